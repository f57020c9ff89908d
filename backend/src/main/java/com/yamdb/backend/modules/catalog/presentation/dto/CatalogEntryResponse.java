package com.yamdb.backend.modules.catalog.presentation.dto;

public record CatalogEntryResponse(String name, String slug) {
}
