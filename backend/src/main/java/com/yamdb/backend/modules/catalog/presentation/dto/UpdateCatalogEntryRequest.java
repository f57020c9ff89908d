package com.yamdb.backend.modules.catalog.presentation.dto;

import jakarta.validation.constraints.Size;

public record UpdateCatalogEntryRequest(
        @Size(max = 256) String name,
        @Size(max = 50) String slug
) {
}
