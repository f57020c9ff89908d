package com.yamdb.backend.modules.catalog.presentation.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Rating and category are written as null rather than omitted.
 */
public record TitleResponse(
        UUID id,
        String name,
        int year,
        String description,
        @JsonInclude(JsonInclude.Include.ALWAYS) BigDecimal rating,
        @JsonInclude(JsonInclude.Include.ALWAYS) CatalogEntryResponse category,
        List<CatalogEntryResponse> genres
) {
}
