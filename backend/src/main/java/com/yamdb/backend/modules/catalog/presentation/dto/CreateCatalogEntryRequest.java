package com.yamdb.backend.modules.catalog.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body for creating a category or a genre.
 */
public record CreateCatalogEntryRequest(
        @NotBlank @Size(max = 256) String name,
        @NotBlank @Size(max = 50) String slug
) {
}
