package com.yamdb.backend.modules.catalog.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Category and genres are referenced by slug.
 */
public record CreateTitleRequest(
        @NotBlank @Size(max = 256) String name,
        @NotNull Integer year,
        String description,
        String category,
        @NotEmpty @JsonAlias("genre") List<String> genres
) {
}
