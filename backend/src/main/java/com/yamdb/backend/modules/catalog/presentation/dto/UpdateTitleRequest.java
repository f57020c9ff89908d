package com.yamdb.backend.modules.catalog.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateTitleRequest(
        @Size(max = 256) String name,
        Integer year,
        String description,
        String category,
        @JsonAlias("genre") List<String> genres
) {
}
