package com.yamdb.backend.modules.catalog.presentation.dto;

import java.util.Comparator;
import java.util.List;

import com.yamdb.backend.modules.catalog.domain.Category;
import com.yamdb.backend.modules.catalog.domain.Genre;
import com.yamdb.backend.modules.catalog.domain.Title;

public final class CatalogDtoMapper {

    private CatalogDtoMapper() {
    }

    public static CatalogEntryResponse toResponse(Category category) {
        return category == null ? null : new CatalogEntryResponse(category.getName(), category.getSlug());
    }

    public static CatalogEntryResponse toResponse(Genre genre) {
        return new CatalogEntryResponse(genre.getName(), genre.getSlug());
    }

    public static TitleResponse toResponse(Title title) {
        List<CatalogEntryResponse> genres = title.getGenres().stream()
                .sorted(Comparator.comparing(Genre::getSlug))
                .map(CatalogDtoMapper::toResponse)
                .toList();
        return new TitleResponse(
                title.getId(),
                title.getName(),
                title.getYear(),
                title.getDescription(),
                title.getRating(),
                toResponse(title.getCategory()),
                genres
        );
    }
}
