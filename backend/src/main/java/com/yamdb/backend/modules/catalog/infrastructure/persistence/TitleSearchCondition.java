package com.yamdb.backend.modules.catalog.infrastructure.persistence;

/**
 * Optional title filters. Slug and name filters match case-insensitive substrings; year matches exactly.
 */
public record TitleSearchCondition(String categorySlug, String genreSlug, String name, Integer year) {

    public static TitleSearchCondition none() {
        return new TitleSearchCondition(null, null, null, null);
    }
}
