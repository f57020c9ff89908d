package com.yamdb.backend.modules.catalog.domain;

import java.util.regex.Pattern;

import com.yamdb.backend.global.error.ErrorKind;
import com.yamdb.backend.global.error.ProblemException;

public final class CatalogRules {

    public static final int NAME_MAX_LENGTH = 256;
    public static final int SLUG_MAX_LENGTH = 50;

    private static final Pattern SLUG_PATTERN = Pattern.compile("^[-a-zA-Z0-9_]+$");

    private CatalogRules() {
    }

    public static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ProblemException(ErrorKind.VALIDATION, "catalog.name_required", "name is required");
        }
        String value = name.trim();
        if (value.length() > NAME_MAX_LENGTH) {
            throw new ProblemException(ErrorKind.VALIDATION, "catalog.name_too_long",
                    "name must be at most " + NAME_MAX_LENGTH + " characters");
        }
        return value;
    }

    public static String requireSlug(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new ProblemException(ErrorKind.VALIDATION, "catalog.slug_required", "slug is required");
        }
        String value = slug.trim();
        if (value.length() > SLUG_MAX_LENGTH || !SLUG_PATTERN.matcher(value).matches()) {
            throw new ProblemException(ErrorKind.VALIDATION, "catalog.slug_invalid",
                    "slug must be 1-" + SLUG_MAX_LENGTH + " characters of letters, digits, '-' or '_'");
        }
        return value;
    }
}
