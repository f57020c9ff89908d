package com.yamdb.backend.modules.auth.domain;

import java.util.Locale;
import java.util.regex.Pattern;

import com.yamdb.backend.global.error.ErrorKind;
import com.yamdb.backend.global.error.ProblemException;

/**
 * Format checks shared by signup, admin user management and profile edits.
 */
public final class AccountRules {

    public static final int USERNAME_MAX_LENGTH = 150;
    public static final int EMAIL_MAX_LENGTH = 254;
    public static final int NAME_MAX_LENGTH = 150;
    public static final String RESERVED_USERNAME = "me";

    private static final Pattern USERNAME_PATTERN =
            Pattern.compile("^[\\w.@+-]+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private AccountRules() {
    }

    public static String requireValidUsername(String username) {
        if (username == null || username.isBlank()) {
            throw invalid("auth.username_required", "username is required");
        }
        String value = username.trim();
        if (value.length() > USERNAME_MAX_LENGTH) {
            throw invalid("auth.username_too_long", "username must be at most " + USERNAME_MAX_LENGTH + " characters");
        }
        if (!USERNAME_PATTERN.matcher(value).matches()) {
            throw invalid("auth.username_invalid", "username may contain only letters, digits and . @ + - _");
        }
        if (RESERVED_USERNAME.equalsIgnoreCase(value)) {
            throw invalid("auth.username_reserved", "username 'me' is reserved");
        }
        return value;
    }

    /**
     * Returns the email trimmed and lower-cased; uniqueness is case-insensitive.
     */
    public static String requireValidEmail(String email) {
        if (email == null || email.isBlank()) {
            throw invalid("auth.email_required", "email is required");
        }
        String value = email.trim().toLowerCase(Locale.ROOT);
        if (value.length() > EMAIL_MAX_LENGTH) {
            throw invalid("auth.email_too_long", "email must be at most " + EMAIL_MAX_LENGTH + " characters");
        }
        if (!EMAIL_PATTERN.matcher(value).matches()) {
            throw invalid("auth.email_invalid", "email is not a valid address");
        }
        return value;
    }

    public static String optionalName(String field, String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() > NAME_MAX_LENGTH) {
            throw invalid("auth." + field + "_too_long", field + " must be at most " + NAME_MAX_LENGTH + " characters");
        }
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static ProblemException invalid(String code, String detail) {
        return new ProblemException(ErrorKind.VALIDATION, code, detail);
    }
}
