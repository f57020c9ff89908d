package com.yamdb.backend.modules.policy.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Totally ordered privilege levels. {@link #ANONYMOUS} is never persisted on an account.
 */
public enum Role {
    ANONYMOUS(0),
    USER(1),
    MODERATOR(2),
    ADMIN(3);

    private final int rank;

    Role(int rank) {
        this.rank = rank;
    }

    public boolean isAtLeast(Role other) {
        return rank >= other.rank;
    }

    /**
     * Whether an account may hold this role.
     */
    public boolean isAssignable() {
        return this != ANONYMOUS;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromCode(String code) {
        if (code == null) {
            return null;
        }
        try {
            return Role.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown role: " + code, ex);
        }
    }
}
