package com.yamdb.backend.modules.policy.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity on whose behalf an operation runs. Anonymous actors have no user id.
 */
public record Actor(UUID userId, String username, Role role) {

    private static final Actor ANONYMOUS = new Actor(null, null, Role.ANONYMOUS);

    public Actor {
        Objects.requireNonNull(role, "role");
        if (role == Role.ANONYMOUS && userId != null) {
            throw new IllegalArgumentException("Anonymous actor cannot carry a user id");
        }
        if (role != Role.ANONYMOUS && userId == null) {
            throw new IllegalArgumentException("Authenticated actor requires a user id");
        }
    }

    public static Actor anonymous() {
        return ANONYMOUS;
    }

    public boolean isAnonymous() {
        return role == Role.ANONYMOUS;
    }

    public boolean owns(UUID authorId) {
        return userId != null && userId.equals(authorId);
    }
}
