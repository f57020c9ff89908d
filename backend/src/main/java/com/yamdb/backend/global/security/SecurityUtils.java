package com.yamdb.backend.global.security;

import com.yamdb.backend.modules.policy.domain.Actor;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Actor for the current request. Requests without a valid bearer token run as anonymous.
     */
    public static Actor currentActor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            return Actor.anonymous();
        }
        return new Actor(principal.userId(), principal.username(), principal.role());
    }
}
