package com.yamdb.backend.global.security;

import java.util.UUID;

import com.yamdb.backend.modules.policy.domain.Role;

public record JwtAuthenticationPrincipal(UUID userId, String username, Role role) {
}
