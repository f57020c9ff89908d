package com.yamdb.backend.modules.auth.presentation.dto;

import com.yamdb.backend.modules.policy.domain.Role;

public record UserResponse(
        String username,
        String email,
        String firstName,
        String lastName,
        String bio,
        Role role
) {
}
