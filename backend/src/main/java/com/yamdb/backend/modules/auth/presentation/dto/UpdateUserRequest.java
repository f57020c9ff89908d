package com.yamdb.backend.modules.auth.presentation.dto;

import com.yamdb.backend.modules.policy.domain.Role;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateUserRequest(
        @Size(max = 150) String username,
        @Email @Size(max = 254) String email,
        @Size(max = 150) String firstName,
        @Size(max = 150) String lastName,
        String bio,
        Role role
) {
}
