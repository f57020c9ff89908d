package com.yamdb.backend.modules.auth.presentation.dto;

import com.yamdb.backend.modules.policy.domain.Role;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @NotBlank @Size(max = 150) String username,
        @NotBlank @Email @Size(max = 254) String email,
        @Size(max = 150) String firstName,
        @Size(max = 150) String lastName,
        String bio,
        Role role
) {
}
