package com.yamdb.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record UpdateProfileRequest(
        @Size(max = 150) String username,
        @Email @Size(max = 254) String email,
        @Size(max = 150) String firstName,
        @Size(max = 150) String lastName,
        String bio
) {
}
