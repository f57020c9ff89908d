package com.yamdb.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.NotBlank;

public record TokenRequest(
        @NotBlank String username,
        @NotBlank @JsonAlias("confirmation_code") String confirmationCode
) {
}
