package com.yamdb.backend.modules.auth.presentation.dto;

public record TokenResponse(
        String token,
        String tokenType,
        long expiresIn,
        String username
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
