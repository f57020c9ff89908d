package com.yamdb.backend.modules.auth.presentation.dto;

public record SignupResponse(String email, String username) {
}
