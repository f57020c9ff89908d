package com.yamdb.backend.modules.auth.presentation;

import com.yamdb.backend.modules.auth.application.AuthService;
import com.yamdb.backend.modules.auth.presentation.dto.SignupRequest;
import com.yamdb.backend.modules.auth.presentation.dto.SignupResponse;
import com.yamdb.backend.modules.auth.presentation.dto.TokenRequest;
import com.yamdb.backend.modules.auth.presentation.dto.TokenResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(
            summary = "Sign up",
            description = """
                    Registers an account and mails a confirmation code. \
                    Repeating the call with the same email and username sends a fresh code.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Code issued"),
            @ApiResponse(responseCode = "400", description = "Invalid input, or email/username already used by another account")
    })
    @PostMapping("/auth/signup")
    public ResponseEntity<SignupResponse> signup(@Valid @RequestBody SignupRequest request) {
        return ResponseEntity.ok(authService.signup(request));
    }

    @Operation(summary = "Exchange confirmation code", description = "Trades a pending confirmation code for a bearer token.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token issued"),
            @ApiResponse(responseCode = "401", description = "Unknown user, missing, expired or wrong code")
    })
    @PostMapping("/auth/token")
    public ResponseEntity<TokenResponse> token(@Valid @RequestBody TokenRequest request) {
        return ResponseEntity.ok(authService.exchange(request));
    }
}
