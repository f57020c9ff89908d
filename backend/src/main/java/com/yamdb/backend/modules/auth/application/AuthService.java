package com.yamdb.backend.modules.auth.application;

import java.util.Optional;

import com.yamdb.backend.global.error.ErrorKind;
import com.yamdb.backend.global.error.ProblemException;
import com.yamdb.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.yamdb.backend.modules.auth.domain.AccountRules;
import com.yamdb.backend.modules.auth.domain.YamdbUser;
import com.yamdb.backend.modules.auth.infrastructure.persistence.YamdbUserRepository;
import com.yamdb.backend.modules.auth.presentation.dto.SignupRequest;
import com.yamdb.backend.modules.auth.presentation.dto.SignupResponse;
import com.yamdb.backend.modules.auth.presentation.dto.TokenRequest;
import com.yamdb.backend.modules.auth.presentation.dto.TokenResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private final YamdbUserRepository userRepository;
    private final AccountService accountService;
    private final ConfirmationCodeService confirmationCodeService;

    public AuthService(
            YamdbUserRepository userRepository,
            AccountService accountService,
            ConfirmationCodeService confirmationCodeService
    ) {
        this.userRepository = userRepository;
        this.accountService = accountService;
        this.confirmationCodeService = confirmationCodeService;
    }

    /**
     * Registers a new account, or re-sends a code when the exact (email, username) pair already exists.
     */
    public SignupResponse signup(SignupRequest request) {
        String email = AccountRules.requireValidEmail(request.email());
        String username = AccountRules.requireValidUsername(request.username());

        Optional<YamdbUser> byUsername = userRepository.findByUsername(username);
        Optional<YamdbUser> byEmail = userRepository.findByEmailIgnoreCase(email);

        if (byUsername.isPresent() && byEmail.isPresent() && byUsername.get().getId().equals(byEmail.get().getId())) {
            confirmationCodeService.issueCode(byUsername.get());
            return new SignupResponse(email, username);
        }
        if (byUsername.isPresent()) {
            throw new ProblemException(ErrorKind.VALIDATION, "auth.username_taken", "Username is registered with another email");
        }
        if (byEmail.isPresent()) {
            throw new ProblemException(ErrorKind.VALIDATION, "auth.email_taken", "Email is registered with another username");
        }
        YamdbUser user = accountService.register(email, username);
        return new SignupResponse(user.getEmail(), user.getUsername());
    }

    public TokenResponse exchange(TokenRequest request) {
        IssuedToken token = confirmationCodeService.exchange(request.username(), request.confirmationCode());
        return new TokenResponse(
                token.token(),
                TokenResponse.DEFAULT_TOKEN_TYPE,
                token.expiresInSeconds(),
                request.username().trim()
        );
    }
}
