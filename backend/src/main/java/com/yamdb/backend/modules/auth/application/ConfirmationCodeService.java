package com.yamdb.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.yamdb.backend.global.error.ErrorKind;
import com.yamdb.backend.global.error.ProblemException;
import com.yamdb.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.yamdb.backend.modules.auth.domain.ConfirmationCodeIssuedEvent;
import com.yamdb.backend.modules.auth.domain.YamdbUser;
import com.yamdb.backend.modules.auth.infrastructure.persistence.YamdbUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues single-use numeric codes and trades them for access tokens.
 */
@Service
@Transactional
public class ConfirmationCodeService {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationCodeService.class);
    private static final int CODE_BOUND = 1_000_000;

    private final YamdbUserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration codeTtl;
    private final SecureRandom random = new SecureRandom();

    public ConfirmationCodeService(
            YamdbUserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            ApplicationEventPublisher eventPublisher,
            Clock clock,
            @Value("${app.confirmation.ttl:PT30M}") Duration codeTtl
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.codeTtl = codeTtl;
    }

    public String issueCode(String email, String username) {
        YamdbUser user = userRepository.findByUsernameForUpdate(username)
                .filter(candidate -> candidate.getEmail().equalsIgnoreCase(email))
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "auth.user_not_found", "No account for that email and username"));
        return issueCode(user);
    }

    /**
     * Replaces any pending code on {@code user}. The plain code leaves this method only through the
     * returned value and the delivery event.
     */
    public String issueCode(YamdbUser user) {
        String code = String.format("%06d", random.nextInt(CODE_BOUND));
        user.assignConfirmationCode(passwordEncoder.encode(code), OffsetDateTime.now(clock).plus(codeTtl));
        userRepository.save(user);
        eventPublisher.publishEvent(new ConfirmationCodeIssuedEvent(user.getEmail(), user.getUsername(), code));
        log.info("Issued confirmation code for user {}", user.getUsername());
        return code;
    }

    public IssuedToken exchange(String username, String code) {
        if (username == null || username.isBlank() || code == null || code.isBlank()) {
            throw invalidCode();
        }
        YamdbUser user = userRepository.findByUsernameForUpdate(username.trim())
                .orElseThrow(ConfirmationCodeService::invalidCode);
        if (!user.hasPendingCode()) {
            throw invalidCode();
        }
        OffsetDateTime expiresAt = user.getConfirmationCodeExpiresAt();
        if (expiresAt == null || !expiresAt.isAfter(OffsetDateTime.now(clock))) {
            log.debug("Confirmation code for user {} expired", user.getUsername());
            throw invalidCode();
        }
        if (!passwordEncoder.matches(code.trim(), user.getConfirmationCodeHash())) {
            throw invalidCode();
        }
        user.clearConfirmationCode();
        userRepository.save(user);
        return jwtTokenService.issueAccessToken(user.getId(), user.getUsername(), user.getRole());
    }

    private static ProblemException invalidCode() {
        return new ProblemException(ErrorKind.UNAUTHENTICATED, "auth.invalid_confirmation_code",
                "Username or confirmation code is invalid");
    }
}
