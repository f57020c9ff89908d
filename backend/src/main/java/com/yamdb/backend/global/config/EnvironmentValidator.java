package com.yamdb.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "dev-jwt-secret-key-change-in-production-yamdb";
    private static final int MIN_SECRET_BYTES = 32;
    private static final long MIN_EXPIRATION_MILLIS = 300_000L;
    private static final long MAX_EXPIRATION_MILLIS = 86_400_000L;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        String[] requiredVars = {
                "spring.datasource.url",
                "jwt.secret",
                "jwt.expiration",
                "app.cors.allowed-origins"
        };
        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(var + " is required");
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        if (jwtSecret.filter(DEV_JWT_SECRET::equals).isPresent()) {
            problems.add("jwt.secret still has the development default");
        } else if (jwtSecret.filter(secret -> secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES).isPresent()) {
            problems.add("jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }

        Optional<String> jwtExpiration = Optional.ofNullable(environment.getProperty("jwt.expiration"));
        if (jwtExpiration.isPresent()) {
            try {
                long expiration = Long.parseLong(jwtExpiration.get().trim());
                if (expiration < MIN_EXPIRATION_MILLIS || expiration > MAX_EXPIRATION_MILLIS) {
                    problems.add("jwt.expiration must be between " + MIN_EXPIRATION_MILLIS + " and " + MAX_EXPIRATION_MILLIS + " ms");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be a number");
            }
        }

        Optional<String> codeTtl = Optional.ofNullable(environment.getProperty("app.confirmation.ttl"));
        if (codeTtl.isPresent()) {
            try {
                Duration ttl = Duration.parse(codeTtl.get().trim());
                if (ttl.isNegative() || ttl.isZero()) {
                    problems.add("app.confirmation.ttl must be positive");
                }
            } catch (DateTimeParseException e) {
                problems.add("app.confirmation.ttl must be an ISO-8601 duration");
            }
        }
        return problems;
    }
}
