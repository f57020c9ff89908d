package com.yamdb.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

class RestExceptionHandlerTest {

    private final RestExceptionHandler handler = new RestExceptionHandler();
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/titles");

    @Test
    void problemKeepsKindAndCode() {
        ResponseEntity<ProblemResponse> response = handler.handleProblemException(
                new ProblemException(ErrorKind.CONFLICT, "review.already_exists", "You have already reviewed this title"),
                request
        );

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().code()).isEqualTo("review.already_exists");
        assertThat(response.getBody().instance()).isEqualTo("/titles");
    }

    @Test
    void storageOutageAdvertisesRetry() {
        ResponseEntity<ProblemResponse> response = handler.handleStorageUnavailable(new QueryTimeoutException("lock wait"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER))
                .isEqualTo(String.valueOf(RestExceptionHandler.STORAGE_RETRY_AFTER_SECONDS));
        assertThat(response.getBody().code()).isEqualTo("storage_unavailable");
    }

    @Test
    void integrityViolationDoesNotLeakSql() {
        DataIntegrityViolationException ex = new DataIntegrityViolationException("could not execute statement",
                new SQLException("duplicate key value violates unique constraint \"uq_category_slug\""));

        ResponseEntity<ProblemResponse> response = handler.handleIntegrityViolation(ex, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().detail()).doesNotContain("uq_category_slug");
    }

    @Test
    void unexpectedErrorIsGeneric() {
        ResponseEntity<ProblemResponse> response = handler.handleGenericException(new IllegalStateException("secret internals"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().code()).isEqualTo("internal_error");
        assertThat(response.getBody().detail()).doesNotContain("secret internals");
    }
}
