package com.company.energyperformance.exception;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MissingServletRequestParameterException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void mapsDomainErrorsToTheirKinds() {
        assertStatus(handler.handleDomainError(new InsufficientDataException("compressors", 40, 1000)),
                HttpStatus.UNPROCESSABLE_ENTITY, "INSUFFICIENT_DATA");
        assertStatus(handler.handleDomainError(new NoActiveModelException("compressors")),
                HttpStatus.CONFLICT, "NO_ACTIVE_MODEL");
        assertStatus(handler.handleDomainError(new ResourceNotFoundException("Group", "compressors")),
                HttpStatus.NOT_FOUND, "NOT_FOUND");
        assertStatus(handler.handleDomainError(new DeadlineExceededException("anomaly detection", Duration.ofSeconds(30))),
                HttpStatus.GATEWAY_TIMEOUT, "DEADLINE_EXCEEDED");
    }

    @Test
    void includesStructuredDetails() {
        UnknownFeatureException error = new UnknownFeatureException("electricity",
                List.of("avg_humidity_pct"), List.of("avg_outdoor_temp_c"));

        ResponseEntity<Map<String, Object>> response = handler.handleDomainError(error);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsKey("details");
        assertThat(response.getBody().get("details").toString()).contains("avg_humidity_pct");
    }

    @Test
    void missingParameterIsValidationError() {
        ResponseEntity<Map<String, Object>> response = handler.handleMissingParameter(
                new MissingServletRequestParameterException("start", "Instant"));

        assertStatus(response, HttpStatus.BAD_REQUEST, "VALIDATION");
    }

    @Test
    void storageFailureIsTransient() {
        ResponseEntity<Map<String, Object>> response = handler.handleDataAccess(
                new DataAccessResourceFailureException("connection refused"));

        assertStatus(response, HttpStatus.SERVICE_UNAVAILABLE, "TRANSIENT_STORE");
        assertThat(response.getBody().get("message")).isEqualTo("Storage temporarily unavailable");
    }

    @Test
    void accessDeniedIsForbidden() {
        ResponseEntity<Map<String, Object>> response = handler.handleAccessDenied(new AccessDeniedException("no"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    void unexpectedErrorsHideInternals() {
        ResponseEntity<Map<String, Object>> response = handler.handleGenericException(
                new IllegalStateException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().get("message")).isEqualTo("An unexpected error occurred");
    }

    private static void assertStatus(ResponseEntity<Map<String, Object>> response, HttpStatus status, String kind) {
        assertThat(response.getStatusCode()).isEqualTo(status);
        assertThat(response.getBody()).containsEntry("status", status.value()).containsEntry("kind", kind);
    }
}
