package com.company.energyperformance.exception;

import org.springframework.http.HttpStatus;

/**
 * Enumerated error kinds surfaced to API callers
 */
public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST),
    UNKNOWN_FEATURE(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_DATA(HttpStatus.UNPROCESSABLE_ENTITY),
    QUALITY_GATE_FAILURE(HttpStatus.UNPROCESSABLE_ENTITY),
    NO_ACTIVE_MODEL(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    TRANSIENT_STORE(HttpStatus.SERVICE_UNAVAILABLE),
    DEADLINE_EXCEEDED(HttpStatus.GATEWAY_TIMEOUT),
    CONFLICT(HttpStatus.CONFLICT);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
