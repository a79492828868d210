package com.company.energyperformance.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of all domain errors. Carries an {@link ErrorKind} and structured details.
 */
public abstract class EnergyPerformanceException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    protected EnergyPerformanceException(ErrorKind kind, String message) {
        this(kind, message, Collections.emptyMap(), null);
    }

    protected EnergyPerformanceException(ErrorKind kind, String message, Map<String, Object> details) {
        this(kind, message, details, null);
    }

    protected EnergyPerformanceException(ErrorKind kind, String message,
                                         Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = new LinkedHashMap<>(details);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }
}
