package com.company.energyperformance.exception;

import java.util.Map;

public class ValidationException extends EnergyPerformanceException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorKind.VALIDATION, message, details);
    }

    protected ValidationException(ErrorKind kind, String message, Map<String, Object> details) {
        super(kind, message, details);
    }
}
