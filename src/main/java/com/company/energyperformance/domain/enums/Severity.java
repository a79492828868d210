package com.company.energyperformance.domain.enums;

/**
 * Shared severity vocabulary for deviation grading and anomaly findings.
 */
public enum Severity {
    NORMAL,
    WARNING,
    CRITICAL;

    public static Severity fromString(String severity) {
        if (severity == null) {
            return NORMAL;
        }
        try {
            return Severity.valueOf(severity.toUpperCase());
        } catch (IllegalArgumentException e) {
            return NORMAL;
        }
    }
}
