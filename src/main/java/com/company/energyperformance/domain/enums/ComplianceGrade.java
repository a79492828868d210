package com.company.energyperformance.domain.enums;

public enum ComplianceGrade {
    COMPLIANT("Deviation within the compliant band"),
    WARNING("Deviation within the warning band"),
    CRITICAL("Deviation beyond the warning band"),
    UNDETERMINED("Deviation percentage undefined (expected consumption is zero)");

    private final String description;

    ComplianceGrade(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static ComplianceGrade fromString(String grade) {
        if (grade == null) {
            return UNDETERMINED;
        }
        try {
            return ComplianceGrade.valueOf(grade.toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNDETERMINED;
        }
    }
}
