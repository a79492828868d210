package com.company.energyperformance.domain.enums;

public enum AnomalyType {
    BASELINE_DEVIATION("Consumption deviates from the baseline expectation"),
    POWER_ANOMALY("Unusual demand or electrical behaviour"),
    TEMPERATURE_ANOMALY("Unusual temperature"),
    PRESSURE_ANOMALY("Unusual pressure"),
    PRODUCTION_ANOMALY("Unusual production or throughput"),
    FLOW_ANOMALY("Unusual flow rate"),
    OTHER("Unclassified outlier");

    private final String description;

    AnomalyType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
