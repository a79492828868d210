package com.company.energyperformance.domain.enums;

public enum FeatureAggregation {
    SUM,
    AVG,
    MAX,
    MIN,
    CUSTOM
}
