package com.company.energyperformance.domain;

import lombok.*;

/**
 * Baseline prediction. Negative raw values are clamped to zero and flagged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Prediction {

    private String groupId;
    private Integer modelVersion;
    private double value;
    private double rawValue;
    private boolean clamped;
    private String unit;
}
