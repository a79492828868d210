package com.company.energyperformance.domain;

import com.company.energyperformance.domain.enums.ComplianceGrade;
import com.company.energyperformance.domain.enums.Severity;
import lombok.*;

import java.time.Instant;

/**
 * Actual versus expected consumption of one group over one reporting period
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceRecord {

    private Long recordId;
    private String groupId;
    private String energySourceId;
    private Instant periodStart;
    private Instant periodEnd;
    private String periodLabel;
    private Integer modelVersion;
    private String modelTier;
    private String actualTier;

    private double actualConsumption;
    private double expectedConsumption;
    private double deviation;
    private Double deviationPercent;
    private double lowerBound;
    private double upperBound;
    private boolean statisticallySignificant;

    private double cumulativeDeviation;
    private Long trendSegmentId;
    private boolean sustainedDrift;

    private ComplianceGrade grade;
    private Severity statisticalSeverity;
    private Double deviationCost;

    private int bucketsPredicted;
    private int bucketsMissingFeatures;
    private int negativePredictionsClamped;

    private boolean finalized;
    private boolean staleData;
    private Instant generatedAt;
}
