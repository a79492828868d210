package com.company.energyperformance.domain;

import com.company.energyperformance.domain.enums.AnomalyType;
import com.company.energyperformance.domain.enums.ResolutionState;
import com.company.energyperformance.domain.enums.Severity;
import lombok.*;

import java.time.Instant;

/**
 * One detected outlier, unique per (group, timestamp, metric).
 * Only the resolution fields change after creation, and only by operator action.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyFinding {

    private Long findingId;
    private String groupId;
    private String entityId;
    private Instant findingTime;
    private String metric;
    private AnomalyType anomalyType;

    private double actualValue;
    private double expectedValue;
    private double deviation;
    private double zScore;
    private double anomalyScore;
    private double threshold;
    private double confidence;
    private Severity severity;
    private Integer modelVersion;
    private String description;

    @Builder.Default
    private ResolutionState resolutionState = ResolutionState.OPEN;
    private Instant resolvedAt;
    private String resolvedBy;
    private String resolutionNotes;

    private Instant detectedAt;
    private Instant updatedAt;
}
