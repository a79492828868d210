package com.company.energyperformance.service.anomaly;

import com.company.energyperformance.domain.AnomalyFinding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyDetectionResult {
    private String groupId;
    private Integer modelVersion;
    private String tier;
    private Instant windowStart;
    private Instant windowEnd;
    private DetectionOutcome.ReferenceSource referenceSource;
    private int referenceSize;
    private double threshold;
    private double contamination;
    private int bucketsScored;
    private int bucketsSkipped;
    private int findingsCreated;
    private int findingsUpdated;
    private int findingsUnchanged;
    @Builder.Default
    private List<AnomalyFinding> findings = new ArrayList<>();
}
