package com.company.energyperformance.service.baseline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Parameters of one training run. Null options fall back to the configured defaults and, for
 * features, to the default set of the group's energy source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingCommand {
    private String groupId;
    private Instant windowStart;
    private Instant windowEnd;
    private List<String> features;
    private String tier;
    private Integer minSamples;
    private Double minRSquared;
    @Builder.Default
    private boolean includeIntercept = true;
    private String trainedBy;
}
