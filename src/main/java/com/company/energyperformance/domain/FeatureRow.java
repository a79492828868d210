package com.company.energyperformance.domain;

import com.company.energyperformance.domain.enums.OperationalState;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Feature values and consumption of one group bucket, ready for fitting or prediction.
 * A null feature value means the bucket lacked the underlying channel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureRow {

    private Instant bucketStart;
    private Instant bucketEnd;
    @Builder.Default
    private Map<String, Double> features = new LinkedHashMap<>();
    private Double consumption;
    // Set when a member was in an excluded operational state during the bucket
    private OperationalState excludedState;
    // Group members without a rollup row in this bucket
    private int missingMembers;

    /**
     * Every feature value present and every group member contributed to the bucket
     */
    @JsonIgnore
    public boolean hasAllFeatures() {
        return missingMembers == 0
                && features.values().stream().allMatch(v -> v != null && Double.isFinite(v));
    }

    /**
     * Usable as a training sample: representative state and every value present
     */
    @JsonIgnore
    public boolean isUsable() {
        return excludedState == null && consumption != null && hasAllFeatures();
    }
}
