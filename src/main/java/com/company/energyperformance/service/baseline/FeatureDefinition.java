package com.company.energyperformance.service.baseline;

import com.company.energyperformance.domain.RollupRow;
import com.company.energyperformance.domain.enums.FeatureAggregation;
import com.company.energyperformance.domain.enums.ReadingChannel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A named regression input computed from one bucket of a group series
 */
@Getter
@Builder
@ToString
public class FeatureDefinition {

    private final String name;
    private final ReadingChannel channel;
    private final FeatureAggregation aggregation;
    private final DerivedFeature derived;
    private final String description;
    private final boolean regressionEligible;

    /**
     * Value of the feature for one bucket, null when the bucket lacks the underlying channel
     */
    public Double extract(RollupRow row, double ratedCapacityKw) {
        switch (aggregation) {
            case SUM:
                return row.sum(channel);
            case AVG:
                return row.mean(channel);
            case MAX:
                return row.max(channel);
            case MIN:
                return row.min(channel);
            case CUSTOM:
                return derived.extract(row, ratedCapacityKw);
            default:
                throw new IllegalStateException("Unsupported aggregation " + aggregation);
        }
    }
}
