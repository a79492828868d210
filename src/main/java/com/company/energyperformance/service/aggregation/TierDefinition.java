package com.company.energyperformance.service.aggregation;

import com.company.energyperformance.config.AggregationProperties;
import com.company.energyperformance.util.TimeUtils;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * One node of the rollup graph
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class TierDefinition {

    private final String name;
    private final String source;
    private final Duration bucketWidth;
    private final Duration refreshInterval;
    private final Duration settle;
    private final Duration lookback;
    private final Duration retention;
    private final Duration maxCatchUp;

    public boolean readsRaw() {
        return AggregationProperties.RAW_SOURCE.equals(source);
    }

    /**
     * Buckets recomputed by a refresh at {@code now}: [now - lookback, now - settle] snapped to
     * bucket boundaries, end exclusive.
     */
    public RefreshWindow refreshWindow(Instant now) {
        Instant start = TimeUtils.floorToBucket(now.minus(lookback), bucketWidth);
        Instant end = TimeUtils.floorToBucket(now.minus(settle), bucketWidth);
        return new RefreshWindow(start, end);
    }

    /**
     * Like {@link #refreshWindow(Instant)}, but when the contiguous coverage of the lineage ends
     * before the regular window the refresh starts there instead, spanning at most the catch-up
     * limit. Buckets skipped by missed refreshes are therefore always computed before they can
     * count as finalized.
     */
    public RefreshWindow refreshWindow(Instant now, Instant coveredThrough) {
        RefreshWindow regular = refreshWindow(now);
        if (coveredThrough == null || !coveredThrough.isBefore(regular.getStart())) {
            return regular;
        }
        Instant start = TimeUtils.floorToBucket(coveredThrough, bucketWidth);
        Instant limit = TimeUtils.floorToBucket(start.plus(catchUpSpan()), bucketWidth);
        return new RefreshWindow(start, TimeUtils.earliest(limit, regular.getEnd()));
    }

    public Duration catchUpSpan() {
        return maxCatchUp != null ? maxCatchUp : lookback.multipliedBy(4);
    }

    /**
     * Start of the provisional range: buckets at or after this instant may still change
     */
    public Instant provisionalFrom(Instant now) {
        return TimeUtils.floorToBucket(now.minus(settle), bucketWidth);
    }

    public Instant bucketEnd(Instant bucketStart) {
        return bucketStart.plus(bucketWidth);
    }

    public static TierDefinition from(AggregationProperties.TierSpec spec) {
        return TierDefinition.builder()
                .name(spec.getName())
                .source(spec.getSource() == null ? AggregationProperties.RAW_SOURCE : spec.getSource())
                .bucketWidth(spec.getBucketWidth())
                .refreshInterval(spec.getRefreshInterval() != null ? spec.getRefreshInterval() : spec.getBucketWidth())
                .settle(spec.getSettle() != null ? spec.getSettle() : spec.getBucketWidth())
                .lookback(spec.getLookback())
                .retention(spec.getRetention())
                .maxCatchUp(spec.getMaxCatchUp())
                .build();
    }
}
