package com.company.energyperformance.service.aggregation;

import com.company.energyperformance.domain.ChannelSummary;
import com.company.energyperformance.domain.RawReading;
import com.company.energyperformance.domain.RollupRow;
import com.company.energyperformance.domain.enums.ReadingChannel;
import com.company.energyperformance.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Pure bucket arithmetic. Inputs are sorted before folding so that equal inputs always
 * produce equal rows regardless of the order the store returned them in.
 */
@Component
public class RollupCalculator {

    /**
     * Buckets of {@code tier} in [windowStart, windowEnd) built from raw readings.
     * Duplicate deliveries of the same (timestamp, channel) count once.
     */
    public List<RollupRow> fromRaw(TierDefinition tier, String entityId, List<RawReading> readings,
                                   Instant windowStart, Instant windowEnd) {
        SortedMap<Instant, Map<ReadingChannel, Double>> byTime = new TreeMap<>();
        for (RawReading reading : readings) {
            Instant ts = reading.getTimestamp();
            if (ts.isBefore(windowStart) || !ts.isBefore(windowEnd)) {
                continue;
            }
            Map<ReadingChannel, Double> values = byTime.computeIfAbsent(ts, t -> new EnumMap<>(ReadingChannel.class));
            reading.getValues().forEach((channel, value) -> {
                if (value != null && Double.isFinite(value)) {
                    values.putIfAbsent(channel, value);
                }
            });
        }

        SortedMap<Instant, RollupRow> buckets = new TreeMap<>();
        byTime.forEach((ts, values) -> {
            Instant bucketStart = TimeUtils.floorToBucket(ts, tier.getBucketWidth());
            RollupRow row = buckets.computeIfAbsent(bucketStart, b -> emptyRow(tier, entityId, b));
            row.setSampleCount(row.getSampleCount() + 1);
            values.forEach((channel, value) ->
                    row.getChannels().merge(channel, ChannelSummary.of(value), ChannelSummary::merge));
        });
        return new ArrayList<>(buckets.values());
    }

    /**
     * Buckets of {@code tier} built only from rows of its source tier
     */
    public List<RollupRow> fromFiner(TierDefinition tier, String entityId, List<RollupRow> finerRows,
                                     Instant windowStart, Instant windowEnd) {
        List<RollupRow> sorted = new ArrayList<>(finerRows);
        sorted.sort(Comparator.comparing(RollupRow::getBucketStart));

        SortedMap<Instant, RollupRow> buckets = new TreeMap<>();
        for (RollupRow fine : sorted) {
            if (fine.getBucketStart().isBefore(windowStart) || !fine.getBucketStart().isBefore(windowEnd)) {
                continue;
            }
            Instant bucketStart = TimeUtils.floorToBucket(fine.getBucketStart(), tier.getBucketWidth());
            RollupRow row = buckets.computeIfAbsent(bucketStart, b -> emptyRow(tier, entityId, b));
            absorb(row, fine);
        }
        return new ArrayList<>(buckets.values());
    }

    /**
     * Per-bucket merge of several entities' rows into one series keyed by {@code seriesId}
     */
    public List<RollupRow> mergeSeries(String seriesId, List<RollupRow> rows) {
        List<RollupRow> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparing(RollupRow::getBucketStart).thenComparing(RollupRow::getEntityId));

        SortedMap<Instant, RollupRow> buckets = new TreeMap<>();
        for (RollupRow row : sorted) {
            RollupRow merged = buckets.computeIfAbsent(row.getBucketStart(), b -> RollupRow.builder()
                    .tier(row.getTier())
                    .entityId(seriesId)
                    .bucketStart(b)
                    .bucketEnd(row.getBucketEnd())
                    .channels(new EnumMap<>(ReadingChannel.class))
                    .build());
            absorb(merged, row);
        }
        return new ArrayList<>(buckets.values());
    }

    private void absorb(RollupRow target, RollupRow source) {
        target.setSampleCount(target.getSampleCount() + source.getSampleCount());
        source.getChannels().forEach((channel, summary) ->
                target.getChannels().merge(channel, summary, ChannelSummary::merge));
    }

    private RollupRow emptyRow(TierDefinition tier, String entityId, Instant bucketStart) {
        return RollupRow.builder()
                .tier(tier.getName())
                .entityId(entityId)
                .bucketStart(bucketStart)
                .bucketEnd(tier.bucketEnd(bucketStart))
                .channels(new EnumMap<>(ReadingChannel.class))
                .build();
    }
}
