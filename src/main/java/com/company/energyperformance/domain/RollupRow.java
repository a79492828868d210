package com.company.energyperformance.domain;

import com.company.energyperformance.domain.enums.ReadingChannel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One (tier, entity, bucket) aggregate
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RollupRow {

    private String tier;
    private String entityId;
    private Instant bucketStart;
    private Instant bucketEnd;
    private long sampleCount;
    @Builder.Default
    private Map<ReadingChannel, ChannelSummary> channels = new EnumMap<>(ReadingChannel.class);
    private Instant refreshedAt;

    @JsonIgnore
    public ChannelSummary channel(ReadingChannel channel) {
        return channels == null ? null : channels.get(channel);
    }

    @JsonIgnore
    public Double sum(ReadingChannel channel) {
        ChannelSummary summary = channel(channel);
        return summary == null ? null : summary.getSum();
    }

    @JsonIgnore
    public Double mean(ReadingChannel channel) {
        ChannelSummary summary = channel(channel);
        return summary == null || summary.getCount() == 0 ? null : summary.mean();
    }

    @JsonIgnore
    public Double max(ReadingChannel channel) {
        ChannelSummary summary = channel(channel);
        return summary == null ? null : summary.getMax();
    }

    @JsonIgnore
    public Double min(ReadingChannel channel) {
        ChannelSummary summary = channel(channel);
        return summary == null ? null : summary.getMin();
    }

    /**
     * Content equality, ignoring the refresh timestamp
     */
    public boolean sameContentAs(RollupRow other) {
        if (other == null) {
            return false;
        }
        return Objects.equals(tier, other.tier)
                && Objects.equals(entityId, other.entityId)
                && Objects.equals(bucketStart, other.bucketStart)
                && Objects.equals(bucketEnd, other.bucketEnd)
                && sampleCount == other.sampleCount
                && Objects.equals(channels, other.channels);
    }
}
