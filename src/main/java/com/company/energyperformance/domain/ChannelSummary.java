package com.company.energyperformance.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.io.Serializable;

/**
 * Mergeable statistics for one channel inside one bucket.
 * Sum and count are kept instead of a mean so that coarser buckets can be
 * derived exactly from finer ones.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelSummary implements Serializable {
    private static final long serialVersionUID = 1L;

    private double sum;
    private long count;
    private double min;
    private double max;

    public static ChannelSummary of(double value) {
        return new ChannelSummary(value, 1, value, value);
    }

    public ChannelSummary merge(ChannelSummary other) {
        if (other == null || other.count == 0) {
            return new ChannelSummary(sum, count, min, max);
        }
        if (count == 0) {
            return new ChannelSummary(other.sum, other.count, other.min, other.max);
        }
        return new ChannelSummary(
                sum + other.sum,
                count + other.count,
                Math.min(min, other.min),
                Math.max(max, other.max));
    }

    @JsonIgnore
    public double mean() {
        return count == 0 ? 0.0 : sum / count;
    }
}
