package com.company.energyperformance.service.aggregation;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Half-open bucket range [start, end) recomputed by one refresh
 */
@Getter
@AllArgsConstructor
@ToString
@EqualsAndHashCode
public class RefreshWindow {

    private final Instant start;
    private final Instant end;

    public boolean isEmpty() {
        return !start.isBefore(end);
    }

    public RefreshWindow clipEnd(Instant limit) {
        if (limit == null || !limit.isBefore(end)) {
            return this;
        }
        return new RefreshWindow(start, limit.isBefore(start) ? start : limit);
    }
}
