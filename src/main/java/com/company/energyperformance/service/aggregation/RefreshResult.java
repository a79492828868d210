package com.company.energyperformance.service.aggregation;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Builder
@ToString
public class RefreshResult {

    private final String tier;
    private final String entityId;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final int rowsComputed;
    private final int rowsWritten;
    private final int rowsDeleted;
    private final boolean skipped;
}
