package com.company.energyperformance.service.aggregation;

import com.company.energyperformance.domain.RollupRow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Rows of one series plus the stale-data warning. {@code staleFrom} is the first instant of the
 * range that may still change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RollupQueryResult {
    private String seriesId;
    private String tier;
    private Instant start;
    private Instant end;
    @Builder.Default
    private List<RollupRow> rows = new ArrayList<>();
    private boolean staleData;
    private Instant staleFrom;
}
