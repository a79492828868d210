package com.company.energyperformance.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.Instant;

/**
 * Progress of one (tier, entity) refresh lineage
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshWatermark {

    private String tier;
    private String entityId;
    private Instant lastRefreshAt;
    private Instant windowStart;
    private Instant windowEnd;
    // End of the range recomputed without gaps since the lineage started
    private Instant coveredThrough;
    private Instant lastAttemptAt;
    private int consecutiveFailures;
    private String lastError;

    /**
     * Contiguous coverage, falling back to the last window end for rows written before
     * coverage was tracked
     */
    @JsonIgnore
    public Instant contiguousThrough() {
        return coveredThrough != null ? coveredThrough : windowEnd;
    }
}
