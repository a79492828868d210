package com.company.energyperformance.domain;

import lombok.*;

import java.time.Instant;

/**
 * Explicit baseline adjustment (equipment upgrade, process change).
 * Starts a new cumulative-deviation segment from {@code effectiveAt}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselineAdjustment {

    private Long adjustmentId;
    private String groupId;
    private Instant effectiveAt;
    private String reason;
    private String recordedBy;
    private Instant recordedAt;
}
