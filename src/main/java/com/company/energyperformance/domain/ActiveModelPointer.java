package com.company.energyperformance.domain;

import lombok.*;

import java.time.Instant;

/**
 * Versioned pointer to the active baseline of a (group, energy source).
 * {@code pointerVersion} increases on every swap and is the compare-and-set token.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveModelPointer {

    private String groupId;
    private String energySourceId;
    private Integer activeVersion;
    private long pointerVersion;
    private Instant updatedAt;
}
