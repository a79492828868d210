package com.company.energyperformance.domain;

import com.company.energyperformance.domain.enums.ReadingChannel;
import lombok.*;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable observation for one entity at one timestamp
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawReading {

    private String entityId;
    private Instant timestamp;
    @Builder.Default
    private Map<ReadingChannel, Double> values = new EnumMap<>(ReadingChannel.class);
}
