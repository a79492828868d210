package com.company.energyperformance.domain;

import com.company.energyperformance.domain.enums.OperationalState;
import lombok.*;

import java.time.Instant;

/**
 * Operational state of an entity between two instants. An open interval has no end.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateInterval {

    private String entityId;
    private OperationalState state;
    private Instant startedAt;
    private Instant endedAt;

    public boolean overlaps(Instant start, Instant end) {
        boolean startsBeforeEnd = startedAt.isBefore(end);
        boolean endsAfterStart = endedAt == null || endedAt.isAfter(start);
        return startsBeforeEnd && endsAfterStart;
    }
}
