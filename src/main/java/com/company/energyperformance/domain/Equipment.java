package com.company.energyperformance.domain;

import lombok.*;

import java.io.Serializable;
import java.time.Instant;

/**
 * A monitored piece of equipment (an entity in the raw store)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Equipment implements Serializable {
    private static final long serialVersionUID = 1L;

    private String entityId;
    private String name;
    private String equipmentType;
    private Double ratedCapacityKw;
    private Boolean active;
    private Instant createdAt;
}
