package com.company.energyperformance.domain;

import com.company.energyperformance.domain.enums.EnergySourceType;
import lombok.*;

import java.io.Serializable;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmissionFactor implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long factorId;
    private String region;
    private EnergySourceType energySourceType;
    private LocalDate validFrom;
    private LocalDate validTo;
    private double factor;

    public boolean appliesOn(LocalDate date) {
        if (validFrom != null && date.isBefore(validFrom)) {
            return false;
        }
        return validTo == null || !date.isAfter(validTo);
    }
}
