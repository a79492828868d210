package com.company.energyperformance.event;

import com.company.energyperformance.domain.AnomalyFinding;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AnomalyDetectedEvent {
    private final AnomalyFinding finding;
}
