package com.company.energyperformance.event;

import com.company.energyperformance.domain.SignificantUseGroup;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class GroupRegisteredEvent {
    private final SignificantUseGroup group;
}
