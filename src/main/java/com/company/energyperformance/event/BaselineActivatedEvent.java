package com.company.energyperformance.event;

import com.company.energyperformance.domain.BaselineModel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Published after the active pointer of a (group, energy source) moved. {@code model} is the
 * newly active model, or the deactivated one when {@code activated} is false.
 */
@Getter
@AllArgsConstructor
public class BaselineActivatedEvent {
    private final BaselineModel model;
    private final boolean activated;
}
