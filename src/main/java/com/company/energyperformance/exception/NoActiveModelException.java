package com.company.energyperformance.exception;

import java.util.Map;

/**
 * The group has no active baseline yet (not onboarded), not a system fault
 */
public class NoActiveModelException extends EnergyPerformanceException {

    public NoActiveModelException(String groupId) {
        super(ErrorKind.NO_ACTIVE_MODEL, "No active baseline model for group " + groupId,
                Map.of("groupId", groupId));
    }
}
