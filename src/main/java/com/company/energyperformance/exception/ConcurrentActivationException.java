package com.company.energyperformance.exception;

import java.util.Map;

/**
 * Compare-and-set on the active model pointer lost against a concurrent swap
 */
public class ConcurrentActivationException extends EnergyPerformanceException {

    public ConcurrentActivationException(String groupId, long expectedPointerVersion) {
        super(ErrorKind.CONFLICT,
                "Active model pointer for group " + groupId + " changed concurrently",
                Map.of("groupId", groupId, "expectedPointerVersion", expectedPointerVersion));
    }
}
