package com.company.energyperformance.exception;

import java.util.Map;

public class FindingAlreadyResolvedException extends EnergyPerformanceException {

    public FindingAlreadyResolvedException(long findingId) {
        super(ErrorKind.CONFLICT, "Anomaly finding " + findingId + " is already resolved",
                Map.of("findingId", findingId));
    }
}
