package com.company.energyperformance.exception;

import java.util.Map;

public class InsufficientDataException extends EnergyPerformanceException {

    private final int samplesFound;
    private final int samplesRequired;

    public InsufficientDataException(String groupId, int samplesFound, int samplesRequired) {
        super(ErrorKind.INSUFFICIENT_DATA,
                String.format("Insufficient data for group %s: %d samples found, %d required",
                        groupId, samplesFound, samplesRequired),
                Map.of("samples_found", samplesFound, "samples_required", samplesRequired));
        this.samplesFound = samplesFound;
        this.samplesRequired = samplesRequired;
    }

    public int getSamplesFound() {
        return samplesFound;
    }

    public int getSamplesRequired() {
        return samplesRequired;
    }
}
