package com.company.energyperformance.exception;

import java.util.List;
import java.util.Map;

public class UnknownFeatureException extends ValidationException {

    private final List<String> unknownFeatures;

    public UnknownFeatureException(String energySource, List<String> unknownFeatures, List<String> allowedFeatures) {
        super(ErrorKind.UNKNOWN_FEATURE,
                "Unknown feature(s) for energy source " + energySource + ": " + String.join(", ", unknownFeatures),
                Map.of("unknownFeatures", List.copyOf(unknownFeatures),
                        "allowedFeatures", List.copyOf(allowedFeatures)));
        this.unknownFeatures = List.copyOf(unknownFeatures);
    }

    public List<String> getUnknownFeatures() {
        return unknownFeatures;
    }
}
