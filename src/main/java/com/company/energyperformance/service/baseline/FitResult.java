package com.company.energyperformance.service.baseline;

import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder
public class FitResult {
    private final double intercept;
    private final boolean interceptIncluded;
    @Builder.Default
    private final Map<String, Double> coefficients = new LinkedHashMap<>();
    @Builder.Default
    private final Map<String, Double> pValues = new LinkedHashMap<>();
    private final int sampleCount;
    private final double rSquared;
    private final double adjustedRSquared;
    private final double rmse;
    private final double mae;
}
