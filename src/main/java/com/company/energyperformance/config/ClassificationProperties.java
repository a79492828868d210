package com.company.energyperformance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "energy.classification")
public class ClassificationProperties {

    /** |deviation%| at or below this is compliant */
    private double compliantPercent = 3.0;

    /** |deviation%| at or below this (and above compliant) is a warning */
    private double warningPercent = 5.0;

    private double warningSigma = 2.0;

    private double criticalSigma = 3.0;

    /** z-value of the uncertainty band around expected consumption (95%) */
    private double bandZ = 1.96;

    private double driftMultiple = 3.0;

    private int driftMinPeriods = 3;
}
