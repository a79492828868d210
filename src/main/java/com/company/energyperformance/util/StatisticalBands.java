package com.company.energyperformance.util;

import com.company.energyperformance.config.ClassificationProperties;
import com.company.energyperformance.domain.enums.Severity;

/**
 * Sigma bands shared by deviation grading and anomaly severity
 */
public class StatisticalBands {

    private final double warningSigma;
    private final double criticalSigma;

    public StatisticalBands(double warningSigma, double criticalSigma) {
        if (warningSigma <= 0 || criticalSigma < warningSigma) {
            throw new IllegalArgumentException(
                    "Sigma bands must satisfy 0 < warning <= critical, got " + warningSigma + " / " + criticalSigma);
        }
        this.warningSigma = warningSigma;
        this.criticalSigma = criticalSigma;
    }

    public static StatisticalBands from(ClassificationProperties properties) {
        return new StatisticalBands(properties.getWarningSigma(), properties.getCriticalSigma());
    }

    public Severity classify(double zScore) {
        double magnitude = Math.abs(zScore);
        if (Double.isNaN(magnitude)) {
            return Severity.NORMAL;
        }
        if (magnitude >= criticalSigma) {
            return Severity.CRITICAL;
        }
        if (magnitude >= warningSigma) {
            return Severity.WARNING;
        }
        return Severity.NORMAL;
    }

    public double getWarningSigma() {
        return warningSigma;
    }

    public double getCriticalSigma() {
        return criticalSigma;
    }
}
