package com.company.energyperformance.service.deviation;

import com.company.energyperformance.config.ClassificationProperties;
import com.company.energyperformance.domain.enums.ComplianceGrade;
import com.company.energyperformance.domain.enums.Severity;
import com.company.energyperformance.util.StatisticalBands;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps a deviation to a compliance grade (by percentage) and a statistical severity
 * (by multiples of the model RMSE)
 */
@Component
@Slf4j
public class GradeClassifier {

    private final double compliantPercent;
    private final double warningPercent;
    private final StatisticalBands bands;

    @Autowired
    public GradeClassifier(ClassificationProperties properties) {
        this(properties.getCompliantPercent(), properties.getWarningPercent(), StatisticalBands.from(properties));
    }

    public GradeClassifier(double compliantPercent, double warningPercent, StatisticalBands bands) {
        if (compliantPercent < 0 || warningPercent <= compliantPercent) {
            throw new IllegalArgumentException(String.format(
                    "Grade thresholds must satisfy 0 <= compliant < warning, got %s / %s",
                    compliantPercent, warningPercent));
        }
        this.compliantPercent = compliantPercent;
        this.warningPercent = warningPercent;
        this.bands = bands;
    }

    public ComplianceGrade grade(Double deviationPercent) {
        if (deviationPercent == null || deviationPercent.isNaN()) {
            return ComplianceGrade.UNDETERMINED;
        }
        double magnitude = Math.abs(deviationPercent);
        if (magnitude <= compliantPercent) {
            return ComplianceGrade.COMPLIANT;
        }
        if (magnitude <= warningPercent) {
            return ComplianceGrade.WARNING;
        }
        return ComplianceGrade.CRITICAL;
    }

    /**
     * Severity of |deviation| / rmse. A zero rmse makes any non-zero deviation critical.
     */
    public Severity statisticalSeverity(double deviation, double rmse) {
        if (rmse <= 0.0) {
            return deviation == 0.0 ? Severity.NORMAL : Severity.CRITICAL;
        }
        return bands.classify(Math.abs(deviation) / rmse);
    }
}
