package com.company.energyperformance.exception;

import com.company.energyperformance.domain.BaselineModel;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The model was fitted and stored inactive because it missed the quality gate
 */
public class QualityGateFailureException extends EnergyPerformanceException {

    private final transient BaselineModel model;

    public QualityGateFailureException(BaselineModel model) {
        super(ErrorKind.QUALITY_GATE_FAILURE,
                "Baseline version " + model.getVersion() + " failed the quality gate: " + model.getQualityGateReason(),
                details(model));
        this.model = model;
    }

    public BaselineModel getModel() {
        return model;
    }

    private static Map<String, Object> details(BaselineModel model) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("groupId", model.getGroupId());
        details.put("version", model.getVersion());
        details.put("rSquared", model.getRSquared());
        details.put("sampleCount", model.getSampleCount());
        details.put("reason", model.getQualityGateReason());
        return details;
    }
}
