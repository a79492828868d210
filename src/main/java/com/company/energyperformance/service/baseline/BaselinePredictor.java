package com.company.energyperformance.service.baseline;

import com.company.energyperformance.domain.BaselineModel;
import com.company.energyperformance.domain.Prediction;
import com.company.energyperformance.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Applies a stored model to a feature vector and renders its formula.
 * Negative raw predictions are clamped to zero and flagged on the result.
 */
@Component
public class BaselinePredictor {

    public Prediction predict(BaselineModel model, Map<String, Double> features) {
        List<String> unknown = new ArrayList<>();
        for (String name : features.keySet()) {
            if (!model.getCoefficients().containsKey(name)) {
                unknown.add(name);
            }
        }
        List<String> missing = new ArrayList<>();
        for (String name : model.getFeatureNames()) {
            Double value = features.get(name);
            if (value == null || !Double.isFinite(value)) {
                missing.add(name);
            }
        }
        if (!unknown.isEmpty() || !missing.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("unknownFeatures", unknown);
            details.put("missingFeatures", missing);
            details.put("modelFeatures", new ArrayList<>(model.getFeatureNames()));
            throw new ValidationException("Feature vector does not match baseline version " + model.getVersion(),
                    details);
        }

        double raw = model.getIntercept();
        for (String name : model.getFeatureNames()) {
            raw += model.getCoefficients().get(name) * features.get(name);
        }

        return Prediction.builder()
                .groupId(model.getGroupId())
                .modelVersion(model.getVersion())
                .rawValue(raw)
                .value(Math.max(0.0, raw))
                .clamped(raw < 0.0)
                .unit(model.getConsumptionUnit())
                .build();
    }

    /**
     * e.g. {@code Energy (kWh) = 45.2000 + 0.000030×total_production_count − 1.2000×avg_outdoor_temp_c}
     */
    public String formula(BaselineModel model) {
        StringBuilder formula = new StringBuilder();
        formula.append("Energy (").append(model.getConsumptionUnit()).append(") = ");
        formula.append(String.format(Locale.ROOT, "%.4f", model.getIntercept()));
        for (String name : model.getFeatureNames()) {
            double coefficient = model.getCoefficients().get(name);
            formula.append(coefficient < 0 ? " − " : " + ");
            formula.append(formatCoefficient(Math.abs(coefficient)));
            formula.append('×').append(name);
        }
        return formula.toString();
    }

    private String formatCoefficient(double value) {
        if (value != 0.0 && value < 0.001) {
            return String.format(Locale.ROOT, "%.6f", value);
        }
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
