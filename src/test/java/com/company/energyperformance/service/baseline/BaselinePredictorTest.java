package com.company.energyperformance.service.baseline;

import com.company.energyperformance.domain.BaselineModel;
import com.company.energyperformance.domain.Prediction;
import com.company.energyperformance.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BaselinePredictorTest {

    private final BaselinePredictor predictor = new BaselinePredictor();

    private BaselineModel model() {
        Map<String, Double> coefficients = new LinkedHashMap<>();
        coefficients.put("total_production_count", 0.00003);
        coefficients.put("avg_outdoor_temp_c", -1.2);
        return BaselineModel.builder()
                .groupId("press-line-elec")
                .version(3)
                .featureNames(new ArrayList<>(List.of("total_production_count", "avg_outdoor_temp_c")))
                .coefficients(coefficients)
                .intercept(45.2)
                .consumptionUnit("kWh")
                .build();
    }

    @Test
    void appliesInterceptAndCoefficients() {
        Prediction prediction = predictor.predict(model(),
                Map.of("total_production_count", 100000.0, "avg_outdoor_temp_c", 10.0));

        assertThat(prediction.getValue()).isEqualTo(45.2 + 3.0 - 12.0, org.assertj.core.data.Offset.offset(1e-9));
        assertThat(prediction.isClamped()).isFalse();
        assertThat(prediction.getUnit()).isEqualTo("kWh");
    }

    @Test
    void negativeRawPredictionIsClampedAndFlagged() {
        Prediction prediction = predictor.predict(model(),
                Map.of("total_production_count", 0.0, "avg_outdoor_temp_c", 50.0));

        assertThat(prediction.getRawValue()).isNegative();
        assertThat(prediction.getValue()).isZero();
        assertThat(prediction.isClamped()).isTrue();
    }

    @Test
    void vectorMustMatchTheModelFeatures() {
        assertThatThrownBy(() -> predictor.predict(model(),
                Map.of("total_production_count", 1.0, "avg_humidity_pct", 40.0)))
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getDetails().get("unknownFeatures")).isEqualTo(List.of("avg_humidity_pct"));
                    assertThat(e.getDetails().get("missingFeatures")).isEqualTo(List.of("avg_outdoor_temp_c"));
                });
    }

    @Test
    void rendersFormulaWithSignsAndSmallCoefficients() {
        assertThat(predictor.formula(model()))
                .isEqualTo("Energy (kWh) = 45.2000 + 0.000030×total_production_count − 1.2000×avg_outdoor_temp_c");
    }
}
