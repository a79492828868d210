package com.company.energyperformance.service.baseline;

import com.company.energyperformance.domain.FeatureRow;
import com.company.energyperformance.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinearRegressionFitterTest {

    private final LinearRegressionFitter fitter = new LinearRegressionFitter();

    private static FeatureRow row(double consumption, double... values) {
        Map<String, Double> features = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            features.put("f" + i, values[i]);
        }
        return FeatureRow.builder().features(features).consumption(consumption).build();
    }

    @Test
    void recoversExactLinearRelationship() {
        List<FeatureRow> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            double a = i;
            double b = (i * 7) % 11;
            rows.add(row(10.0 + 2.0 * a - 3.0 * b, a, b));
        }

        FitResult fit = fitter.fit(rows, List.of("f0", "f1"), true);

        assertThat(fit.getIntercept()).isCloseTo(10.0, within(1e-6));
        assertThat(fit.getCoefficients().get("f0")).isCloseTo(2.0, within(1e-6));
        assertThat(fit.getCoefficients().get("f1")).isCloseTo(-3.0, within(1e-6));
        assertThat(fit.getRSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(fit.getRmse()).isCloseTo(0.0, within(1e-6));
        assertThat(fit.getSampleCount()).isEqualTo(20);
    }

    @Test
    void fitsThroughTheOriginWhenInterceptSuppressed() {
        List<FeatureRow> rows = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            rows.add(row(4.0 * i, i));
        }

        FitResult fit = fitter.fit(rows, List.of("f0"), false);

        assertThat(fit.isInterceptIncluded()).isFalse();
        assertThat(fit.getIntercept()).isZero();
        assertThat(fit.getCoefficients().get("f0")).isCloseTo(4.0, within(1e-9));
    }

    @Test
    void constantFeatureWithInterceptIsRejected() {
        List<FeatureRow> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            rows.add(row(i, i, 5.0));
        }

        assertThatThrownBy(() -> fitter.fit(rows, List.of("f0", "f1"), true))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Constant features");
    }

    @Test
    void tooFewRowsForTheParameterCountIsRejected() {
        List<FeatureRow> rows = List.of(row(1, 1, 2), row(2, 2, 1), row(3, 4, 4));

        assertThatThrownBy(() -> fitter.fit(rows, List.of("f0", "f1"), true))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("cannot fit 3 parameters");
    }
}
