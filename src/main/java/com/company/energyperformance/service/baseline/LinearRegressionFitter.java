package com.company.energyperformance.service.baseline;

import com.company.energyperformance.domain.FeatureRow;
import com.company.energyperformance.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Ordinary least squares over feature rows, intercept included unless suppressed.
 * Rank-deficient designs (constant or collinear features) are rejected as validation errors.
 */
@Component
@Slf4j
public class LinearRegressionFitter {

    private static final double SINGULARITY_THRESHOLD = 1e-10;

    public FitResult fit(List<FeatureRow> rows, List<String> featureNames, boolean includeIntercept) {
        int n = rows.size();
        int k = featureNames.size();
        int parameters = includeIntercept ? k + 1 : k;
        if (n < parameters + 1) {
            throw new ValidationException(String.format(
                    "%d samples cannot fit %d parameters", n, parameters),
                    Map.of("samples", n, "parameters", parameters));
        }

        double[] y = new double[n];
        double[][] x = new double[n][k];
        for (int i = 0; i < n; i++) {
            FeatureRow row = rows.get(i);
            y[i] = row.getConsumption();
            for (int j = 0; j < k; j++) {
                x[i][j] = row.getFeatures().get(featureNames.get(j));
            }
        }

        List<String> constant = constantColumns(x, featureNames);
        if (includeIntercept && !constant.isEmpty()) {
            throw new ValidationException("Constant features cannot be fitted alongside an intercept",
                    Map.of("features", constant));
        }

        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
        regression.setNoIntercept(!includeIntercept);
        regression.newSampleData(y, x);

        double[] beta;
        double[] standardErrors;
        double[] residuals;
        try {
            beta = regression.estimateRegressionParameters();
            standardErrors = regression.estimateRegressionParametersStandardErrors();
            residuals = regression.estimateResiduals();
        } catch (SingularMatrixException e) {
            throw new ValidationException("Features are collinear; remove redundant features",
                    Map.of("features", new ArrayList<>(featureNames)));
        }

        int degreesOfFreedom = n - parameters;
        TDistribution tDistribution = degreesOfFreedom > 0 ? new TDistribution(degreesOfFreedom) : null;

        int offset = includeIntercept ? 1 : 0;
        Map<String, Double> coefficients = new LinkedHashMap<>();
        Map<String, Double> pValues = new LinkedHashMap<>();
        for (int j = 0; j < k; j++) {
            coefficients.put(featureNames.get(j), beta[j + offset]);
            pValues.put(featureNames.get(j), pValue(beta[j + offset], standardErrors[j + offset], tDistribution));
        }

        double sumSquared = 0.0;
        double sumAbsolute = 0.0;
        for (double residual : residuals) {
            sumSquared += residual * residual;
            sumAbsolute += Math.abs(residual);
        }

        double rSquared = regression.calculateRSquared();
        double adjustedRSquared = regression.calculateAdjustedRSquared();

        log.debug("OLS fit: n={}, k={}, R²={}, adjusted R²={}", n, k, rSquared, adjustedRSquared);

        return FitResult.builder()
                .intercept(includeIntercept ? beta[0] : 0.0)
                .interceptIncluded(includeIntercept)
                .coefficients(coefficients)
                .pValues(pValues)
                .sampleCount(n)
                .rSquared(rSquared)
                .adjustedRSquared(adjustedRSquared)
                .rmse(Math.sqrt(sumSquared / n))
                .mae(sumAbsolute / n)
                .build();
    }

    private double pValue(double coefficient, double standardError, TDistribution tDistribution) {
        if (tDistribution == null || Double.isNaN(standardError)) {
            return Double.NaN;
        }
        if (standardError == 0.0) {
            return 0.0;
        }
        double t = Math.abs(coefficient / standardError);
        return 2.0 * (1.0 - tDistribution.cumulativeProbability(t));
    }

    private List<String> constantColumns(double[][] x, List<String> featureNames) {
        List<String> constant = new ArrayList<>();
        for (int j = 0; j < featureNames.size(); j++) {
            double first = x[0][j];
            boolean same = true;
            for (int i = 1; i < x.length && same; i++) {
                same = x[i][j] == first;
            }
            if (same) {
                constant.add(featureNames.get(j));
            }
        }
        return constant;
    }
}
