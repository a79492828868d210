package com.company.energyperformance.service.anomaly;

import com.company.energyperformance.config.AnomalyProperties;
import com.company.energyperformance.domain.BaselineModel;
import com.company.energyperformance.domain.FeatureRow;
import com.company.energyperformance.domain.enums.AnomalyType;
import com.company.energyperformance.domain.enums.EnergySourceType;
import com.company.energyperformance.domain.enums.OperationalState;
import com.company.energyperformance.exception.InsufficientDataException;
import com.company.energyperformance.exception.ValidationException;
import com.company.energyperformance.service.baseline.BaselinePredictor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AnomalyDetectorTest {

    private static final Instant REFERENCE_START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant DETECTION_START = Instant.parse("2024-03-01T00:00:00Z");

    private AnomalyDetector detector;
    private BaselineModel model;

    @BeforeEach
    void setUp() {
        detector = new AnomalyDetector(new BaselinePredictor(), new AnomalyProperties());

        Map<String, Double> coefficients = new LinkedHashMap<>();
        coefficients.put("avg_outdoor_temp_c", 2.0);
        model = BaselineModel.builder()
                .groupId("compressors")
                .energySourceId("electricity")
                .version(1)
                .tier("1hour")
                .featureNames(List.of("avg_outdoor_temp_c"))
                .coefficients(coefficients)
                .pValues(new LinkedHashMap<>())
                .intercept(100.0)
                .interceptIncluded(true)
                .rmse(1.0)
                .build();
    }

    @Test
    void flagsInjectedSpikeAndAttributesItToTheDeviation() {
        List<FeatureRow> detection = rows(DETECTION_START, 25, 11L);
        FeatureRow spike = detection.get(12);
        spike.setConsumption(spike.getConsumption() + 60.0);

        DetectionOutcome outcome = detector.detect(model, rows(REFERENCE_START, 200, 7L), detection, 0.1);

        assertThat(outcome.getReferenceSource()).isEqualTo(DetectionOutcome.ReferenceSource.TRAINING_WINDOW);
        assertThat(outcome.getReferenceSize()).isEqualTo(200);
        assertThat(outcome.getBucketsScored()).isEqualTo(25);

        ScoredPoint flagged = outcome.getPoints().get(12);
        assertThat(flagged.isAnomalous()).isTrue();
        assertThat(flagged.getBucketStart()).isEqualTo(spike.getBucketStart());
        assertThat(flagged.getMetric()).isEqualTo(AnomalyDetector.DEVIATION);
        assertThat(flagged.getMetricZScore()).isGreaterThan(10.0);
        assertThat(flagged.getPredicted()).isCloseTo(100.0 + 2.0 * spike.getFeatures().get("avg_outdoor_temp_c"), within(1e-9));

        double highest = outcome.getPoints().stream().mapToDouble(ScoredPoint::getScore).max().orElse(0.0);
        assertThat(flagged.getScore()).isEqualTo(highest);
        assertThat(outcome.anomalies()).contains(flagged);
    }

    @Test
    void sameInputsGiveSameScores() {
        List<FeatureRow> reference = rows(REFERENCE_START, 120, 3L);
        List<FeatureRow> detection = rows(DETECTION_START, 24, 4L);

        DetectionOutcome first = detector.detect(model, reference, detection, 0.1);
        DetectionOutcome second = detector.detect(model, reference, detection, 0.1);

        assertThat(second.getThreshold()).isEqualTo(first.getThreshold());
        assertThat(scores(second)).isEqualTo(scores(first));
    }

    @Test
    void fallsBackToDetectionWindowWhenReferenceIsTooSmall() {
        DetectionOutcome outcome = detector.detect(model, rows(REFERENCE_START, 5, 1L),
                rows(DETECTION_START, 30, 2L), 0.1);

        assertThat(outcome.getReferenceSource()).isEqualTo(DetectionOutcome.ReferenceSource.DETECTION_WINDOW);
        assertThat(outcome.getReferenceSize()).isEqualTo(30);
        assertThat(outcome.getPoints()).hasSize(30);
    }

    @Test
    void rejectsWhenNeitherWindowHasEnoughBuckets() {
        assertThatThrownBy(() -> detector.detect(model, Collections.emptyList(), rows(DETECTION_START, 5, 2L), 0.1))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void skipsBucketsInExcludedStates() {
        List<FeatureRow> detection = rows(DETECTION_START, 24, 5L);
        detection.get(0).setExcludedState(OperationalState.MAINTENANCE);
        detection.get(1).setConsumption(null);

        DetectionOutcome outcome = detector.detect(model, rows(REFERENCE_START, 100, 6L), detection, 0.1);

        assertThat(outcome.getBucketsScored()).isEqualTo(22);
        assertThat(outcome.getBucketsSkipped()).isEqualTo(2);
        assertThat(outcome.getPoints()).noneMatch(p -> p.getBucketStart().equals(detection.get(0).getBucketStart()));
    }

    @Test
    void rejectsContaminationOutsideRange() {
        List<FeatureRow> reference = rows(REFERENCE_START, 50, 1L);
        List<FeatureRow> detection = rows(DETECTION_START, 10, 2L);

        assertThatThrownBy(() -> detector.detect(model, reference, detection, 0.0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> detector.detect(model, reference, detection, 0.6))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> detector.detect(model, reference, detection, Double.NaN))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void confidenceGrowsWithScore() {
        assertThat(AnomalyDetector.confidence(1.0, 1.0)).isEqualTo(0.5);
        assertThat(AnomalyDetector.confidence(3.0, 1.0)).isEqualTo(0.75);
        assertThat(AnomalyDetector.confidence(0.0, 0.0)).isZero();
    }

    @Test
    void mapsMetricsToAnomalyTypes() {
        assertThat(AnomalyDetector.typeOf("deviation", EnergySourceType.ELECTRICITY)).isEqualTo(AnomalyType.BASELINE_DEVIATION);
        assertThat(AnomalyDetector.typeOf("consumption", EnergySourceType.ELECTRICITY)).isEqualTo(AnomalyType.POWER_ANOMALY);
        assertThat(AnomalyDetector.typeOf("consumption", EnergySourceType.STEAM)).isEqualTo(AnomalyType.FLOW_ANOMALY);
        assertThat(AnomalyDetector.typeOf("heating_degree_hours", EnergySourceType.ELECTRICITY)).isEqualTo(AnomalyType.TEMPERATURE_ANOMALY);
        assertThat(AnomalyDetector.typeOf("avg_pressure_bar", EnergySourceType.STEAM)).isEqualTo(AnomalyType.PRESSURE_ANOMALY);
        assertThat(AnomalyDetector.typeOf("total_production_count", EnergySourceType.ELECTRICITY)).isEqualTo(AnomalyType.PRODUCTION_ANOMALY);
        assertThat(AnomalyDetector.typeOf("avg_load_factor", EnergySourceType.ELECTRICITY)).isEqualTo(AnomalyType.POWER_ANOMALY);
        assertThat(AnomalyDetector.typeOf("operating_hours", EnergySourceType.ELECTRICITY)).isEqualTo(AnomalyType.OTHER);
    }

    @Test
    void constantReferenceDimensionStillScoresDepartures() {
        assertThat(AnomalyDetector.zScore(5.0, 5.0, 0.0)).isZero();
        assertThat(AnomalyDetector.zScore(6.0, 5.0, 0.0)).isEqualTo(10.0);
        assertThat(AnomalyDetector.zScore(4.0, 5.0, 0.0)).isEqualTo(-10.0);
        assertThat(AnomalyDetector.zScore(7.0, 5.0, 2.0)).isEqualTo(1.0);
    }

    @Test
    void quantileUsesNearestRank() {
        double[] scores = {5, 1, 4, 2, 3, 6, 7, 8, 9, 10};

        assertThat(AnomalyDetector.quantile(scores, 0.9)).isEqualTo(9.0);
        assertThat(AnomalyDetector.quantile(scores, 0.5)).isEqualTo(5.0);
        assertThat(AnomalyDetector.quantile(scores, 1.0)).isEqualTo(10.0);
        assertThat(AnomalyDetector.quantile(new double[0], 0.9)).isZero();
    }

    private static List<Double> scores(DetectionOutcome outcome) {
        return outcome.getPoints().stream().map(ScoredPoint::getScore).collect(Collectors.toList());
    }

    private static List<FeatureRow> rows(Instant start, int count, long seed) {
        Random random = new Random(seed);
        List<FeatureRow> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Instant bucketStart = start.plus(Duration.ofHours(i));
            double temperature = 10.0 + 5.0 * Math.sin(i / 10.0) + random.nextGaussian();
            Map<String, Double> features = new LinkedHashMap<>();
            features.put("avg_outdoor_temp_c", temperature);
            rows.add(FeatureRow.builder()
                    .bucketStart(bucketStart)
                    .bucketEnd(bucketStart.plus(Duration.ofHours(1)))
                    .features(features)
                    .consumption(100.0 + 2.0 * temperature + random.nextGaussian())
                    .build());
        }
        return rows;
    }
}
