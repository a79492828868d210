package com.company.energyperformance.service.anomaly;

import com.amazon.randomcutforest.RandomCutForest;
import com.company.energyperformance.config.AnomalyProperties;
import com.company.energyperformance.domain.BaselineModel;
import com.company.energyperformance.domain.FeatureRow;
import com.company.energyperformance.domain.Prediction;
import com.company.energyperformance.domain.enums.AnomalyType;
import com.company.energyperformance.domain.enums.EnergySourceType;
import com.company.energyperformance.exception.InsufficientDataException;
import com.company.energyperformance.exception.ValidationException;
import com.company.energyperformance.service.baseline.BaselinePredictor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Scores model-tier buckets with a Random Cut Forest trained on a reference set.
 *
 * <p>Each bucket becomes a vector of the model features, the actual consumption and the signed
 * deviation from the baseline prediction, standardized against the reference set. The first quarter
 * of the reference warms the forest up; the rest is scored before being added, and the
 * (1 - contamination) quantile of those scores is the threshold. Detection buckets are scored
 * against the finished forest without updating it, so a fixed seed gives repeatable results.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnomalyDetector {

    public static final String CONSUMPTION = "consumption";
    public static final String DEVIATION = "deviation";

    private static final double MIN_STD = 1e-9;

    private final BaselinePredictor predictor;
    private final AnomalyProperties properties;

    public DetectionOutcome detect(BaselineModel model, List<FeatureRow> referenceRows,
                                   List<FeatureRow> detectionRows, double contamination) {
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new ValidationException("Contamination must be within (0, 0.5]",
                    Map.of("contamination", contamination));
        }

        List<String> dimensions = new ArrayList<>(model.getFeatureNames());
        dimensions.add(CONSUMPTION);
        dimensions.add(DEVIATION);

        List<BucketVector> detection = vectorize(model, detectionRows);
        List<BucketVector> reference = vectorize(model, referenceRows);
        DetectionOutcome.ReferenceSource source = DetectionOutcome.ReferenceSource.TRAINING_WINDOW;
        if (reference.size() < properties.getMinReferenceSamples()) {
            log.debug("Reference for group {} has {} buckets, falling back to the detection window",
                    model.getGroupId(), reference.size());
            reference = detection;
            source = DetectionOutcome.ReferenceSource.DETECTION_WINDOW;
        }
        if (reference.size() < properties.getMinReferenceSamples()) {
            throw new InsufficientDataException(model.getGroupId(), reference.size(),
                    properties.getMinReferenceSamples());
        }
        if (reference.size() > properties.getMaxReferenceSamples()) {
            reference = reference.subList(reference.size() - properties.getMaxReferenceSamples(), reference.size());
        }

        int d = dimensions.size();
        double[] mean = new double[d];
        double[] std = new double[d];
        standardization(reference, mean, std);

        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(d)
                .numberOfTrees(properties.getNumberOfTrees())
                .sampleSize(properties.getSampleSize())
                .randomSeed(properties.getRandomSeed())
                .outputAfter(1)
                .build();

        int warmup = Math.max(1, reference.size() / 4);
        double[] referenceScores = new double[reference.size() - warmup];
        for (int i = 0; i < reference.size(); i++) {
            float[] point = standardize(reference.get(i).values, mean, std);
            if (i >= warmup) {
                referenceScores[i - warmup] = forest.getAnomalyScore(point);
            }
            forest.update(point);
        }
        double threshold = quantile(referenceScores, 1.0 - contamination);

        List<ScoredPoint> points = new ArrayList<>(detection.size());
        for (BucketVector vector : detection) {
            double score = forest.getAnomalyScore(standardize(vector.values, mean, std));

            int strongest = 0;
            double strongestZ = 0.0;
            for (int j = 0; j < d; j++) {
                double z = zScore(vector.values[j], mean[j], std[j]);
                if (Math.abs(z) > Math.abs(strongestZ)) {
                    strongest = j;
                    strongestZ = z;
                }
            }

            Map<String, Double> values = new LinkedHashMap<>();
            for (int j = 0; j < d; j++) {
                values.put(dimensions.get(j), vector.values[j]);
            }
            points.add(ScoredPoint.builder()
                    .bucketStart(vector.row.getBucketStart())
                    .bucketEnd(vector.row.getBucketEnd())
                    .score(score)
                    .anomalous(score > threshold)
                    .metric(dimensions.get(strongest))
                    .metricValue(vector.values[strongest])
                    .metricZScore(strongestZ)
                    .referenceMean(mean[strongest])
                    .consumption(vector.values[d - 2])
                    .predicted(vector.predicted)
                    .values(values)
                    .build());
        }

        return DetectionOutcome.builder()
                .referenceSource(source)
                .referenceSize(reference.size())
                .threshold(threshold)
                .contamination(contamination)
                .bucketsScored(detection.size())
                .bucketsSkipped(detectionRows.size() - detection.size())
                .points(points)
                .build();
    }

    public static double confidence(double score, double threshold) {
        double total = score + threshold;
        return total > 0.0 ? score / total : 0.0;
    }

    public static AnomalyType typeOf(String metric, EnergySourceType sourceType) {
        if (DEVIATION.equals(metric)) {
            return AnomalyType.BASELINE_DEVIATION;
        }
        if (CONSUMPTION.equals(metric)) {
            return sourceType == EnergySourceType.ELECTRICITY ? AnomalyType.POWER_ANOMALY : AnomalyType.FLOW_ANOMALY;
        }
        if (metric.contains("temp") || metric.contains("degree_hours")) {
            return AnomalyType.TEMPERATURE_ANOMALY;
        }
        if (metric.contains("pressure")) {
            return AnomalyType.PRESSURE_ANOMALY;
        }
        if (metric.contains("production") || metric.contains("throughput")) {
            return AnomalyType.PRODUCTION_ANOMALY;
        }
        if (metric.contains("flow")) {
            return AnomalyType.FLOW_ANOMALY;
        }
        if (metric.contains("power") || metric.contains("load_factor")
                || metric.contains("voltage") || metric.contains("current")) {
            return AnomalyType.POWER_ANOMALY;
        }
        return AnomalyType.OTHER;
    }

    private List<BucketVector> vectorize(BaselineModel model, List<FeatureRow> rows) {
        List<BucketVector> vectors = new ArrayList<>(rows.size());
        List<String> features = model.getFeatureNames();
        for (FeatureRow row : rows) {
            if (!row.isUsable()) {
                continue;
            }
            Prediction prediction = predictor.predict(model, row.getFeatures());
            double[] values = new double[features.size() + 2];
            for (int j = 0; j < features.size(); j++) {
                values[j] = row.getFeatures().get(features.get(j));
            }
            values[features.size()] = row.getConsumption();
            values[features.size() + 1] = row.getConsumption() - prediction.getValue();
            vectors.add(new BucketVector(row, values, prediction.getValue()));
        }
        return vectors;
    }

    private static void standardization(List<BucketVector> reference, double[] mean, double[] std) {
        int n = reference.size();
        for (BucketVector vector : reference) {
            for (int j = 0; j < mean.length; j++) {
                mean[j] += vector.values[j] / n;
            }
        }
        for (BucketVector vector : reference) {
            for (int j = 0; j < std.length; j++) {
                double diff = vector.values[j] - mean[j];
                std[j] += diff * diff / n;
            }
        }
        for (int j = 0; j < std.length; j++) {
            std[j] = Math.sqrt(std[j]);
        }
    }

    private static float[] standardize(double[] values, double[] mean, double[] std) {
        float[] point = new float[values.length];
        for (int j = 0; j < values.length; j++) {
            point[j] = (float) zScore(values[j], mean[j], std[j]);
        }
        return point;
    }

    // A constant reference dimension has no spread; any departure from it counts as critical
    static double zScore(double value, double mean, double std) {
        double diff = value - mean;
        if (std < MIN_STD) {
            return Math.abs(diff) < MIN_STD ? 0.0 : Math.copySign(10.0, diff);
        }
        return diff / std;
    }

    static double quantile(double[] scores, double q) {
        if (scores.length == 0) {
            return 0.0;
        }
        double[] sorted = scores.clone();
        Arrays.sort(sorted);
        int index = (int) Math.ceil(q * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(sorted.length - 1, index))];
    }

    private static final class BucketVector {
        private final FeatureRow row;
        private final double[] values;
        private final double predicted;

        private BucketVector(FeatureRow row, double[] values, double predicted) {
            this.row = row;
            this.values = values;
            this.predicted = predicted;
        }
    }
}
