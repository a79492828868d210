package com.company.energyperformance.service.deviation;

import com.company.energyperformance.config.ClassificationProperties;
import com.company.energyperformance.domain.*;
import com.company.energyperformance.exception.ValidationException;
import com.company.energyperformance.repository.BaselineAdjustmentRepository;
import com.company.energyperformance.repository.PerformanceRecordRepository;
import com.company.energyperformance.service.ReferenceDataService;
import com.company.energyperformance.service.aggregation.RollupQueryResult;
import com.company.energyperformance.service.aggregation.RollupQueryService;
import com.company.energyperformance.service.aggregation.TierDefinition;
import com.company.energyperformance.service.aggregation.TierFinalizationService;
import com.company.energyperformance.service.aggregation.TierGraph;
import com.company.energyperformance.service.baseline.BaselineModelRegistry;
import com.company.energyperformance.service.baseline.BaselinePredictor;
import com.company.energyperformance.service.baseline.FeatureCatalog;
import com.company.energyperformance.service.baseline.FeatureDefinition;
import com.company.energyperformance.service.baseline.FeatureRowAssembler;
import com.company.energyperformance.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Compares actual consumption of a group with its active baseline over a period, grades the
 * deviation and keeps the cumulative trend.
 *
 * <p>Actual consumption comes from the finest tier aligned with the period; expected consumption is
 * the sum of per-bucket predictions on the model's tier. Periods that end inside the finalized
 * range are stored once and then served unchanged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PerformanceService {

    private final ReferenceDataService referenceDataService;
    private final BaselineModelRegistry registry;
    private final BaselinePredictor predictor;
    private final FeatureCatalog featureCatalog;
    private final FeatureRowAssembler featureRowAssembler;
    private final RollupQueryService rollupQueryService;
    private final TierGraph tierGraph;
    private final TierFinalizationService finalizationService;
    private final PerformanceRecordRepository recordRepository;
    private final BaselineAdjustmentRepository adjustmentRepository;
    private final GradeClassifier gradeClassifier;
    private final TrendCalculator trendCalculator;
    private final ClassificationProperties properties;
    private final MeterRegistry meterRegistry;

    public PerformanceRecord evaluate(String groupId, Instant periodStart, Instant periodEnd) {
        return evaluate(groupId, periodStart, periodEnd, null);
    }

    public PerformanceRecord evaluate(String groupId, Instant periodStart, Instant periodEnd, String label) {
        if (periodStart == null || periodEnd == null || !periodStart.isBefore(periodEnd)) {
            throw new ValidationException("Period start must be before its end",
                    Map.of("periodStart", String.valueOf(periodStart), "periodEnd", String.valueOf(periodEnd)));
        }

        Optional<PerformanceRecord> stored = recordRepository.findByPeriod(groupId, periodStart, periodEnd);
        if (stored.isPresent() && stored.get().isFinalized()) {
            log.debug("Serving finalized record for group {} [{} - {})", groupId, periodStart, periodEnd);
            return stored.get();
        }

        SignificantUseGroup group = referenceDataService.getGroup(groupId);
        EnergySource source = referenceDataService.getEnergySource(group.getEnergySourceId());
        BaselineModel model = registry.activeModel(groupId);
        TierDefinition modelTier = tierGraph.require(model.getTier());
        Instant now = Instant.now();

        if (!TimeUtils.isAligned(periodStart, modelTier.getBucketWidth())
                || !TimeUtils.isAligned(periodEnd, modelTier.getBucketWidth())) {
            throw new ValidationException("Period is not aligned with the baseline tier " + modelTier.getName(),
                    Map.of("periodStart", periodStart.toString(), "periodEnd", periodEnd.toString(),
                            "tier", modelTier.getName()));
        }
        TierDefinition actualTier = tierGraph.finestApplicable(periodStart, periodEnd, now)
                .orElse(modelTier);

        RollupQueryResult actualSeries = rollupQueryService.queryGroup(group, actualTier.getName(),
                periodStart, periodEnd, now);
        double actual = 0.0;
        for (RollupRow row : actualSeries.getRows()) {
            Double value = row.sum(source.resolvedConsumptionChannel());
            if (value != null) {
                actual += value;
            }
        }

        List<FeatureDefinition> features = featureCatalog.resolveForTraining(source.getType(), model.getFeatureNames());
        List<FeatureRow> rows = featureRowAssembler.assemble(group, source, modelTier.getName(),
                periodStart, periodEnd, features, Collections.emptyList());

        double expected = 0.0;
        int predicted = 0;
        int missing = 0;
        int clamped = 0;
        for (FeatureRow row : rows) {
            if (!row.hasAllFeatures()) {
                missing++;
                continue;
            }
            Prediction prediction = predictor.predict(model, row.getFeatures());
            expected += prediction.getValue();
            predicted++;
            if (prediction.isClamped()) {
                clamped++;
            }
        }

        PerformanceRecord record = classify(group, model, periodStart, periodEnd, actual, expected,
                source.getUnitCost());
        record.setPeriodLabel(label != null ? label : periodStart + "/" + periodEnd);
        record.setActualTier(actualTier.getName());
        record.setBucketsPredicted(predicted);
        record.setBucketsMissingFeatures(missing);
        record.setNegativePredictionsClamped(clamped);
        record.setStaleData(actualSeries.isStaleData());
        record.setFinalized(!actualSeries.isStaleData() && isFinalized(group, modelTier, actualTier, periodEnd));
        record.setGeneratedAt(now);

        if (!recordRepository.upsert(record)) {
            // Finalized concurrently; the stored record wins
            return recordRepository.findByPeriod(groupId, periodStart, periodEnd).orElse(record);
        }

        meterRegistry.counter("performance.evaluations", "grade", record.getGrade().name()).increment();
        if (missing > 0) {
            log.warn("Group {} [{} - {}): {} buckets lacked features and were not predicted",
                    groupId, periodStart, periodEnd, missing);
        }
        log.info("Evaluated group {} [{} - {}): actual {}, expected {}, deviation {}% -> {}",
                groupId, periodStart, periodEnd,
                String.format(Locale.ROOT, "%.2f", actual), String.format(Locale.ROOT, "%.2f", expected),
                record.getDeviationPercent() != null
                        ? String.format(Locale.ROOT, "%.2f", record.getDeviationPercent()) : "n/a",
                record.getGrade());
        return record;
    }

    /**
     * Report for a calendar period. Quarters and years evaluate their months first so the
     * cumulative trend of the breakdown is in place.
     */
    public PerformanceReport report(String groupId, int year, String period) {
        ReportingPeriod reportingPeriod = ReportingPeriod.parse(year, period);

        List<PerformanceRecord> months = new ArrayList<>();
        for (ReportingPeriod month : reportingPeriod.monthlyBreakdown()) {
            months.add(evaluate(groupId, month.getStart(), month.getEnd(), month.getLabel()));
        }
        PerformanceRecord summary = evaluate(groupId, reportingPeriod.getStart(), reportingPeriod.getEnd(),
                reportingPeriod.getLabel());

        return PerformanceReport.builder()
                .groupId(groupId)
                .year(year)
                .period(reportingPeriod.getLabel())
                .summary(summary)
                .monthlyBreakdown(months)
                .baselineFormula(predictor.formula(registry.activeModel(groupId)))
                .build();
    }

    public List<PerformanceRecord> history(String groupId, Instant from, Instant to) {
        referenceDataService.getGroup(groupId);
        return recordRepository.findInRange(groupId, from, to);
    }

    public BaselineAdjustment recordAdjustment(String groupId, Instant effectiveAt, String reason, String recordedBy) {
        referenceDataService.getGroup(groupId);
        if (effectiveAt == null) {
            throw new ValidationException("effectiveAt is required");
        }
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("An adjustment needs a reason");
        }
        BaselineAdjustment adjustment = adjustmentRepository.save(BaselineAdjustment.builder()
                .groupId(groupId)
                .effectiveAt(effectiveAt)
                .reason(reason)
                .recordedBy(recordedBy)
                .recordedAt(Instant.now())
                .build());
        log.info("Baseline adjustment {} for group {} effective {}: {}",
                adjustment.getAdjustmentId(), groupId, effectiveAt, reason);
        return adjustment;
    }

    /**
     * Pure part of an evaluation: deviation, band, grade, severity, cost and trend
     */
    PerformanceRecord classify(SignificantUseGroup group, BaselineModel model, Instant periodStart,
                               Instant periodEnd, double actual, double expected, Double unitCost) {
        double deviation = actual - expected;
        Double deviationPercent = expected == 0.0 ? null : deviation / expected * 100.0;
        double halfBand = properties.getBandZ() * model.getRmse();

        TrendCalculator.Trend trend = trendCalculator.compute(periodStart,
                Duration.between(periodStart, periodEnd), deviation,
                recordRepository.findEndingAtOrBefore(group.getGroupId(), periodStart),
                adjustmentRepository.findByGroup(group.getGroupId()));

        return PerformanceRecord.builder()
                .groupId(group.getGroupId())
                .energySourceId(group.getEnergySourceId())
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .modelVersion(model.getVersion())
                .modelTier(model.getTier())
                .actualConsumption(actual)
                .expectedConsumption(expected)
                .deviation(deviation)
                .deviationPercent(deviationPercent)
                .lowerBound(expected - halfBand)
                .upperBound(expected + halfBand)
                .statisticallySignificant(Math.abs(deviation) > halfBand)
                .cumulativeDeviation(trend.getCumulativeDeviation())
                .trendSegmentId(trend.getSegmentId())
                .sustainedDrift(trend.isSustainedDrift())
                .grade(gradeClassifier.grade(deviationPercent))
                .statisticalSeverity(gradeClassifier.statisticalSeverity(deviation, model.getRmse()))
                .deviationCost(unitCost != null ? deviation * unitCost : null)
                .build();
    }

    private boolean isFinalized(SignificantUseGroup group, TierDefinition modelTier, TierDefinition actualTier,
                                Instant periodEnd) {
        Optional<Instant> modelHorizon = finalizationService.finalizedThrough(modelTier.getName(), group.getEntityIds());
        Optional<Instant> actualHorizon = finalizationService.finalizedThrough(actualTier.getName(), group.getEntityIds());
        return modelHorizon.isPresent() && actualHorizon.isPresent()
                && !periodEnd.isAfter(TimeUtils.earliest(modelHorizon.get(), actualHorizon.get()));
    }
}
