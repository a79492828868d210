package com.company.energyperformance.service.anomaly;

import com.company.energyperformance.config.AnomalyProperties;
import com.company.energyperformance.config.BaselineProperties;
import com.company.energyperformance.config.ClassificationProperties;
import com.company.energyperformance.domain.*;
import com.company.energyperformance.domain.enums.AnomalyType;
import com.company.energyperformance.domain.enums.ResolutionState;
import com.company.energyperformance.domain.enums.Severity;
import com.company.energyperformance.event.AnomalyDetectedEvent;
import com.company.energyperformance.exception.DeadlineExceededException;
import com.company.energyperformance.exception.FindingAlreadyResolvedException;
import com.company.energyperformance.exception.ResourceNotFoundException;
import com.company.energyperformance.exception.ValidationException;
import com.company.energyperformance.repository.AnomalyFindingRepository;
import com.company.energyperformance.repository.RollupRowRepository;
import com.company.energyperformance.service.ReferenceDataService;
import com.company.energyperformance.service.aggregation.TierDefinition;
import com.company.energyperformance.service.aggregation.TierGraph;
import com.company.energyperformance.service.baseline.BaselineModelRegistry;
import com.company.energyperformance.service.baseline.FeatureCatalog;
import com.company.energyperformance.service.baseline.FeatureDefinition;
import com.company.energyperformance.service.baseline.FeatureRowAssembler;
import com.company.energyperformance.util.StatisticalBands;
import com.company.energyperformance.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the detector for a group window, stores the findings and raises alerts for critical ones.
 */
@Service
@Slf4j
public class AnomalyService {

    private static final int MAX_LISTED_FINDINGS = 1000;

    private final ReferenceDataService referenceDataService;
    private final BaselineModelRegistry registry;
    private final TierGraph tierGraph;
    private final FeatureCatalog featureCatalog;
    private final FeatureRowAssembler featureRowAssembler;
    private final RollupRowRepository rollupRowRepository;
    private final AnomalyDetector detector;
    private final AnomalyFindingRepository findingRepository;
    private final AnomalyProperties properties;
    private final BaselineProperties baselineProperties;
    private final StatisticalBands bands;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    public AnomalyService(ReferenceDataService referenceDataService,
                          BaselineModelRegistry registry,
                          TierGraph tierGraph,
                          FeatureCatalog featureCatalog,
                          FeatureRowAssembler featureRowAssembler,
                          RollupRowRepository rollupRowRepository,
                          AnomalyDetector detector,
                          AnomalyFindingRepository findingRepository,
                          AnomalyProperties properties,
                          BaselineProperties baselineProperties,
                          ClassificationProperties classificationProperties,
                          ApplicationEventPublisher eventPublisher,
                          MeterRegistry meterRegistry,
                          Tracer tracer) {
        this.referenceDataService = referenceDataService;
        this.registry = registry;
        this.tierGraph = tierGraph;
        this.featureCatalog = featureCatalog;
        this.featureRowAssembler = featureRowAssembler;
        this.rollupRowRepository = rollupRowRepository;
        this.detector = detector;
        this.findingRepository = findingRepository;
        this.properties = properties;
        this.baselineProperties = baselineProperties;
        this.bands = StatisticalBands.from(classificationProperties);
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.tracer = tracer;
    }

    public AnomalyDetectionResult detect(String groupId, Instant windowStart, Instant windowEnd, Double contamination) {
        if (windowStart == null || windowEnd == null || !windowStart.isBefore(windowEnd)) {
            throw new ValidationException("Detection window start must be before its end",
                    Map.of("windowStart", String.valueOf(windowStart), "windowEnd", String.valueOf(windowEnd)));
        }
        double rate = contamination != null ? contamination : properties.getContamination();

        SignificantUseGroup group = referenceDataService.getGroup(groupId);
        EnergySource source = referenceDataService.getEnergySource(group.getEnergySourceId());
        BaselineModel model = registry.activeModel(groupId);
        TierDefinition tier = tierGraph.require(model.getTier());
        Instant start = TimeUtils.floorToBucket(windowStart, tier.getBucketWidth());
        Instant end = TimeUtils.ceilToBucket(windowEnd, tier.getBucketWidth());

        Span span = tracer.spanBuilder("anomaly.detect")
                .setAttribute("group", groupId)
                .setAttribute("tier", tier.getName())
                .setAttribute("model.version", model.getVersion())
                .startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        try (Scope ignored = span.makeCurrent()) {
            List<FeatureDefinition> features = featureCatalog.resolveForTraining(source.getType(), model.getFeatureNames());
            List<FeatureRow> reference = featureRowAssembler.assemble(group, source, tier.getName(),
                    model.getTrainingStart(), model.getTrainingEnd(), features, baselineProperties.getExcludedStates());
            List<FeatureRow> detection = featureRowAssembler.assemble(group, source, tier.getName(),
                    start, end, features, baselineProperties.getExcludedStates());

            DetectionOutcome outcome = detectWithDeadline(model, reference, detection, rate);
            Map<Instant, String> attribution = largestConsumer(group, source, tier.getName(), start, end);

            Instant detectedAt = Instant.now();
            int created = 0;
            int updated = 0;
            int unchanged = 0;
            List<AnomalyFinding> findings = new ArrayList<>();
            for (ScoredPoint point : outcome.anomalies()) {
                AnomalyFinding finding = toFinding(group, source, model, point, outcome.getThreshold(),
                        attribution, detectedAt);
                AnomalyFindingRepository.UpsertOutcome stored = findingRepository.upsert(finding);
                if (stored == AnomalyFindingRepository.UpsertOutcome.INSERTED) {
                    created++;
                } else if (stored == AnomalyFindingRepository.UpsertOutcome.UPDATED) {
                    updated++;
                } else {
                    unchanged++;
                }
                if (stored != AnomalyFindingRepository.UpsertOutcome.UNCHANGED) {
                    meterRegistry.counter("anomaly.findings.stored",
                            "severity", finding.getSeverity().name(),
                            "outcome", stored.name().toLowerCase(Locale.ROOT)).increment();
                    if (finding.getSeverity() == Severity.CRITICAL) {
                        eventPublisher.publishEvent(new AnomalyDetectedEvent(finding));
                    }
                }
                findings.add(finding);
            }

            log.info("Anomaly detection for group {} [{} - {}): {} buckets scored, {} skipped, "
                            + "{} anomalous ({} new, {} updated, {} unchanged), reference {} x{}",
                    groupId, start, end, outcome.getBucketsScored(), outcome.getBucketsSkipped(),
                    findings.size(), created, updated, unchanged,
                    outcome.getReferenceSource(), outcome.getReferenceSize());

            return AnomalyDetectionResult.builder()
                    .groupId(groupId)
                    .modelVersion(model.getVersion())
                    .tier(tier.getName())
                    .windowStart(start)
                    .windowEnd(end)
                    .referenceSource(outcome.getReferenceSource())
                    .referenceSize(outcome.getReferenceSize())
                    .threshold(outcome.getThreshold())
                    .contamination(rate)
                    .bucketsScored(outcome.getBucketsScored())
                    .bucketsSkipped(outcome.getBucketsSkipped())
                    .findingsCreated(created)
                    .findingsUpdated(updated)
                    .findingsUnchanged(unchanged)
                    .findings(findings)
                    .build();

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("anomaly.detection.duration"));
            span.end();
        }
    }

    public List<AnomalyFinding> findings(String groupId, String entityId, Instant from, Instant to,
                                         Severity severity, ResolutionState state, Integer limit) {
        if (groupId == null && entityId == null) {
            throw new ValidationException("Either groupId or entityId is required");
        }
        int max = limit != null ? Math.min(Math.max(limit, 1), MAX_LISTED_FINDINGS) : MAX_LISTED_FINDINGS;
        return findingRepository.find(groupId, entityId, from, to, severity, state, max);
    }

    public AnomalyFinding resolve(long findingId, String notes, String resolvedBy) {
        AnomalyFinding finding = findingRepository.findById(findingId)
                .orElseThrow(() -> new ResourceNotFoundException("Anomaly finding", findingId));
        if (finding.getResolutionState() == ResolutionState.RESOLVED) {
            throw new FindingAlreadyResolvedException(findingId);
        }
        if (!findingRepository.resolve(findingId, notes, resolvedBy, Instant.now())) {
            throw new FindingAlreadyResolvedException(findingId);
        }
        meterRegistry.counter("anomaly.findings.resolved").increment();
        log.info("Anomaly finding {} of group {} resolved by {}", findingId, finding.getGroupId(), resolvedBy);
        return findingRepository.findById(findingId).orElse(finding);
    }

    AnomalyFinding toFinding(SignificantUseGroup group, EnergySource source, BaselineModel model, ScoredPoint point,
                             double threshold, Map<Instant, String> attribution, Instant detectedAt) {
        boolean consumptionMetric = AnomalyDetector.CONSUMPTION.equals(point.getMetric())
                || AnomalyDetector.DEVIATION.equals(point.getMetric());
        double actual = consumptionMetric ? point.getConsumption() : point.getMetricValue();
        double expected = consumptionMetric ? point.getPredicted() : point.getReferenceMean();
        AnomalyType type = AnomalyDetector.typeOf(point.getMetric(), source.getType());
        String entityId = attribution.getOrDefault(point.getBucketStart(), group.getEntityIds().get(0));

        return AnomalyFinding.builder()
                .groupId(group.getGroupId())
                .entityId(entityId)
                .findingTime(point.getBucketStart())
                .metric(point.getMetric())
                .anomalyType(type)
                .actualValue(actual)
                .expectedValue(expected)
                .deviation(actual - expected)
                .zScore(point.getMetricZScore())
                .anomalyScore(point.getScore())
                .threshold(threshold)
                .confidence(AnomalyDetector.confidence(point.getScore(), threshold))
                .severity(bands.classify(point.getMetricZScore()))
                .modelVersion(model.getVersion())
                .description(String.format(Locale.ROOT, "%s: %s %.2f vs expected %.2f (z %.2f, score %.3f > %.3f)",
                        type.getDescription(), point.getMetric(), actual, expected,
                        point.getMetricZScore(), point.getScore(), threshold))
                .detectedAt(detectedAt)
                .build();
    }

    /**
     * Member with the largest consumption per bucket, used to attribute group findings
     */
    private Map<Instant, String> largestConsumer(SignificantUseGroup group, EnergySource source, String tier,
                                                 Instant start, Instant end) {
        Map<Instant, String> leader = new HashMap<>();
        Map<Instant, Double> leading = new HashMap<>();
        for (RollupRow row : rollupRowRepository.findRows(tier, group.getEntityIds(), start, end)) {
            Double consumption = row.sum(source.resolvedConsumptionChannel());
            if (consumption == null) {
                continue;
            }
            Double best = leading.get(row.getBucketStart());
            if (best == null || consumption > best) {
                leading.put(row.getBucketStart(), consumption);
                leader.put(row.getBucketStart(), row.getEntityId());
            }
        }
        return leader;
    }

    private DetectionOutcome detectWithDeadline(BaselineModel model, List<FeatureRow> reference,
                                                List<FeatureRow> detection, double contamination) {
        Duration deadline = properties.getDetectionDeadline();
        CompletableFuture<DetectionOutcome> future =
                CompletableFuture.supplyAsync(() -> detector.detect(model, reference, detection, contamination));
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            meterRegistry.counter("anomaly.detection.rejected", "reason", "deadline").increment();
            throw new DeadlineExceededException("anomaly detection", deadline);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Anomaly detection failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during anomaly detection", e);
        }
    }
}
