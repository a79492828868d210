package com.company.energyperformance.service.anomaly;

import com.company.energyperformance.config.AggregationProperties;
import com.company.energyperformance.config.AnomalyProperties;
import com.company.energyperformance.config.BaselineProperties;
import com.company.energyperformance.config.ClassificationProperties;
import com.company.energyperformance.domain.AnomalyFinding;
import com.company.energyperformance.domain.BaselineModel;
import com.company.energyperformance.domain.ChannelSummary;
import com.company.energyperformance.domain.EnergySource;
import com.company.energyperformance.domain.RollupRow;
import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.domain.enums.AnomalyType;
import com.company.energyperformance.domain.enums.EnergySourceType;
import com.company.energyperformance.domain.enums.ReadingChannel;
import com.company.energyperformance.domain.enums.ResolutionState;
import com.company.energyperformance.domain.enums.Severity;
import com.company.energyperformance.event.AnomalyDetectedEvent;
import com.company.energyperformance.exception.FindingAlreadyResolvedException;
import com.company.energyperformance.exception.ResourceNotFoundException;
import com.company.energyperformance.exception.ValidationException;
import com.company.energyperformance.repository.AnomalyFindingRepository;
import com.company.energyperformance.repository.RollupRowRepository;
import com.company.energyperformance.service.ReferenceDataService;
import com.company.energyperformance.service.aggregation.TierGraph;
import com.company.energyperformance.service.baseline.BaselineModelRegistry;
import com.company.energyperformance.service.baseline.FeatureCatalog;
import com.company.energyperformance.service.baseline.FeatureRowAssembler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyServiceTest {

    private static final Instant WINDOW_START = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant WINDOW_END = Instant.parse("2024-03-02T00:00:00Z");
    private static final Instant SPIKE = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant DIP = Instant.parse("2024-03-01T18:00:00Z");

    @Mock
    private ReferenceDataService referenceDataService;
    @Mock
    private BaselineModelRegistry registry;
    @Mock
    private FeatureRowAssembler featureRowAssembler;
    @Mock
    private RollupRowRepository rollupRowRepository;
    @Mock
    private AnomalyDetector detector;
    @Mock
    private AnomalyFindingRepository findingRepository;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private SimpleMeterRegistry meterRegistry;
    private AnomalyService service;
    private SignificantUseGroup group;
    private EnergySource source;
    private BaselineModel model;
    private final Map<String, AnomalyFinding> stored = new HashMap<>();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new AnomalyService(referenceDataService, registry, new TierGraph(new AggregationProperties()),
                new FeatureCatalog(), featureRowAssembler, rollupRowRepository, detector, findingRepository,
                new AnomalyProperties(), new BaselineProperties(), new ClassificationProperties(), eventPublisher,
                meterRegistry, OpenTelemetry.noop().getTracer("test"));

        group = SignificantUseGroup.builder()
                .groupId("compressors")
                .name("Compressor hall")
                .energySourceId("electricity")
                .entityIds(List.of("comp-1", "comp-2"))
                .active(true)
                .build();
        source = EnergySource.builder()
                .energySourceId("electricity")
                .name("Grid electricity")
                .type(EnergySourceType.ELECTRICITY)
                .build();
        model = BaselineModel.builder()
                .groupId("compressors")
                .energySourceId("electricity")
                .version(3)
                .tier("1hour")
                .featureNames(List.of("avg_outdoor_temp_c"))
                .coefficients(new LinkedHashMap<>(Map.of("avg_outdoor_temp_c", 2.0)))
                .intercept(100.0)
                .interceptIncluded(true)
                .trainingStart(Instant.parse("2024-01-01T00:00:00Z"))
                .trainingEnd(Instant.parse("2024-02-01T00:00:00Z"))
                .active(true)
                .build();
    }

    @Test
    void repeatedDetectionIsIdempotentAndAlertsOnce() {
        stubDetectionInputs(outcome(140.0));

        AnomalyDetectionResult first = service.detect("compressors", WINDOW_START, WINDOW_END, null);
        AnomalyDetectionResult second = service.detect("compressors", WINDOW_START, WINDOW_END, null);

        assertThat(first.getFindingsCreated()).isEqualTo(2);
        assertThat(first.getFindingsUnchanged()).isZero();
        assertThat(second.getFindingsCreated()).isZero();
        assertThat(second.getFindingsUpdated()).isZero();
        assertThat(second.getFindingsUnchanged()).isEqualTo(2);
        assertThat(stored).hasSize(2);

        ArgumentCaptor<AnomalyDetectedEvent> events = ArgumentCaptor.forClass(AnomalyDetectedEvent.class);
        verify(eventPublisher, times(1)).publishEvent(events.capture());
        assertThat(events.getValue().getFinding().getFindingTime()).isEqualTo(SPIKE);
        assertThat(events.getValue().getFinding().getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void changedCriticalFindingIsUpdatedAndAlertedAgain() {
        stubDetectionInputs(outcome(140.0), outcome(150.0));

        service.detect("compressors", WINDOW_START, WINDOW_END, null);
        AnomalyDetectionResult rerun = service.detect("compressors", WINDOW_START, WINDOW_END, null);

        assertThat(rerun.getFindingsUpdated()).isEqualTo(1);
        assertThat(rerun.getFindingsUnchanged()).isEqualTo(1);
        verify(eventPublisher, times(2)).publishEvent(any(AnomalyDetectedEvent.class));
        assertThat(stored.get(key("compressors", SPIKE, "deviation")).getActualValue()).isEqualTo(150.0);
    }

    @Test
    void attributesFindingsToLargestConsumer() {
        stubDetectionInputs(outcome(140.0));

        AnomalyDetectionResult result = service.detect("compressors", WINDOW_START, WINDOW_END, 0.05);

        assertThat(result.getContamination()).isEqualTo(0.05);
        assertThat(result.getModelVersion()).isEqualTo(3);
        assertThat(result.getTier()).isEqualTo("1hour");
        assertThat(result.getFindings())
                .filteredOn(f -> f.getFindingTime().equals(SPIKE))
                .singleElement()
                .satisfies(f -> assertThat(f.getEntityId()).isEqualTo("comp-2"));
        // no rollup row for the dip bucket, so the first member is used
        assertThat(result.getFindings())
                .filteredOn(f -> f.getFindingTime().equals(DIP))
                .singleElement()
                .satisfies(f -> assertThat(f.getEntityId()).isEqualTo("comp-1"));
        verify(detector).detect(eq(model), anyList(), anyList(), eq(0.05));
    }

    @Test
    void rejectsInvertedWindowBeforeLoadingAnything() {
        assertThatThrownBy(() -> service.detect("compressors", WINDOW_END, WINDOW_START, null))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(referenceDataService, registry, detector, findingRepository);
    }

    @Test
    void mapsDeviationPointToConsumptionFinding() {
        ScoredPoint point = point(SPIKE, "deviation", 40.0, 4.5, 140.0, 100.0, 0.0);

        AnomalyFinding finding = service.toFinding(group, source, model, point, 1.5,
                Map.of(SPIKE, "comp-2"), WINDOW_END);

        assertThat(finding.getGroupId()).isEqualTo("compressors");
        assertThat(finding.getEntityId()).isEqualTo("comp-2");
        assertThat(finding.getAnomalyType()).isEqualTo(AnomalyType.BASELINE_DEVIATION);
        assertThat(finding.getActualValue()).isEqualTo(140.0);
        assertThat(finding.getExpectedValue()).isEqualTo(100.0);
        assertThat(finding.getDeviation()).isEqualTo(40.0);
        assertThat(finding.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(finding.getConfidence()).isCloseTo(3.0 / 4.5, within(1e-9));
        assertThat(finding.getModelVersion()).isEqualTo(3);
        assertThat(finding.getResolutionState()).isEqualTo(ResolutionState.OPEN);
        assertThat(finding.getDescription()).contains("deviation").contains("140.00").contains("100.00");
    }

    @Test
    void mapsFeaturePointAgainstReferenceMean() {
        ScoredPoint point = point(DIP, "avg_outdoor_temp_c", -12.0, -2.4, 120.0, 118.0, 8.0);

        AnomalyFinding finding = service.toFinding(group, source, model, point, 1.5, Map.of(), WINDOW_END);

        assertThat(finding.getEntityId()).isEqualTo("comp-1");
        assertThat(finding.getAnomalyType()).isEqualTo(AnomalyType.TEMPERATURE_ANOMALY);
        assertThat(finding.getActualValue()).isEqualTo(-12.0);
        assertThat(finding.getExpectedValue()).isEqualTo(8.0);
        assertThat(finding.getSeverity()).isEqualTo(Severity.WARNING);
    }

    @Test
    void listingNeedsGroupOrEntityAndCapsLimit() {
        assertThatThrownBy(() -> service.findings(null, null, null, null, null, null, 10))
                .isInstanceOf(ValidationException.class);

        service.findings("compressors", null, null, null, Severity.CRITICAL, ResolutionState.OPEN, 50_000);

        verify(findingRepository).find("compressors", null, null, null, Severity.CRITICAL, ResolutionState.OPEN, 1000);
    }

    @Test
    void resolvesOpenFinding() {
        AnomalyFinding open = AnomalyFinding.builder().findingId(7L).groupId("compressors").build();
        AnomalyFinding closed = open.toBuilder().resolutionState(ResolutionState.RESOLVED).resolvedBy("ops").build();
        when(findingRepository.findById(7L)).thenReturn(Optional.of(open), Optional.of(closed));
        when(findingRepository.resolve(eq(7L), eq("valve replaced"), eq("ops"), any(Instant.class))).thenReturn(true);

        AnomalyFinding result = service.resolve(7L, "valve replaced", "ops");

        assertThat(result.getResolutionState()).isEqualTo(ResolutionState.RESOLVED);
        assertThat(meterRegistry.counter("anomaly.findings.resolved").count()).isEqualTo(1.0);
    }

    @Test
    void resolvingTwiceOrUnknownFindingFails() {
        AnomalyFinding closed = AnomalyFinding.builder()
                .findingId(7L)
                .groupId("compressors")
                .resolutionState(ResolutionState.RESOLVED)
                .build();
        when(findingRepository.findById(7L)).thenReturn(Optional.of(closed));
        when(findingRepository.findById(8L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.resolve(7L, null, "ops"))
                .isInstanceOf(FindingAlreadyResolvedException.class);
        assertThatThrownBy(() -> service.resolve(8L, null, "ops"))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(findingRepository, never()).resolve(anyLong(), any(), anyString(), any(Instant.class));
    }

    private void stubDetectionInputs(DetectionOutcome first, DetectionOutcome... rest) {
        when(referenceDataService.getGroup("compressors")).thenReturn(group);
        when(referenceDataService.getEnergySource("electricity")).thenReturn(source);
        when(registry.activeModel("compressors")).thenReturn(model);
        when(featureRowAssembler.assemble(any(), any(), anyString(), any(), any(), anyList(), any()))
                .thenReturn(new ArrayList<>());
        when(detector.detect(any(), anyList(), anyList(), anyDouble())).thenReturn(first, rest);
        when(rollupRowRepository.findRows(eq("1hour"), anyList(), any(), any())).thenReturn(List.of(
                rollup("comp-1", SPIKE, 30.0),
                rollup("comp-2", SPIKE, 110.0)));
        lenient().when(findingRepository.upsert(any())).thenAnswer(invocation -> {
            AnomalyFinding finding = invocation.getArgument(0);
            String key = key(finding.getGroupId(), finding.getFindingTime(), finding.getMetric());
            AnomalyFinding previous = stored.put(key, finding);
            if (previous == null) {
                return AnomalyFindingRepository.UpsertOutcome.INSERTED;
            }
            boolean same = previous.getActualValue() == finding.getActualValue()
                    && previous.getExpectedValue() == finding.getExpectedValue()
                    && previous.getSeverity() == finding.getSeverity()
                    && previous.getEntityId().equals(finding.getEntityId());
            return same ? AnomalyFindingRepository.UpsertOutcome.UNCHANGED : AnomalyFindingRepository.UpsertOutcome.UPDATED;
        });
    }

    private DetectionOutcome outcome(double spikeConsumption) {
        List<ScoredPoint> points = List.of(
                point(WINDOW_START, "consumption", 118.0, 0.3, 118.0, 118.0, 118.0, false),
                point(SPIKE, "deviation", spikeConsumption - 100.0, 4.5, spikeConsumption, 100.0, 0.0),
                point(DIP, "consumption", 80.0, -2.5, 80.0, 110.0, 115.0));
        return DetectionOutcome.builder()
                .referenceSource(DetectionOutcome.ReferenceSource.TRAINING_WINDOW)
                .referenceSize(744)
                .threshold(1.5)
                .contamination(0.1)
                .bucketsScored(3)
                .bucketsSkipped(0)
                .points(points)
                .build();
    }

    private static ScoredPoint point(Instant bucketStart, String metric, double metricValue, double z,
                                     double consumption, double predicted, double referenceMean) {
        return point(bucketStart, metric, metricValue, z, consumption, predicted, referenceMean, true);
    }

    private static ScoredPoint point(Instant bucketStart, String metric, double metricValue, double z,
                                     double consumption, double predicted, double referenceMean,
                                     boolean anomalous) {
        return ScoredPoint.builder()
                .bucketStart(bucketStart)
                .bucketEnd(bucketStart.plus(Duration.ofHours(1)))
                .score(3.0)
                .anomalous(anomalous)
                .metric(metric)
                .metricValue(metricValue)
                .metricZScore(z)
                .referenceMean(referenceMean)
                .consumption(consumption)
                .predicted(predicted)
                .values(Map.of())
                .build();
    }

    private static RollupRow rollup(String entityId, Instant bucketStart, double energy) {
        Map<ReadingChannel, ChannelSummary> channels = new EnumMap<>(ReadingChannel.class);
        channels.put(ReadingChannel.ENERGY_KWH, ChannelSummary.of(energy));
        return RollupRow.builder()
                .tier("1hour")
                .entityId(entityId)
                .bucketStart(bucketStart)
                .bucketEnd(bucketStart.plus(Duration.ofHours(1)))
                .sampleCount(1)
                .channels(channels)
                .build();
    }

    private static String key(String groupId, Instant findingTime, String metric) {
        return groupId + "|" + findingTime + "|" + metric;
    }
}
