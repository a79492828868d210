package com.company.energyperformance.service.baseline;

import com.company.energyperformance.config.AggregationProperties;
import com.company.energyperformance.config.BaselineProperties;
import com.company.energyperformance.domain.BaselineModel;
import com.company.energyperformance.domain.EnergySource;
import com.company.energyperformance.domain.FeatureRow;
import com.company.energyperformance.domain.Prediction;
import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.domain.enums.EnergySourceType;
import com.company.energyperformance.event.BaselineActivatedEvent;
import com.company.energyperformance.exception.ErrorKind;
import com.company.energyperformance.exception.InsufficientDataException;
import com.company.energyperformance.exception.NoActiveModelException;
import com.company.energyperformance.exception.QualityGateFailureException;
import com.company.energyperformance.exception.UnknownFeatureException;
import com.company.energyperformance.repository.InMemoryBaselineModelRepository;
import com.company.energyperformance.service.ReferenceDataService;
import com.company.energyperformance.service.aggregation.TierGraph;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BaselineModelRegistryTest {

    private static final Instant START = Instant.parse("2024-02-01T00:00:00Z");
    private static final Instant END = START.plus(Duration.ofHours(72));

    @Mock
    private ReferenceDataService referenceDataService;
    @Mock
    private FeatureRowAssembler featureRowAssembler;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private InMemoryBaselineModelRepository modelRepository;
    private BaselineModelRegistry registry;

    private final SignificantUseGroup electricGroup = SignificantUseGroup.builder()
            .groupId("press-line-elec").name("Press line power").energySourceId("grid")
            .entityIds(new ArrayList<>(List.of("press-1"))).region("EU-DE").active(true).build();
    private final SignificantUseGroup steamGroup = SignificantUseGroup.builder()
            .groupId("press-line-steam").name("Press line steam").energySourceId("steam")
            .entityIds(new ArrayList<>(List.of("press-1"))).region("EU-DE").active(true).build();
    private final EnergySource grid = EnergySource.builder()
            .energySourceId("grid").name("Grid").type(EnergySourceType.ELECTRICITY).unit("kWh").build();
    private final EnergySource steam = EnergySource.builder()
            .energySourceId("steam").name("Steam").type(EnergySourceType.STEAM).unit("kg").build();

    @BeforeEach
    void setUp() {
        modelRepository = new InMemoryBaselineModelRepository();
        BaselineProperties properties = new BaselineProperties();
        registry = new BaselineModelRegistry(modelRepository, referenceDataService,
                new TierGraph(new AggregationProperties()), new FeatureCatalog(), featureRowAssembler,
                new LinearRegressionFitter(), new BaselinePredictor(), properties, eventPublisher,
                new SimpleMeterRegistry(), OpenTelemetry.noop().getTracer("test"));

        lenient().when(referenceDataService.getGroup("press-line-elec")).thenReturn(electricGroup);
        lenient().when(referenceDataService.getGroup("press-line-steam")).thenReturn(steamGroup);
        lenient().when(referenceDataService.getEnergySource("grid")).thenReturn(grid);
        lenient().when(referenceDataService.getEnergySource("steam")).thenReturn(steam);
    }

    /**
     * Hourly rows whose consumption is an exact linear function of the six default electricity
     * features plus small noise
     */
    static List<FeatureRow> electricRows(int count, long seed) {
        Random random = new Random(seed);
        List<FeatureRow> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, Double> features = new LinkedHashMap<>();
            double production = 500 + random.nextInt(1000);
            double outdoor = -5 + random.nextDouble() * 30;
            double throughput = 40 + random.nextDouble() * 60;
            double machine = 45 + random.nextDouble() * 25;
            double loadFactor = 0.3 + random.nextDouble() * 0.6;
            double pressure = 5 + random.nextDouble() * 3;
            features.put("total_production_count", production);
            features.put("avg_outdoor_temp_c", outdoor);
            features.put("avg_throughput_units_per_hour", throughput);
            features.put("avg_machine_temp_c", machine);
            features.put("avg_load_factor", loadFactor);
            features.put("avg_pressure_bar", pressure);
            double consumption = 45.2 + 0.03 * production - 1.2 * outdoor + 0.5 * throughput
                    + 0.8 * machine + 120 * loadFactor + 3 * pressure + random.nextGaussian() * 0.3;
            Instant bucket = START.plus(Duration.ofHours(i));
            rows.add(FeatureRow.builder()
                    .bucketStart(bucket)
                    .bucketEnd(bucket.plus(Duration.ofHours(1)))
                    .features(features)
                    .consumption(consumption)
                    .build());
        }
        return rows;
    }

    static List<FeatureRow> steamRows(int count, long seed) {
        Random random = new Random(seed);
        List<FeatureRow> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, Double> features = new LinkedHashMap<>();
            double production = 500 + random.nextInt(1000);
            double pressure = 8 + random.nextDouble() * 4;
            double outdoor = -5 + random.nextDouble() * 30;
            features.put("total_production_count", production);
            features.put("avg_pressure_bar", pressure);
            features.put("avg_outdoor_temp_c", outdoor);
            Instant bucket = START.plus(Duration.ofHours(i));
            rows.add(FeatureRow.builder()
                    .bucketStart(bucket)
                    .bucketEnd(bucket.plus(Duration.ofHours(1)))
                    .features(features)
                    .consumption(200 + 0.4 * production + 12 * pressure - 2 * outdoor + random.nextGaussian())
                    .build());
        }
        return rows;
    }

    private TrainingCommand command(String groupId) {
        return TrainingCommand.builder()
                .groupId(groupId)
                .windowStart(START)
                .windowEnd(END)
                .trainedBy("analyst@example.com")
                .build();
    }

    @Test
    void wellFittedBaselineIsStoredActiveAndPredictsPositiveEnergy() {
        when(featureRowAssembler.assemble(eq(electricGroup), eq(grid), eq("1hour"), eq(START), eq(END), any(), any()))
                .thenReturn(electricRows(72, 7L));

        BaselineModel model = registry.train(command("press-line-elec"));

        assertThat(model.getVersion()).isEqualTo(1);
        assertThat(model.isActive()).isTrue();
        assertThat(model.isQualityGatePassed()).isTrue();
        assertThat(model.getSampleCount()).isEqualTo(72);
        assertThat(model.getFeatureNames()).hasSize(6);
        assertThat(model.getRSquared()).isGreaterThan(0.99);
        assertThat(model.getPValues()).containsOnlyKeys(model.getFeatureNames());
        verify(eventPublisher).publishEvent(any(BaselineActivatedEvent.class));

        Map<String, Double> typical = new LinkedHashMap<>(electricRows(1, 99L).get(0).getFeatures());
        Prediction prediction = registry.predict("press-line-elec", typical);
        assertThat(prediction.getValue()).isPositive();
        assertThat(prediction.isClamped()).isFalse();
        assertThat(prediction.getModelVersion()).isEqualTo(1);
    }

    @Test
    void tooFewSamplesIsRejectedWithoutCreatingAModel() {
        when(featureRowAssembler.assemble(eq(electricGroup), eq(grid), eq("1hour"), eq(START), eq(END), any(), any()))
                .thenReturn(electricRows(40, 3L));
        TrainingCommand command = command("press-line-elec");
        command.setMinSamples(1000);

        assertThatThrownBy(() -> registry.train(command))
                .isInstanceOfSatisfying(InsufficientDataException.class, e -> {
                    assertThat(e.getSamplesFound()).isEqualTo(40);
                    assertThat(e.getSamplesRequired()).isEqualTo(1000);
                    assertThat(e.getDetails()).containsEntry("samples_found", 40)
                            .containsEntry("samples_required", 1000);
                });
        assertThat(modelRepository.rowCount()).isZero();
        assertThatThrownBy(() -> registry.activeModel("press-line-elec"))
                .isInstanceOf(NoActiveModelException.class);
    }

    @Test
    void fitBelowTheQualityGateIsStoredInactive() {
        when(featureRowAssembler.assemble(eq(electricGroup), eq(grid), eq("1hour"), eq(START), eq(END), any(), any()))
                .thenReturn(electricRows(72, 7L));
        TrainingCommand command = command("press-line-elec");
        command.setMinRSquared(1.0);

        BaselineModel model = registry.train(command);

        assertThat(model.isActive()).isFalse();
        assertThat(model.isQualityGatePassed()).isFalse();
        assertThat(model.getQualityGateReason()).contains("below required");
        assertThat(modelRepository.rowCount()).isEqualTo(1);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void lineagesOfTwoEnergySourcesOnOneEntityStayIndependent() {
        when(featureRowAssembler.assemble(eq(electricGroup), eq(grid), any(), any(), any(), any(), any()))
                .thenReturn(electricRows(72, 11L));
        when(featureRowAssembler.assemble(eq(steamGroup), eq(steam), any(), any(), any(), any(), any()))
                .thenReturn(steamRows(72, 13L));

        registry.train(command("press-line-elec"));
        registry.train(command("press-line-elec"));
        BaselineModel steamModel = registry.train(command("press-line-steam"));

        assertThat(registry.history("press-line-elec")).extracting(BaselineModel::getVersion).containsExactly(2, 1);
        assertThat(registry.history("press-line-steam")).extracting(BaselineModel::getVersion).containsExactly(1);
        assertThat(steamModel.getEnergySourceId()).isEqualTo("steam");

        registry.deactivate("press-line-elec", 2, "Meter replaced");

        assertThatThrownBy(() -> registry.activeModel("press-line-elec"))
                .isInstanceOf(NoActiveModelException.class);
        assertThat(registry.activeModel("press-line-steam").getVersion()).isEqualTo(1);
        assertThat(registry.activeModel("press-line-steam").isActive()).isTrue();
    }

    @Test
    void unknownFeatureIsRejectedBeforeAnyDataIsRead() {
        TrainingCommand command = command("press-line-elec");
        command.setFeatures(List.of("total_production_count", "avg_humidity_pct"));

        assertThatThrownBy(() -> registry.train(command))
                .isInstanceOfSatisfying(UnknownFeatureException.class, e ->
                        assertThat(e.getUnknownFeatures()).containsExactly("avg_humidity_pct"))
                .hasMessageContaining("avg_humidity_pct");
        verifyNoInteractions(featureRowAssembler);
        assertThat(modelRepository.rowCount()).isZero();
    }

    @Test
    void activatingAnOlderVersionSupersedesTheCurrentOne() {
        when(featureRowAssembler.assemble(eq(electricGroup), eq(grid), any(), any(), any(), any(), any()))
                .thenReturn(electricRows(72, 5L));
        registry.train(command("press-line-elec"));
        registry.train(command("press-line-elec"));

        registry.activate("press-line-elec", 1);

        List<BaselineModel> history = registry.history("press-line-elec");
        assertThat(history).filteredOn(BaselineModel::isActive).extracting(BaselineModel::getVersion).containsExactly(1);
        assertThat(history.get(0).getDeactivationReason()).isEqualTo("Superseded by version 1");
    }

    @Test
    void versionThatFailedTheQualityGateCannotBeActivatedByHand() {
        when(featureRowAssembler.assemble(eq(electricGroup), eq(grid), any(), any(), any(), any(), any()))
                .thenReturn(electricRows(72, 19L));
        registry.train(command("press-line-elec"));
        TrainingCommand strict = command("press-line-elec");
        strict.setMinRSquared(1.0);
        registry.train(strict);

        assertThatThrownBy(() -> registry.activate("press-line-elec", 2))
                .isInstanceOfSatisfying(QualityGateFailureException.class, e ->
                        assertThat(e.getKind()).isEqualTo(ErrorKind.QUALITY_GATE_FAILURE))
                .hasMessageContaining("version 2");

        assertThat(registry.activeModel("press-line-elec").getVersion()).isEqualTo(1);
        verify(eventPublisher, times(1)).publishEvent(any(BaselineActivatedEvent.class));
    }

    @Test
    void concurrentTrainingLeavesExactlyOneActiveVersion() throws Exception {
        when(featureRowAssembler.assemble(eq(electricGroup), eq(grid), any(), any(), any(), any(), any()))
                .thenAnswer(inv -> electricRows(72, 17L));

        int runs = 8;
        ExecutorService executor = Executors.newFixedThreadPool(runs);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BaselineModel>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < runs; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return registry.train(command("press-line-elec"));
                }));
            }
            start.countDown();
            for (Future<BaselineModel> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<BaselineModel> history = registry.history("press-line-elec");
        assertThat(history).hasSize(runs);
        assertThat(history).extracting(BaselineModel::getVersion)
                .containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(history).filteredOn(BaselineModel::isActive).hasSize(1);
        assertThat(modelRepository.maxActiveObserved()).isEqualTo(1);
    }
}
