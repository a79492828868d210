package com.company.energyperformance.service.baseline;

import com.company.energyperformance.domain.ChannelSummary;
import com.company.energyperformance.domain.EnergySource;
import com.company.energyperformance.domain.FeatureRow;
import com.company.energyperformance.domain.RollupRow;
import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.domain.enums.EnergySourceType;
import com.company.energyperformance.domain.enums.ReadingChannel;
import com.company.energyperformance.repository.EquipmentRepository;
import com.company.energyperformance.repository.OperationalStateRepository;
import com.company.energyperformance.repository.RollupRowRepository;
import com.company.energyperformance.service.aggregation.RollupCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeatureRowAssemblerTest {

    private static final Instant T0 = Instant.parse("2024-05-06T08:00:00Z");
    private static final Instant T1 = T0.plus(Duration.ofHours(1));
    private static final Instant END = T1.plus(Duration.ofHours(1));

    @Mock
    private RollupRowRepository rollupRowRepository;
    @Mock
    private OperationalStateRepository stateRepository;
    @Mock
    private EquipmentRepository equipmentRepository;

    private FeatureRowAssembler assembler;
    private List<FeatureDefinition> features;

    private final SignificantUseGroup group = SignificantUseGroup.builder()
            .groupId("press-line").energySourceId("grid").entityIds(List.of("press-a", "press-b")).build();
    private final EnergySource source = EnergySource.builder()
            .energySourceId("grid").type(EnergySourceType.ELECTRICITY).build();

    @BeforeEach
    void setUp() {
        assembler = new FeatureRowAssembler(rollupRowRepository, new RollupCalculator(),
                stateRepository, equipmentRepository);
        features = new FeatureCatalog().resolveForTraining(EnergySourceType.ELECTRICITY,
                List.of("avg_outdoor_temp_c"));
    }

    @Test
    void bucketWithEveryMemberIsUsable() {
        when(rollupRowRepository.findRows(eq("1hour"), any(), any(), any())).thenReturn(List.of(
                row("press-a", T0, 100.0, 12.0),
                row("press-b", T0, 40.0, 12.0)));

        List<FeatureRow> rows = assemble();

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getConsumption()).isEqualTo(140.0);
        assertThat(rows.get(0).getMissingMembers()).isZero();
        assertThat(rows.get(0).isUsable()).isTrue();
    }

    @Test
    void bucketMissingAMemberIsNotUsableOrPredictable() {
        when(rollupRowRepository.findRows(eq("1hour"), any(), any(), any())).thenReturn(List.of(
                row("press-a", T0, 100.0, 12.0),
                row("press-b", T0, 40.0, 12.0),
                row("press-a", T1, 100.0, 13.0)));

        List<FeatureRow> rows = assemble();

        assertThat(rows).hasSize(2);
        FeatureRow partial = rows.get(1);
        assertThat(partial.getBucketStart()).isEqualTo(T1);
        assertThat(partial.getMissingMembers()).isEqualTo(1);
        assertThat(partial.isUsable()).isFalse();
        assertThat(partial.hasAllFeatures()).isFalse();
        assertThat(rows.get(0).isUsable()).isTrue();
    }

    @Test
    void duplicateMemberRowsDoNotMaskAnAbsentMember() {
        when(rollupRowRepository.findRows(eq("1hour"), any(), any(), any())).thenReturn(List.of(
                row("press-a", T0, 50.0, 12.0),
                row("press-a", T0, 50.0, 12.0)));

        List<FeatureRow> rows = assemble();

        assertThat(rows.get(0).getMissingMembers()).isEqualTo(1);
        assertThat(rows.get(0).isUsable()).isFalse();
    }

    private List<FeatureRow> assemble() {
        return assembler.assemble(group, source, "1hour", T0, END, features, Collections.emptyList());
    }

    private static RollupRow row(String entityId, Instant bucketStart, double energy, double outdoorTemp) {
        Map<ReadingChannel, ChannelSummary> channels = new EnumMap<>(ReadingChannel.class);
        channels.put(ReadingChannel.ENERGY_KWH, new ChannelSummary(energy, 60, energy / 60, energy / 60));
        channels.put(ReadingChannel.OUTDOOR_TEMP_C, new ChannelSummary(outdoorTemp * 60, 60, outdoorTemp, outdoorTemp));
        return RollupRow.builder()
                .tier("1hour")
                .entityId(entityId)
                .bucketStart(bucketStart)
                .bucketEnd(bucketStart.plus(Duration.ofHours(1)))
                .sampleCount(60)
                .channels(channels)
                .build();
    }
}
