package com.company.energyperformance.service.kpi;

import com.company.energyperformance.config.KpiProperties;
import com.company.energyperformance.domain.ChannelSummary;
import com.company.energyperformance.domain.EmissionFactor;
import com.company.energyperformance.domain.EnergySource;
import com.company.energyperformance.domain.KpiBundle;
import com.company.energyperformance.domain.RollupRow;
import com.company.energyperformance.domain.TariffRate;
import com.company.energyperformance.domain.enums.EnergySourceType;
import com.company.energyperformance.domain.enums.ReadingChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class KpiCalculatorTest {

    // Monday
    private static final Instant EARLY = Instant.parse("2024-03-04T07:00:00Z");
    private static final Instant MORNING = Instant.parse("2024-03-04T10:00:00Z");
    private static final Instant PERIOD_START = Instant.parse("2024-03-04T00:00:00Z");
    private static final Instant PERIOD_END = Instant.parse("2024-03-05T00:00:00Z");

    private KpiProperties properties;
    private KpiCalculator calculator;
    private EnergySource source;

    @BeforeEach
    void setUp() {
        properties = new KpiProperties();
        calculator = new KpiCalculator(properties);
        source = EnergySource.builder()
                .energySourceId("electricity")
                .type(EnergySourceType.ELECTRICITY)
                .unitCost(0.20)
                .build();
    }

    @Test
    void computesAllIndicatorsInOnePass() {
        KpiBundle bundle = calculator.calculateAll("compressors", source, "1hour", PERIOD_START, PERIOD_END,
                memberRows(), List.of(dayTariff()), emissionFactors());

        assertThat(bundle.getBucketCount()).isEqualTo(2);
        assertThat(bundle.getUnit()).isEqualTo("kWh");
        assertThat(bundle.getTotalConsumption()).isCloseTo(280.0, within(1e-9));
        assertThat(bundle.getTotalProduction()).isCloseTo(140.0, within(1e-9));
        assertThat(bundle.getSpecificConsumption()).isCloseTo(2.0, within(1e-9));

        // demand adds up across members within a bucket
        assertThat(bundle.getAverageDemand()).isCloseTo(140.0, within(1e-9));
        assertThat(bundle.getPeakDemand()).isCloseTo(200.0, within(1e-9));
        assertThat(bundle.getLoadFactor()).isCloseTo(0.7, within(1e-9));

        assertThat(bundle.getTotalCost()).isCloseTo(160.0 * 0.20 + 120.0 * 0.30, within(1e-9));
        assertThat(bundle.getCostByTariff()).containsOnlyKeys(KpiCalculator.UNIT_COST_KEY, "Weekday day");
        assertThat(bundle.getCostByTariff().get("Weekday day")).isCloseTo(36.0, within(1e-9));
        assertThat(bundle.getBucketsAtDefaultRate()).isEqualTo(1);
        assertThat(bundle.getCostPerUnit()).isCloseTo(68.0 / 140.0, within(1e-9));

        assertThat(bundle.getEmissionFactor()).isEqualTo(0.35);
        assertThat(bundle.getEmissionsKgCo2()).isCloseTo(98.0, within(1e-9));
        assertThat(bundle.getEmissionsPerUnit()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void tariffWindowsFollowConfiguredZone() {
        properties.setZone("Europe/Berlin");

        KpiBundle bundle = calculator.calculateAll("compressors", source, "1hour", PERIOD_START, PERIOD_END,
                memberRows(), List.of(dayTariff()), emissionFactors());

        // 07:00Z is 08:00 in Berlin, inside the day window
        assertThat(bundle.getBucketsAtDefaultRate()).isZero();
        assertThat(bundle.getTotalCost()).isCloseTo(280.0 * 0.30, within(1e-9));
    }

    @Test
    void higherPriorityTariffWins() {
        TariffRate override = TariffRate.builder()
                .tariffId(9L)
                .name("Critical peak")
                .startTime(LocalTime.of(9, 0))
                .endTime(LocalTime.of(11, 0))
                .rate(1.0)
                .priority(5)
                .build();

        KpiBundle bundle = calculator.calculateAll("compressors", source, "1hour", PERIOD_START, PERIOD_END,
                memberRows(), List.of(dayTariff(), override), emissionFactors());

        assertThat(bundle.getCostByTariff()).containsKey("Critical peak").doesNotContainKey("Weekday day");
        assertThat(bundle.getCostByTariff().get("Critical peak")).isCloseTo(120.0, within(1e-9));
    }

    @Test
    void fallsBackToDefaultsWithoutReferenceData() {
        EnergySource bare = EnergySource.builder()
                .energySourceId("electricity")
                .type(EnergySourceType.ELECTRICITY)
                .build();

        KpiBundle bundle = calculator.calculateAll("compressors", bare, "1hour", PERIOD_START, PERIOD_END,
                memberRows(), Collections.emptyList(), Collections.emptyList());

        assertThat(bundle.getCostByTariff()).containsOnlyKeys(KpiCalculator.DEFAULT_RATE_KEY);
        assertThat(bundle.getTotalCost()).isCloseTo(280.0 * 0.15, within(1e-9));
        assertThat(bundle.getBucketsAtDefaultRate()).isEqualTo(2);
        assertThat(bundle.getEmissionFactor()).isEqualTo(0.45);
    }

    @Test
    void sourceEmissionFactorUsedWhenNoScopedFactorApplies() {
        source.setEmissionFactor(0.5);
        EmissionFactor future = EmissionFactor.builder().validFrom(LocalDate.of(2025, 1, 1)).factor(0.1).build();

        double factor = calculator.emissionFactor(List.of(future), source, LocalDate.of(2024, 3, 4));

        assertThat(factor).isEqualTo(0.5);
    }

    @Test
    void ratiosAreAbsentWithoutProduction() {
        List<RollupRow> rows = List.of(row("comp-1", EARLY, 50.0, 0.0, null));

        KpiBundle bundle = calculator.calculateAll("compressors", source, "1hour", PERIOD_START, PERIOD_END,
                rows, Collections.emptyList(), Collections.emptyList());

        assertThat(bundle.getSpecificConsumption()).isNull();
        assertThat(bundle.getCostPerUnit()).isNull();
        assertThat(bundle.getEmissionsPerUnit()).isNull();
        assertThat(bundle.getPeakDemand()).isZero();
        assertThat(bundle.getLoadFactor()).isZero();
    }

    @Test
    void emptyPeriodGivesZeroTotals() {
        KpiBundle bundle = calculator.calculateAll("compressors", source, "1hour", PERIOD_START, PERIOD_END,
                Collections.emptyList(), List.of(dayTariff()), emissionFactors());

        assertThat(bundle.getBucketCount()).isZero();
        assertThat(bundle.getTotalConsumption()).isZero();
        assertThat(bundle.getTotalCost()).isZero();
        assertThat(bundle.getEmissionsKgCo2()).isZero();
    }

    private static List<RollupRow> memberRows() {
        return List.of(
                row("comp-1", EARLY, 100.0, 50.0, new ChannelSummary(200.0, 2, 80.0, 120.0)),
                row("comp-2", EARLY, 60.0, 30.0, new ChannelSummary(60.0, 1, 60.0, 80.0)),
                row("comp-1", MORNING, 80.0, 40.0, new ChannelSummary(80.0, 1, 80.0, 90.0)),
                row("comp-2", MORNING, 40.0, 20.0, new ChannelSummary(40.0, 1, 40.0, 50.0)));
    }

    private static RollupRow row(String entityId, Instant bucketStart, double energy, double production,
                                 ChannelSummary power) {
        Map<ReadingChannel, ChannelSummary> channels = new EnumMap<>(ReadingChannel.class);
        channels.put(ReadingChannel.ENERGY_KWH, ChannelSummary.of(energy));
        channels.put(ReadingChannel.PRODUCTION_COUNT, ChannelSummary.of(production));
        if (power != null) {
            channels.put(ReadingChannel.POWER_KW, power);
        }
        return RollupRow.builder()
                .tier("1hour")
                .entityId(entityId)
                .bucketStart(bucketStart)
                .bucketEnd(bucketStart.plus(Duration.ofHours(1)))
                .sampleCount(60)
                .channels(channels)
                .build();
    }

    private static TariffRate dayTariff() {
        return TariffRate.builder()
                .tariffId(1L)
                .name("Weekday day")
                .daysOfWeek(List.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY,
                        DayOfWeek.THURSDAY, DayOfWeek.FRIDAY))
                .startTime(LocalTime.of(8, 0))
                .endTime(LocalTime.of(20, 0))
                .rate(0.30)
                .priority(1)
                .build();
    }

    private static List<EmissionFactor> emissionFactors() {
        return List.of(
                EmissionFactor.builder().factorId(1L).validFrom(LocalDate.of(2023, 1, 1)).factor(0.40).build(),
                EmissionFactor.builder().factorId(2L).validFrom(LocalDate.of(2024, 1, 1)).factor(0.35).build(),
                EmissionFactor.builder().factorId(3L).validFrom(LocalDate.of(2025, 1, 1)).factor(0.10).build());
    }
}
