package com.company.energyperformance.service.deviation;

import com.company.energyperformance.config.ClassificationProperties;
import com.company.energyperformance.domain.BaselineAdjustment;
import com.company.energyperformance.domain.PerformanceRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrendCalculatorTest {

    private static final Instant DAY0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration DAY = Duration.ofDays(1);

    private final TrendCalculator calculator = new TrendCalculator(new ClassificationProperties());

    private static PerformanceRecord day(int index, double deviation) {
        return PerformanceRecord.builder()
                .periodStart(DAY0.plus(DAY.multipliedBy(index)))
                .periodEnd(DAY0.plus(DAY.multipliedBy(index + 1)))
                .deviation(deviation)
                .build();
    }

    @Test
    void accumulatesTheContiguousChainOfEarlierPeriods() {
        List<PerformanceRecord> earlier = List.of(day(0, 5.0), day(1, -2.0), day(2, 4.0));

        TrendCalculator.Trend trend = calculator.compute(DAY0.plus(DAY.multipliedBy(3)), DAY, 1.0,
                earlier, Collections.emptyList());

        assertThat(trend.getCumulativeDeviation()).isCloseTo(8.0, within(1e-9));
        assertThat(trend.getPeriodsInSegment()).isEqualTo(4);
        assertThat(trend.getSegmentId()).isZero();
    }

    @Test
    void adjustmentStartsANewSegment() {
        List<PerformanceRecord> earlier = List.of(day(0, 5.0), day(1, 6.0), day(2, 7.0));
        BaselineAdjustment adjustment = BaselineAdjustment.builder()
                .adjustmentId(42L)
                .effectiveAt(DAY0.plus(DAY.multipliedBy(2)))
                .reason("Process change")
                .build();

        TrendCalculator.Trend trend = calculator.compute(DAY0.plus(DAY.multipliedBy(3)), DAY, 1.0,
                earlier, List.of(adjustment));

        assertThat(trend.getCumulativeDeviation()).isCloseTo(8.0, within(1e-9));
        assertThat(trend.getSegmentId()).isEqualTo(42L);
        assertThat(trend.getPeriodsInSegment()).isEqualTo(2);
    }

    @Test
    void futureAdjustmentDoesNotResetTheCurrentPeriod() {
        BaselineAdjustment later = BaselineAdjustment.builder()
                .adjustmentId(7L)
                .effectiveAt(DAY0.plus(DAY.multipliedBy(10)))
                .build();

        TrendCalculator.Trend trend = calculator.compute(DAY0.plus(DAY), DAY, 2.0,
                List.of(day(0, 3.0)), List.of(later));

        assertThat(trend.getCumulativeDeviation()).isCloseTo(5.0, within(1e-9));
        assertThat(trend.getSegmentId()).isZero();
    }

    @Test
    void sustainedOneSidedDeviationIsDrift() {
        List<PerformanceRecord> earlier = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            earlier.add(day(i, 10.0));
        }

        TrendCalculator.Trend drifting = calculator.compute(DAY0.plus(DAY.multipliedBy(5)), DAY, 10.0,
                earlier, Collections.emptyList());
        TrendCalculator.Trend alternating = calculator.compute(DAY0.plus(DAY.multipliedBy(2)), DAY, 10.0,
                List.of(day(0, 10.0), day(1, -10.0)), Collections.emptyList());

        assertThat(drifting.isSustainedDrift()).isTrue();
        assertThat(alternating.isSustainedDrift()).isFalse();
    }

    @Test
    void prefersThePredecessorClosestInLength() {
        PerformanceRecord week = PerformanceRecord.builder()
                .periodStart(DAY0.minus(Duration.ofDays(6)))
                .periodEnd(DAY0.plus(DAY))
                .deviation(100.0)
                .build();

        TrendCalculator.Trend trend = calculator.compute(DAY0.plus(DAY), DAY, 1.0,
                List.of(week, day(0, 2.0)), Collections.emptyList());

        assertThat(trend.getCumulativeDeviation()).isCloseTo(3.0, within(1e-9));
    }
}
