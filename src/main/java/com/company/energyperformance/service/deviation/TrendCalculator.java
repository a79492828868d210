package com.company.energyperformance.service.deviation;

import com.company.energyperformance.config.ClassificationProperties;
import com.company.energyperformance.domain.BaselineAdjustment;
import com.company.energyperformance.domain.PerformanceRecord;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cumulative deviation (CUSUM) within a trend segment. A baseline adjustment opens a new segment:
 * periods starting at or after its effective instant no longer accumulate earlier deviations.
 */
@Component
@RequiredArgsConstructor
public class TrendCalculator {

    private final ClassificationProperties properties;

    @Getter
    public static class Trend {
        private final double cumulativeDeviation;
        private final boolean sustainedDrift;
        private final Long segmentId;
        private final int periodsInSegment;

        Trend(double cumulativeDeviation, boolean sustainedDrift, Long segmentId, int periodsInSegment) {
            this.cumulativeDeviation = cumulativeDeviation;
            this.sustainedDrift = sustainedDrift;
            this.segmentId = segmentId;
            this.periodsInSegment = periodsInSegment;
        }
    }

    /**
     * @param periodStart  start of the period being evaluated
     * @param periodLength its length, used to pick comparable predecessors
     * @param deviation    its deviation
     * @param earlier      stored records ending at or before {@code periodStart}, any order
     * @param adjustments  adjustments of the group, any order
     */
    public Trend compute(Instant periodStart, Duration periodLength, double deviation,
                         List<PerformanceRecord> earlier, List<BaselineAdjustment> adjustments) {
        BaselineAdjustment segmentStart = null;
        for (BaselineAdjustment adjustment : adjustments) {
            if (!adjustment.getEffectiveAt().isAfter(periodStart)
                    && (segmentStart == null || adjustment.getEffectiveAt().isAfter(segmentStart.getEffectiveAt()))) {
                segmentStart = adjustment;
            }
        }
        Instant segmentFrom = segmentStart != null ? segmentStart.getEffectiveAt() : Instant.MIN;

        List<Double> deviations = new ArrayList<>(predecessorChain(periodStart, periodLength, earlier, segmentFrom));
        deviations.add(deviation);

        double cumulative = 0.0;
        double absoluteSum = 0.0;
        for (double value : deviations) {
            cumulative += value;
            absoluteSum += Math.abs(value);
        }
        double meanAbsolute = absoluteSum / deviations.size();

        boolean drift = trailingSameSign(deviations) >= properties.getDriftMinPeriods()
                && Math.abs(cumulative) > properties.getDriftMultiple() * meanAbsolute;

        return new Trend(cumulative, drift, segmentStart != null ? segmentStart.getAdjustmentId() : 0L,
                deviations.size());
    }

    /**
     * Contiguous run of earlier periods ending at {@code periodStart}, walking backwards, in
     * chronological order. Among records ending at the same instant the one closest in length wins.
     */
    private List<Double> predecessorChain(Instant periodStart, Duration periodLength,
                                          List<PerformanceRecord> earlier, Instant segmentFrom) {
        List<Double> chain = new ArrayList<>();
        Instant cursor = periodStart;
        while (true) {
            PerformanceRecord best = null;
            long bestDistance = Long.MAX_VALUE;
            for (PerformanceRecord record : earlier) {
                if (!record.getPeriodEnd().equals(cursor) || record.getPeriodStart().isBefore(segmentFrom)) {
                    continue;
                }
                long length = Duration.between(record.getPeriodStart(), record.getPeriodEnd()).getSeconds();
                long distance = Math.abs(length - periodLength.getSeconds());
                if (distance < bestDistance) {
                    best = record;
                    bestDistance = distance;
                }
            }
            if (best == null) {
                break;
            }
            chain.add(best.getDeviation());
            cursor = best.getPeriodStart();
        }
        Collections.reverse(chain);
        return chain;
    }

    private int trailingSameSign(List<Double> deviations) {
        int count = 0;
        double sign = 0.0;
        for (int i = deviations.size() - 1; i >= 0; i--) {
            double current = Math.signum(deviations.get(i));
            if (current == 0.0 || (sign != 0.0 && current != sign)) {
                break;
            }
            sign = current;
            count++;
        }
        return count;
    }
}
