package com.company.energyperformance.service.kpi;

import com.company.energyperformance.config.KpiProperties;
import com.company.energyperformance.domain.*;
import com.company.energyperformance.domain.enums.ReadingChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;

/**
 * Energy indicators of a group from its member rollup rows and the reference tariff and emission
 * tables. Member rows are combined per bucket in one pass; demand is the sum of member demand within
 * a bucket, so the group peak is the largest sum of member maxima.
 */
@Component
@RequiredArgsConstructor
public class KpiCalculator {

    static final String UNIT_COST_KEY = "unit-cost";
    static final String DEFAULT_RATE_KEY = "default-rate";

    private final KpiProperties properties;

    public KpiBundle calculateAll(String groupId, EnergySource source, String tier, Instant start, Instant end,
                                  List<RollupRow> memberRows, List<TariffRate> tariffs,
                                  List<EmissionFactor> emissionFactors) {
        ReadingChannel consumptionChannel = source.resolvedConsumptionChannel();
        ReadingChannel demandChannel = source.resolvedDemandChannel();

        Map<Instant, BucketTotals> buckets = new TreeMap<>();
        for (RollupRow row : memberRows) {
            BucketTotals totals = buckets.computeIfAbsent(row.getBucketStart(), b -> new BucketTotals());
            Double consumption = row.sum(consumptionChannel);
            if (consumption != null) {
                totals.consumption += consumption;
            }
            Double production = row.sum(ReadingChannel.PRODUCTION_COUNT);
            if (production != null) {
                totals.production += production;
            }
            Double demand = demandChannel != null ? row.mean(demandChannel) : null;
            if (demand != null) {
                totals.demand += demand;
                totals.hasDemand = true;
            }
            Double peak = demandChannel != null ? row.max(demandChannel) : null;
            if (peak != null) {
                totals.peak += peak;
            }
        }

        ZoneId zone = ZoneId.of(properties.getZone());
        List<TariffRate> byPriority = new ArrayList<>(tariffs);
        byPriority.sort(Comparator.comparingInt(TariffRate::getPriority).reversed()
                .thenComparing(t -> t.getTariffId() != null ? t.getTariffId() : Long.MAX_VALUE));

        double totalConsumption = 0.0;
        double totalProduction = 0.0;
        double peakDemand = 0.0;
        double demandSum = 0.0;
        int demandBuckets = 0;
        double totalCost = 0.0;
        int atDefaultRate = 0;
        Map<String, Double> costByTariff = new LinkedHashMap<>();

        for (Map.Entry<Instant, BucketTotals> entry : buckets.entrySet()) {
            BucketTotals totals = entry.getValue();
            totalConsumption += totals.consumption;
            totalProduction += totals.production;
            if (totals.hasDemand) {
                demandSum += totals.demand;
                demandBuckets++;
            }
            peakDemand = Math.max(peakDemand, totals.peak);

            TariffRate tariff = matchingTariff(byPriority, entry.getKey(), zone);
            double rate;
            String key;
            if (tariff != null) {
                rate = tariff.getRate();
                key = tariff.getName() != null ? tariff.getName() : "tariff-" + tariff.getTariffId();
            } else {
                atDefaultRate++;
                if (source.getUnitCost() != null) {
                    rate = source.getUnitCost();
                    key = UNIT_COST_KEY;
                } else {
                    rate = properties.getDefaultRate();
                    key = DEFAULT_RATE_KEY;
                }
            }
            double cost = totals.consumption * rate;
            totalCost += cost;
            costByTariff.merge(key, cost, Double::sum);
        }

        double averageDemand = demandBuckets > 0 ? demandSum / demandBuckets : 0.0;
        double factor = emissionFactor(emissionFactors, source, LocalDate.ofInstant(start, zone));
        double emissions = totalConsumption * factor;

        return KpiBundle.builder()
                .groupId(groupId)
                .periodStart(start)
                .periodEnd(end)
                .tier(tier)
                .unit(source.resolvedUnit())
                .totalConsumption(totalConsumption)
                .totalProduction(totalProduction)
                .specificConsumption(perUnit(totalConsumption, totalProduction))
                .peakDemand(peakDemand)
                .averageDemand(averageDemand)
                .loadFactor(peakDemand > 0.0 ? averageDemand / peakDemand : 0.0)
                .totalCost(totalCost)
                .costPerUnit(perUnit(totalCost, totalProduction))
                .costByTariff(costByTariff)
                .bucketsAtDefaultRate(atDefaultRate)
                .emissionsKgCo2(emissions)
                .emissionsPerUnit(perUnit(emissions, totalProduction))
                .emissionFactor(factor)
                .bucketCount(buckets.size())
                .build();
    }

    TariffRate matchingTariff(List<TariffRate> byPriority, Instant bucketStart, ZoneId zone) {
        for (TariffRate tariff : byPriority) {
            if (tariff.appliesAt(bucketStart.atZone(zone))) {
                return tariff;
            }
        }
        return null;
    }

    /**
     * Most recently started scoped factor valid on the date, else the source factor, else the default
     */
    double emissionFactor(List<EmissionFactor> factors, EnergySource source, LocalDate date) {
        EmissionFactor best = null;
        for (EmissionFactor candidate : factors) {
            if (!candidate.appliesOn(date)) {
                continue;
            }
            if (best == null || startsLater(candidate, best)) {
                best = candidate;
            }
        }
        if (best != null) {
            return best.getFactor();
        }
        if (source.getEmissionFactor() != null) {
            return source.getEmissionFactor();
        }
        return properties.getDefaultEmissionFactor();
    }

    private static boolean startsLater(EmissionFactor a, EmissionFactor b) {
        if (a.getValidFrom() == null) {
            return false;
        }
        return b.getValidFrom() == null || a.getValidFrom().isAfter(b.getValidFrom());
    }

    private static Double perUnit(double value, double production) {
        return production > 0.0 ? value / production : null;
    }

    private static final class BucketTotals {
        private double consumption;
        private double production;
        private double demand;
        private double peak;
        private boolean hasDemand;
    }
}
