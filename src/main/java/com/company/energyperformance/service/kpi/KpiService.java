package com.company.energyperformance.service.kpi;

import com.company.energyperformance.domain.EnergySource;
import com.company.energyperformance.domain.KpiBundle;
import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.exception.ValidationException;
import com.company.energyperformance.service.ReferenceDataService;
import com.company.energyperformance.service.aggregation.RollupQueryResult;
import com.company.energyperformance.service.aggregation.RollupQueryService;
import com.company.energyperformance.service.aggregation.TierDefinition;
import com.company.energyperformance.service.aggregation.TierGraph;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class KpiService {

    private final ReferenceDataService referenceDataService;
    private final RollupQueryService rollupQueryService;
    private final TierGraph tierGraph;
    private final KpiCalculator calculator;
    private final MeterRegistry meterRegistry;

    /**
     * Indicator bundle of a group, read from the finest tier aligned with the period
     */
    public KpiBundle calculate(String groupId, Instant start, Instant end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new ValidationException("Period start must be before its end",
                    Map.of("start", String.valueOf(start), "end", String.valueOf(end)));
        }
        Instant now = Instant.now();
        SignificantUseGroup group = referenceDataService.getGroup(groupId);
        EnergySource source = referenceDataService.getEnergySource(group.getEnergySourceId());
        TierDefinition tier = tierGraph.finestApplicable(start, end, now)
                .orElseThrow(() -> new ValidationException("No tier is aligned with the requested period",
                        Map.of("start", start.toString(), "end", end.toString())));

        RollupQueryResult rows = rollupQueryService.queryGroupMembers(group, tier.getName(), start, end, now);
        KpiBundle bundle = calculator.calculateAll(groupId, source, tier.getName(), start, end, rows.getRows(),
                referenceDataService.getTariffs(group.getRegion(), source.getType()),
                referenceDataService.getEmissionFactors(group.getRegion(), source.getType()));
        bundle.setStaleData(rows.isStaleData());

        meterRegistry.counter("kpi.calculations", "tier", tier.getName()).increment();
        if (bundle.getBucketsAtDefaultRate() > 0) {
            log.debug("Group {}: {} of {} buckets priced without a matching tariff",
                    groupId, bundle.getBucketsAtDefaultRate(), bundle.getBucketCount());
        }
        return bundle;
    }
}
