package com.company.energyperformance.scheduled;

import com.company.energyperformance.domain.KpiBundle;
import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.repository.SignificantUseGroupRepository;
import com.company.energyperformance.service.kpi.KpiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "energy.kpi.summary.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class KpiSummaryJob {

    private final KpiService kpiService;
    private final SignificantUseGroupRepository groupRepository;

    /**
     * Previous UTC day's indicators for every active group, at 00:30
     */
    @Scheduled(cron = "${energy.kpi.summary.cron:0 30 0 * * *}", zone = "UTC")
    public void summarizePreviousDay() {
        Instant end = Instant.now().truncatedTo(ChronoUnit.DAYS);
        Instant start = end.minus(1, ChronoUnit.DAYS);

        List<SignificantUseGroup> groups = groupRepository.findAllActive();

        int succeeded = 0;
        int failed = 0;

        for (SignificantUseGroup group : groups) {
            try {
                KpiBundle kpis = kpiService.calculate(group.getGroupId(), start, end);
                log.info("Daily KPIs {} {}: consumption {} {}, peak demand {}, load factor {}, cost {}, emissions {} kg{}",
                        group.getGroupId(), start,
                        String.format(Locale.ROOT, "%.2f", kpis.getTotalConsumption()), kpis.getUnit(),
                        String.format(Locale.ROOT, "%.2f", kpis.getPeakDemand()),
                        String.format(Locale.ROOT, "%.3f", kpis.getLoadFactor()),
                        String.format(Locale.ROOT, "%.2f", kpis.getTotalCost()),
                        String.format(Locale.ROOT, "%.2f", kpis.getEmissionsKgCo2()),
                        kpis.isStaleData() ? " (provisional)" : "");
                succeeded++;
            } catch (Exception e) {
                log.error("KPI summary failed for group {}", group.getGroupId(), e);
                failed++;
            }
        }

        log.info("KPI summary completed: {} succeeded, {} failed", succeeded, failed);
    }
}
