package com.company.energyperformance.scheduled;

import com.company.energyperformance.domain.Equipment;
import com.company.energyperformance.repository.EquipmentRepository;
import com.company.energyperformance.service.aggregation.RefreshResult;
import com.company.energyperformance.service.aggregation.RollupRefreshService;
import com.company.energyperformance.service.aggregation.TierDefinition;
import com.company.energyperformance.service.aggregation.TierGraph;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Registers one fixed-delay refresh task per tier of the graph. A coarse tier only picks up
 * buckets its source has already covered, so tiers can tick independently.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "energy.aggregation.refresh.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class TierRefreshScheduler implements SchedulingConfigurer {

    private final TierGraph tierGraph;
    private final RollupRefreshService refreshService;
    private final EquipmentRepository equipmentRepository;
    private final MeterRegistry meterRegistry;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        for (TierDefinition tier : tierGraph.inTopologicalOrder()) {
            registrar.addFixedDelayTask(() -> refreshTier(tier.getName()), tier.getRefreshInterval());
            log.info("Scheduled refresh of tier {} every {}", tier.getName(), tier.getRefreshInterval());
        }
    }

    public void refreshTier(String tierName) {
        Instant now = Instant.now();
        List<Equipment> entities;
        try {
            entities = equipmentRepository.findAllActive();
        } catch (Exception e) {
            log.error("Could not list entities for tier {} refresh", tierName, e);
            meterRegistry.counter("rollup.refresh.pass.failures", "tier", tierName).increment();
            return;
        }

        int successCount = 0;
        int skippedCount = 0;
        int failureCount = 0;

        for (Equipment entity : entities) {
            try {
                RefreshResult result = refreshService.refresh(tierName, entity.getEntityId(), now);
                if (result.isSkipped()) {
                    skippedCount++;
                } else {
                    successCount++;
                }
            } catch (Exception e) {
                log.error("Refresh of tier {} failed for entity {}", tierName, entity.getEntityId(), e);
                failureCount++;
            }
        }

        log.info("Tier {} refresh completed: {} succeeded, {} skipped, {} failed",
                tierName, successCount, skippedCount, failureCount);
    }
}
