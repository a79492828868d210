package com.company.energyperformance.scheduled;

import com.company.energyperformance.domain.Equipment;
import com.company.energyperformance.repository.EquipmentRepository;
import com.company.energyperformance.service.aggregation.RetentionService;
import com.company.energyperformance.service.aggregation.TierDefinition;
import com.company.energyperformance.service.aggregation.TierGraph;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "energy.aggregation.retention.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class RetentionJob {

    private final RetentionService retentionService;
    private final TierGraph tierGraph;
    private final EquipmentRepository equipmentRepository;
    private final MeterRegistry meterRegistry;

    /**
     * Purge raw readings and retention-bounded tiers daily at 3 AM
     */
    @Scheduled(cron = "${energy.aggregation.retention.cron:0 0 3 * * *}")
    public void purgeExpiredData() {
        log.info("Starting retention pass");
        Instant now = Instant.now();
        List<Equipment> entities = equipmentRepository.findAllActive();

        int successCount = 0;
        int failureCount = 0;
        long purged = 0;

        for (Equipment entity : entities) {
            try {
                purged += retentionService.purgeRaw(entity.getEntityId(), now);
                for (TierDefinition tier : tierGraph.inTopologicalOrder()) {
                    if (tier.getRetention() != null) {
                        purged += retentionService.purgeTier(tier.getName(), entity.getEntityId(), now);
                    }
                }
                successCount++;
            } catch (Exception e) {
                log.error("Retention failed for entity {}", entity.getEntityId(), e);
                meterRegistry.counter("retention.failures").increment();
                failureCount++;
            }
        }

        log.info("Retention pass completed: {} succeeded, {} failed, {} rows purged",
                successCount, failureCount, purged);
    }
}
