package com.company.energyperformance.scheduled;

import com.company.energyperformance.config.AnomalyProperties;
import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.exception.InsufficientDataException;
import com.company.energyperformance.exception.NoActiveModelException;
import com.company.energyperformance.repository.SignificantUseGroupRepository;
import com.company.energyperformance.service.anomaly.AnomalyDetectionResult;
import com.company.energyperformance.service.anomaly.AnomalyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "energy.anomaly.sweep.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class AnomalySweepJob {

    private final AnomalyService anomalyService;
    private final SignificantUseGroupRepository groupRepository;
    private final AnomalyProperties properties;

    /**
     * Scan the trailing window of every active group, five minutes past each hour
     */
    @Scheduled(cron = "${energy.anomaly.sweep.cron:0 5 * * * *}")
    public void sweep() {
        Instant end = Instant.now().truncatedTo(ChronoUnit.HOURS);
        Instant start = end.minus(properties.getSweepWindow());

        List<SignificantUseGroup> groups = groupRepository.findAllActive();
        log.debug("Anomaly sweep over {} groups [{} - {})", groups.size(), start, end);

        int succeeded = 0;
        int skipped = 0;
        int failed = 0;
        int findings = 0;

        for (SignificantUseGroup group : groups) {
            try {
                AnomalyDetectionResult result = anomalyService.detect(group.getGroupId(), start, end, null);
                findings += result.getFindingsCreated();
                succeeded++;
            } catch (NoActiveModelException e) {
                log.debug("Skipping anomaly sweep for group {}: no active baseline", group.getGroupId());
                skipped++;
            } catch (InsufficientDataException e) {
                log.warn("Skipping anomaly sweep for group {}: {}", group.getGroupId(), e.getMessage());
                skipped++;
            } catch (Exception e) {
                log.error("Anomaly sweep failed for group {}", group.getGroupId(), e);
                failed++;
            }
        }

        log.info("Anomaly sweep completed: {} succeeded, {} skipped, {} failed, {} new findings",
                succeeded, skipped, failed, findings);
    }
}
