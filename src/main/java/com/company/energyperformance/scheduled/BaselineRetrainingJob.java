package com.company.energyperformance.scheduled;

import com.company.energyperformance.config.BaselineProperties;
import com.company.energyperformance.domain.BaselineModel;
import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.exception.InsufficientDataException;
import com.company.energyperformance.repository.SignificantUseGroupRepository;
import com.company.energyperformance.security.OperatorContext;
import com.company.energyperformance.service.aggregation.TierDefinition;
import com.company.energyperformance.service.aggregation.TierGraph;
import com.company.energyperformance.service.baseline.BaselineModelRegistry;
import com.company.energyperformance.service.baseline.TrainingCommand;
import com.company.energyperformance.util.TimeUtils;
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
        value = "energy.baseline.retraining.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class BaselineRetrainingJob {

    private final BaselineModelRegistry registry;
    private final SignificantUseGroupRepository groupRepository;
    private final TierGraph tierGraph;
    private final BaselineProperties properties;

    /**
     * Retrain every active group on the trailing window, Sundays at 2 AM.
     * The new version only replaces the active one when it passes the quality gate.
     */
    @Scheduled(cron = "${energy.baseline.retraining.cron:0 0 2 * * SUN}")
    public void retrainAll() {
        log.info("Starting weekly baseline retraining");

        TierDefinition tier = tierGraph.require(properties.getDefaultTier());
        Instant end = TimeUtils.floorToBucket(Instant.now(), tier.getBucketWidth());
        Instant start = end.minus(properties.getRetrainLookback());

        List<SignificantUseGroup> groups = groupRepository.findAllActive();

        int activated = 0;
        int rejected = 0;
        int skipped = 0;
        int failed = 0;

        for (SignificantUseGroup group : groups) {
            try {
                BaselineModel model = registry.train(TrainingCommand.builder()
                        .groupId(group.getGroupId())
                        .windowStart(start)
                        .windowEnd(end)
                        .tier(tier.getName())
                        .trainedBy(OperatorContext.SYSTEM_OPERATOR)
                        .build());
                if (model.isQualityGatePassed()) {
                    activated++;
                } else {
                    rejected++;
                }
            } catch (InsufficientDataException e) {
                log.warn("Skipping retraining of group {}: {}", group.getGroupId(), e.getMessage());
                skipped++;
            } catch (Exception e) {
                log.error("Retraining failed for group {}", group.getGroupId(), e);
                failed++;
            }
        }

        log.info("Baseline retraining completed: {} activated, {} below quality gate, {} skipped, {} failed",
                activated, rejected, skipped, failed);
    }
}
