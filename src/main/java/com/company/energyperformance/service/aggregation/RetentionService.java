package com.company.energyperformance.service.aggregation;

import com.company.energyperformance.config.AggregationProperties;
import com.company.energyperformance.repository.RawReadingRepository;
import com.company.energyperformance.repository.RollupRowRepository;
import com.company.energyperformance.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Purges raw readings and retention-bounded tiers. Data is only removed behind the finalized
 * horizon of every tier that reads it, directly or through other tiers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetentionService {

    private final TierGraph tierGraph;
    private final TierFinalizationService finalizationService;
    private final RawReadingRepository rawReadingRepository;
    private final RollupRowRepository rollupRowRepository;
    private final AggregationProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * @return rows deleted, 0 when a dependent tier has not finalized anything yet
     */
    public int purgeRaw(String entityId, Instant now) {
        Optional<Instant> cutoff = safeCutoff(AggregationProperties.RAW_SOURCE, properties.getRawRetention(),
                entityId, now);
        if (cutoff.isEmpty()) {
            log.debug("Skipping raw purge for {}: dependents not finalized", entityId);
            return 0;
        }
        int deleted = rawReadingRepository.purgeBefore(entityId, cutoff.get());
        meterRegistry.counter("retention.rows.purged", "tier", AggregationProperties.RAW_SOURCE).increment(deleted);
        log.debug("Purged {} raw readings of {} before {}", deleted, entityId, cutoff.get());
        return deleted;
    }

    /**
     * Purges one tier for one entity. Tiers without retention are kept forever.
     */
    public int purgeTier(String tierName, String entityId, Instant now) {
        TierDefinition tier = tierGraph.require(tierName);
        if (tier.getRetention() == null) {
            return 0;
        }
        Optional<Instant> cutoff = safeCutoff(tierName, tier.getRetention(), entityId, now)
                .map(c -> TimeUtils.floorToBucket(c, tier.getBucketWidth()));
        if (cutoff.isEmpty()) {
            log.debug("Skipping {} purge for {}: dependents not finalized", tierName, entityId);
            return 0;
        }
        int deleted = rollupRowRepository.purgeBefore(tierName, entityId, cutoff.get());
        meterRegistry.counter("retention.rows.purged", "tier", tierName).increment(deleted);
        log.debug("Purged {} {} rows of {} before {}", deleted, tierName, entityId, cutoff.get());
        return deleted;
    }

    /**
     * min(now - retention, finalized horizon of every transitive dependent of {@code node})
     */
    Optional<Instant> safeCutoff(String node, Duration retention, String entityId, Instant now) {
        Instant cutoff = now.minus(retention);
        List<TierDefinition> dependents = tierGraph.transitiveDependentsOf(node);
        for (TierDefinition dependent : dependents) {
            Optional<Instant> horizon = finalizationService.finalizedThrough(dependent, entityId);
            if (horizon.isEmpty()) {
                return Optional.empty();
            }
            cutoff = TimeUtils.earliest(cutoff, horizon.get());
        }
        return Optional.of(cutoff);
    }
}
