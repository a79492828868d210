package com.company.energyperformance.service.aggregation;

import com.company.energyperformance.domain.RefreshWatermark;
import com.company.energyperformance.repository.RefreshWatermarkRepository;
import com.company.energyperformance.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Finalized horizon of a (tier, entity): buckets ending at or before it will not be recomputed
 * by any later refresh of that tier or of a tier it reads from.
 *
 * <p>horizon(tier) = min(lastRefresh - lookback, contiguous coverage, horizon(source)), floored to
 * the tier's buckets. Buckets a missed refresh skipped stay beyond the horizon until a catch-up
 * refresh computes them. The raw store counts as final everywhere. Empty when the tier was never
 * refreshed.
 */
@Service
@RequiredArgsConstructor
public class TierFinalizationService {

    private final TierGraph tierGraph;
    private final RefreshWatermarkRepository watermarkRepository;

    public Optional<Instant> finalizedThrough(String tierName, String entityId) {
        return finalizedThrough(tierGraph.require(tierName), entityId);
    }

    public Optional<Instant> finalizedThrough(TierDefinition tier, String entityId) {
        Optional<RefreshWatermark> watermark = watermarkRepository.find(tier.getName(), entityId);
        if (watermark.isEmpty() || watermark.get().getLastRefreshAt() == null) {
            return Optional.empty();
        }

        Instant own = TimeUtils.floorToBucket(TimeUtils.earliest(
                watermark.get().getLastRefreshAt().minus(tier.getLookback()),
                watermark.get().contiguousThrough()), tier.getBucketWidth());

        Optional<TierDefinition> source = tierGraph.sourceOf(tier);
        if (source.isEmpty()) {
            return Optional.of(own);
        }

        Optional<Instant> upstream = finalizedThrough(source.get(), entityId);
        if (upstream.isEmpty()) {
            return Optional.empty();
        }
        Instant bounded = TimeUtils.earliest(own, upstream.get());
        return Optional.of(TimeUtils.floorToBucket(bounded, tier.getBucketWidth()));
    }

    /**
     * Horizon of a set of entities: the earliest member horizon, empty if any member has none
     */
    public Optional<Instant> finalizedThrough(String tierName, Collection<String> entityIds) {
        TierDefinition tier = tierGraph.require(tierName);
        Instant horizon = null;
        for (String entityId : entityIds) {
            Optional<Instant> member = finalizedThrough(tier, entityId);
            if (member.isEmpty()) {
                return Optional.empty();
            }
            horizon = TimeUtils.earliest(horizon, member.get());
        }
        return Optional.ofNullable(horizon);
    }

    /**
     * End of the range refreshed without gaps; empty when never refreshed
     */
    public Optional<Instant> coveredThrough(String tierName, Collection<String> entityIds) {
        Instant covered = null;
        for (String entityId : entityIds) {
            Optional<RefreshWatermark> watermark = watermarkRepository.find(tierName, entityId);
            if (watermark.isEmpty() || watermark.get().contiguousThrough() == null) {
                return Optional.empty();
            }
            covered = TimeUtils.earliest(covered, watermark.get().contiguousThrough());
        }
        return Optional.ofNullable(covered);
    }
}
