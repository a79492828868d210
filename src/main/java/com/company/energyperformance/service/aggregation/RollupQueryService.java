package com.company.energyperformance.service.aggregation;

import com.company.energyperformance.domain.RollupRow;
import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.exception.ValidationException;
import com.company.energyperformance.repository.RollupRowRepository;
import com.company.energyperformance.service.ReferenceDataService;
import com.company.energyperformance.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads rollups for one entity or for the merged member series of a group.
 * A result is flagged stale when part of the range is still inside the settle period or past the
 * last refreshed window.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RollupQueryService {

    private final TierGraph tierGraph;
    private final RollupRowRepository rollupRowRepository;
    private final RollupCalculator calculator;
    private final TierFinalizationService finalizationService;
    private final ReferenceDataService referenceDataService;

    public RollupQueryResult queryEntity(String entityId, String tierName, Instant start, Instant end, Instant now) {
        TierDefinition tier = tierGraph.require(tierName);
        validateRange(start, end);

        List<RollupRow> rows = rollupRowRepository.findRows(tierName, List.of(entityId), start, end);
        return withStaleness(RollupQueryResult.builder()
                .seriesId(entityId)
                .tier(tierName)
                .start(start)
                .end(end)
                .rows(rows)
                .build(), tier, List.of(entityId), now);
    }

    public RollupQueryResult queryGroup(String groupId, String tierName, Instant start, Instant end, Instant now) {
        SignificantUseGroup group = referenceDataService.getGroup(groupId);
        return queryGroup(group, tierName, start, end, now);
    }

    public RollupQueryResult queryGroup(SignificantUseGroup group, String tierName,
                                        Instant start, Instant end, Instant now) {
        TierDefinition tier = tierGraph.require(tierName);
        validateRange(start, end);

        List<RollupRow> memberRows = rollupRowRepository.findRows(tierName, group.getEntityIds(), start, end);
        List<RollupRow> merged = calculator.mergeSeries(group.getGroupId(), memberRows);

        return withStaleness(RollupQueryResult.builder()
                .seriesId(group.getGroupId())
                .tier(tierName)
                .start(start)
                .end(end)
                .rows(merged)
                .build(), tier, group.getEntityIds(), now);
    }

    /**
     * Member rows of a group without merging, for indicators that combine members per bucket
     */
    public RollupQueryResult queryGroupMembers(SignificantUseGroup group, String tierName,
                                               Instant start, Instant end, Instant now) {
        TierDefinition tier = tierGraph.require(tierName);
        validateRange(start, end);

        return withStaleness(RollupQueryResult.builder()
                .seriesId(group.getGroupId())
                .tier(tierName)
                .start(start)
                .end(end)
                .rows(rollupRowRepository.findRows(tierName, group.getEntityIds(), start, end))
                .build(), tier, group.getEntityIds(), now);
    }

    private RollupQueryResult withStaleness(RollupQueryResult result, TierDefinition tier,
                                            Collection<String> entityIds, Instant now) {
        Instant staleFrom = tier.provisionalFrom(now);
        Optional<Instant> covered = finalizationService.coveredThrough(tier.getName(), entityIds);
        staleFrom = TimeUtils.earliest(staleFrom, covered.orElse(Instant.EPOCH));

        if (result.getEnd().isAfter(staleFrom)) {
            result.setStaleData(true);
            result.setStaleFrom(staleFrom.isAfter(result.getStart()) ? staleFrom : result.getStart());
            log.debug("Rollup query {} / {} is stale from {}", result.getSeriesId(), tier.getName(),
                    result.getStaleFrom());
        }
        return result;
    }

    private void validateRange(Instant start, Instant end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new ValidationException("Range start must be before end",
                    Map.of("start", String.valueOf(start), "end", String.valueOf(end)));
        }
    }
}
