package com.company.energyperformance.service.baseline;

import com.company.energyperformance.domain.*;
import com.company.energyperformance.domain.enums.OperationalState;
import com.company.energyperformance.domain.enums.ReadingChannel;
import com.company.energyperformance.repository.EquipmentRepository;
import com.company.energyperformance.repository.OperationalStateRepository;
import com.company.energyperformance.repository.RollupRowRepository;
import com.company.energyperformance.service.aggregation.RollupCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Builds per-bucket feature rows of a group series. Rows are never imputed: a missing channel
 * leaves a null feature, a bucket some member has no row for is marked incomplete, and buckets
 * touching an excluded operational state are marked.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FeatureRowAssembler {

    private final RollupRowRepository rollupRowRepository;
    private final RollupCalculator calculator;
    private final OperationalStateRepository stateRepository;
    private final EquipmentRepository equipmentRepository;

    public List<FeatureRow> assemble(SignificantUseGroup group, EnergySource source, String tier,
                                     Instant start, Instant end, List<FeatureDefinition> features,
                                     Collection<OperationalState> excludedStates) {
        List<RollupRow> memberRows = rollupRowRepository.findRows(tier, group.getEntityIds(), start, end);
        List<RollupRow> series = calculator.mergeSeries(group.getGroupId(), memberRows);
        Set<String> members = new HashSet<>(group.getEntityIds());
        Map<Instant, Set<String>> contributors = new HashMap<>();
        for (RollupRow row : memberRows) {
            contributors.computeIfAbsent(row.getBucketStart(), b -> new HashSet<>()).add(row.getEntityId());
        }

        List<StateInterval> exclusions = new ArrayList<>();
        if (!excludedStates.isEmpty() && !series.isEmpty()) {
            for (StateInterval interval : stateRepository.findIntervals(group.getEntityIds(), start, end)) {
                if (excludedStates.contains(interval.getState())) {
                    exclusions.add(interval);
                }
            }
        }

        double ratedCapacityKw = ratedCapacity(group);
        ReadingChannel consumptionChannel = source.resolvedConsumptionChannel();

        List<FeatureRow> rows = new ArrayList<>(series.size());
        int incomplete = 0;
        for (RollupRow row : series) {
            Set<String> present = contributors.getOrDefault(row.getBucketStart(), Collections.emptySet());
            int missingMembers = (int) members.stream().filter(m -> !present.contains(m)).count();
            if (missingMembers > 0) {
                incomplete++;
            }
            Map<String, Double> values = new LinkedHashMap<>();
            for (FeatureDefinition feature : features) {
                values.put(feature.getName(), feature.extract(row, ratedCapacityKw));
            }

            rows.add(FeatureRow.builder()
                    .bucketStart(row.getBucketStart())
                    .bucketEnd(row.getBucketEnd())
                    .features(values)
                    .consumption(row.sum(consumptionChannel))
                    .excludedState(excludedState(exclusions, row))
                    .missingMembers(missingMembers)
                    .build());
        }

        log.debug("Assembled {} feature rows for group {} on {} [{} - {}), {} incomplete, {} exclusion intervals",
                rows.size(), group.getGroupId(), tier, start, end, incomplete, exclusions.size());
        return rows;
    }

    private OperationalState excludedState(List<StateInterval> exclusions, RollupRow row) {
        for (StateInterval interval : exclusions) {
            if (interval.overlaps(row.getBucketStart(), row.getBucketEnd())) {
                return interval.getState();
            }
        }
        return null;
    }

    private double ratedCapacity(SignificantUseGroup group) {
        double total = 0.0;
        for (String entityId : group.getEntityIds()) {
            Optional<Equipment> equipment = equipmentRepository.findById(entityId);
            if (equipment.isPresent() && equipment.get().getRatedCapacityKw() != null) {
                total += equipment.get().getRatedCapacityKw();
            }
        }
        return total;
    }
}
