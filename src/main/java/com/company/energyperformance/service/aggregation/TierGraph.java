package com.company.energyperformance.service.aggregation;

import com.company.energyperformance.config.AggregationProperties;
import com.company.energyperformance.exception.ValidationException;
import com.company.energyperformance.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Validated DAG of rollup tiers. Each tier reads only from its declared source
 * (raw or another tier) and its bucket width is an exact multiple of the source width.
 */
@Component
@Slf4j
public class TierGraph {

    private final Map<String, TierDefinition> tiers;
    private final List<TierDefinition> topologicalOrder;
    private final Map<String, List<TierDefinition>> dependents;

    @Autowired
    public TierGraph(AggregationProperties properties) {
        this(properties.getTiers().stream().map(TierDefinition::from).collect(Collectors.toList()));
    }

    public TierGraph(List<TierDefinition> definitions) {
        Map<String, TierDefinition> byName = new LinkedHashMap<>();
        for (TierDefinition tier : definitions) {
            validateShape(tier);
            if (byName.putIfAbsent(tier.getName(), tier) != null) {
                throw new IllegalArgumentException("Duplicate tier name: " + tier.getName());
            }
        }

        Map<String, List<TierDefinition>> children = new HashMap<>();
        for (TierDefinition tier : byName.values()) {
            if (!tier.readsRaw()) {
                TierDefinition source = byName.get(tier.getSource());
                if (source == null) {
                    throw new IllegalArgumentException(
                            "Tier " + tier.getName() + " reads unknown source " + tier.getSource());
                }
                validateCoarsening(source, tier);
            }
            children.computeIfAbsent(tier.getSource(), k -> new ArrayList<>()).add(tier);
        }

        this.tiers = Collections.unmodifiableMap(byName);
        this.dependents = children;
        this.topologicalOrder = Collections.unmodifiableList(sort(byName, children));

        log.info("Tier graph: {}", topologicalOrder.stream()
                .map(t -> t.getName() + "<-" + t.getSource())
                .collect(Collectors.joining(", ")));
    }

    public Optional<TierDefinition> find(String name) {
        return Optional.ofNullable(tiers.get(name));
    }

    public TierDefinition require(String name) {
        TierDefinition tier = tiers.get(name);
        if (tier == null) {
            throw new ValidationException("Unknown tier: " + name,
                    Map.of("tier", String.valueOf(name), "knownTiers", new ArrayList<>(tiers.keySet())));
        }
        return tier;
    }

    /**
     * Tiers ordered so that every source precedes its dependents
     */
    public List<TierDefinition> inTopologicalOrder() {
        return topologicalOrder;
    }

    public Optional<TierDefinition> sourceOf(TierDefinition tier) {
        return tier.readsRaw() ? Optional.empty() : Optional.of(tiers.get(tier.getSource()));
    }

    /**
     * Every tier that reads {@code node} directly or through other tiers. {@code node} may be "raw".
     */
    public List<TierDefinition> transitiveDependentsOf(String node) {
        List<TierDefinition> result = new ArrayList<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(node);
        Set<String> seen = new HashSet<>();
        while (!pending.isEmpty()) {
            for (TierDefinition child : dependents.getOrDefault(pending.poll(), Collections.emptyList())) {
                if (seen.add(child.getName())) {
                    result.add(child);
                    pending.add(child.getName());
                }
            }
        }
        return result;
    }

    /**
     * Finest tier whose buckets align with both ends of the range and whose retention still
     * covers its start.
     */
    public Optional<TierDefinition> finestApplicable(Instant start, Instant end, Instant now) {
        return topologicalOrder.stream()
                .sorted(Comparator.comparing(TierDefinition::getBucketWidth))
                .filter(t -> TimeUtils.isAligned(start, t.getBucketWidth())
                        && TimeUtils.isAligned(end, t.getBucketWidth()))
                .filter(t -> t.getRetention() == null || !start.isBefore(now.minus(t.getRetention())))
                .findFirst();
    }

    private void validateShape(TierDefinition tier) {
        if (tier.getName() == null || tier.getName().isBlank()) {
            throw new IllegalArgumentException("Tier name is required");
        }
        if (AggregationProperties.RAW_SOURCE.equals(tier.getName())) {
            throw new IllegalArgumentException("'raw' is reserved for the raw store");
        }
        requirePositive(tier, "bucket width", tier.getBucketWidth());
        requirePositive(tier, "refresh interval", tier.getRefreshInterval());
        requirePositive(tier, "look-back", tier.getLookback());
        if (tier.getSettle() == null || tier.getSettle().isNegative()) {
            throw new IllegalArgumentException("Tier " + tier.getName() + " needs a non-negative settle offset");
        }
        if (tier.getLookback().compareTo(tier.getSettle()) <= 0) {
            throw new IllegalArgumentException("Tier " + tier.getName() + " look-back must exceed its settle offset");
        }
        if (tier.getBucketWidth().getNano() != 0) {
            throw new IllegalArgumentException("Tier " + tier.getName() + " bucket width must be whole seconds");
        }
    }

    private void requirePositive(TierDefinition tier, String what, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException("Tier " + tier.getName() + " needs a positive " + what);
        }
    }

    private void validateCoarsening(TierDefinition source, TierDefinition tier) {
        long fine = source.getBucketWidth().getSeconds();
        long coarse = tier.getBucketWidth().getSeconds();
        if (coarse <= fine || coarse % fine != 0) {
            throw new IllegalArgumentException(String.format(
                    "Tier %s (%ds) is not an exact coarsening of %s (%ds)",
                    tier.getName(), coarse, source.getName(), fine));
        }
    }

    private List<TierDefinition> sort(Map<String, TierDefinition> byName, Map<String, List<TierDefinition>> children) {
        List<TierDefinition> ordered = new ArrayList<>();
        Deque<String> ready = new ArrayDeque<>();
        ready.add(AggregationProperties.RAW_SOURCE);
        while (!ready.isEmpty()) {
            for (TierDefinition child : children.getOrDefault(ready.poll(), Collections.emptyList())) {
                ordered.add(child);
                ready.add(child.getName());
            }
        }
        if (ordered.size() != byName.size()) {
            Set<String> unreachable = new TreeSet<>(byName.keySet());
            ordered.forEach(t -> unreachable.remove(t.getName()));
            throw new IllegalArgumentException("Tier graph has a cycle through " + unreachable);
        }
        return ordered;
    }
}
