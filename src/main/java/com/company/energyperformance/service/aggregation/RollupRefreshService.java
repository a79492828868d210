package com.company.energyperformance.service.aggregation;

import com.company.energyperformance.domain.RawReading;
import com.company.energyperformance.domain.RefreshWatermark;
import com.company.energyperformance.domain.RollupRow;
import com.company.energyperformance.repository.RawReadingRepository;
import com.company.energyperformance.repository.RefreshWatermarkRepository;
import com.company.energyperformance.repository.RollupRowRepository;
import com.company.energyperformance.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Recomputes one (tier, entity) refresh window and replaces the stored rows.
 * Refreshes of the same (tier, entity) are serialized in arrival order; everything else
 * runs concurrently.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RollupRefreshService {

    private final TierGraph tierGraph;
    private final RollupCalculator calculator;
    private final RawReadingRepository rawReadingRepository;
    private final RollupRowRepository rollupRowRepository;
    private final RefreshWatermarkRepository watermarkRepository;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public RefreshResult refresh(String tierName, String entityId, Instant now) {
        TierDefinition tier = tierGraph.require(tierName);
        Instant coveredThrough = watermarkRepository.find(tierName, entityId)
                .map(RefreshWatermark::contiguousThrough)
                .orElse(null);
        RefreshWindow window = tier.refreshWindow(now, coveredThrough);
        if (!window.equals(tier.refreshWindow(now))) {
            log.info("Catching up {} / {} from {} to {}", tierName, entityId, window.getStart(), window.getEnd());
            meterRegistry.counter("rollup.refresh.catchup", "tier", tierName).increment();
        }

        if (!tier.readsRaw()) {
            window = window.clipEnd(sourceCoverageEnd(tier, entityId));
        }

        if (window.isEmpty()) {
            log.debug("Nothing to refresh for {} / {} (source not yet covered)", tierName, entityId);
            return RefreshResult.builder()
                    .tier(tierName).entityId(entityId)
                    .windowStart(window.getStart()).windowEnd(window.getEnd())
                    .skipped(true)
                    .build();
        }

        Span span = tracer.spanBuilder("rollup.refresh")
                .setAttribute("tier", tierName)
                .setAttribute("entity", entityId)
                .startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        ReentrantLock lock = locks.computeIfAbsent(tierName + ":" + entityId, k -> new ReentrantLock(true));
        lock.lock();

        try (Scope ignored = span.makeCurrent()) {
            List<RollupRow> computed = compute(tier, entityId, window);
            computed.forEach(row -> row.setRefreshedAt(now));

            List<RollupRow> existing = rollupRowRepository.findRows(
                    tierName, List.of(entityId), window.getStart(), window.getEnd());

            Map<Instant, RollupRow> existingByBucket = new HashMap<>();
            existing.forEach(row -> existingByBucket.put(row.getBucketStart(), row));

            List<RollupRow> changed = new ArrayList<>();
            Set<Instant> computedBuckets = new HashSet<>();
            for (RollupRow row : computed) {
                computedBuckets.add(row.getBucketStart());
                if (!row.sameContentAs(existingByBucket.get(row.getBucketStart()))) {
                    changed.add(row);
                }
            }

            List<Instant> vanished = new ArrayList<>();
            for (Instant bucket : existingByBucket.keySet()) {
                if (!computedBuckets.contains(bucket)) {
                    vanished.add(bucket);
                }
            }
            Collections.sort(vanished);

            rollupRowRepository.applyWindowChanges(tierName, entityId, changed, vanished);
            watermarkRepository.recordSuccess(tierName, entityId, now, window.getStart(), window.getEnd());

            meterRegistry.counter("rollup.refresh.success", "tier", tierName).increment();
            meterRegistry.counter("rollup.rows.written", "tier", tierName).increment(changed.size());

            log.debug("Refreshed {} / {} [{} - {}): {} computed, {} written, {} deleted",
                    tierName, entityId, window.getStart(), window.getEnd(),
                    computed.size(), changed.size(), vanished.size());

            return RefreshResult.builder()
                    .tier(tierName)
                    .entityId(entityId)
                    .windowStart(window.getStart())
                    .windowEnd(window.getEnd())
                    .rowsComputed(computed.size())
                    .rowsWritten(changed.size())
                    .rowsDeleted(vanished.size())
                    .build();

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            meterRegistry.counter("rollup.refresh.failure", "tier", tierName).increment();
            recordFailureQuietly(tierName, entityId, now, e);
            throw e;
        } finally {
            lock.unlock();
            sample.stop(meterRegistry.timer("rollup.refresh.duration", "tier", tierName));
            span.end();
        }
    }

    private List<RollupRow> compute(TierDefinition tier, String entityId, RefreshWindow window) {
        if (tier.readsRaw()) {
            List<RawReading> readings = rawReadingRepository.findReadings(
                    entityId, window.getStart(), window.getEnd());
            return calculator.fromRaw(tier, entityId, readings, window.getStart(), window.getEnd());
        }
        List<RollupRow> finer = rollupRowRepository.findRows(
                tier.getSource(), List.of(entityId), window.getStart(), window.getEnd());
        return calculator.fromFiner(tier, entityId, finer, window.getStart(), window.getEnd());
    }

    /**
     * End of the range the source tier has already absorbed without gaps, snapped to this tier's
     * buckets. A coarse bucket is only recomputed once its whole span exists in the source.
     */
    private Instant sourceCoverageEnd(TierDefinition tier, String entityId) {
        TierDefinition source = tierGraph.sourceOf(tier).orElseThrow();
        Optional<RefreshWatermark> watermark = watermarkRepository.find(source.getName(), entityId);
        if (watermark.isEmpty() || watermark.get().getLastRefreshAt() == null) {
            return Instant.EPOCH;
        }
        Instant covered = TimeUtils.earliest(source.provisionalFrom(watermark.get().getLastRefreshAt()),
                watermark.get().contiguousThrough());
        return TimeUtils.floorToBucket(covered, tier.getBucketWidth());
    }

    private void recordFailureQuietly(String tierName, String entityId, Instant now, Exception cause) {
        try {
            watermarkRepository.recordFailure(tierName, entityId, now, cause.getMessage());
        } catch (Exception e) {
            log.warn("Could not record refresh failure for {} / {}: {}", tierName, entityId, e.getMessage());
        }
    }
}
