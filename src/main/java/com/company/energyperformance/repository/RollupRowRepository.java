package com.company.energyperformance.repository;

import com.company.energyperformance.domain.ChannelSummary;
import com.company.energyperformance.domain.RollupRow;
import com.company.energyperformance.domain.enums.ReadingChannel;
import com.company.energyperformance.exception.TransientStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

/**
 * Rollup rows keyed by (tier, entity, bucket start). Channel summaries are stored as JSONB.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RollupRowRepository {

    private static final TypeReference<LinkedHashMap<String, ChannelSummary>> SUMMARY_TYPE =
            new TypeReference<>() {
            };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public List<RollupRow> findRows(String tier, Collection<String> entityIds, Instant start, Instant end) {
        if (entityIds == null || entityIds.isEmpty()) {
            return Collections.emptyList();
        }

        String placeholders = String.join(",", Collections.nCopies(entityIds.size(), "?"));

        String sql = String.format("""
            SELECT tier, entity_id, bucket_start, bucket_end, sample_count, summary, refreshed_at
            FROM rollup_rows
            WHERE tier = ?
            AND entity_id IN (%s)
            AND bucket_start >= ?
            AND bucket_start < ?
            ORDER BY bucket_start, entity_id
            """, placeholders);

        List<Object> params = new ArrayList<>();
        params.add(tier);
        params.addAll(entityIds);
        params.add(Timestamp.from(start));
        params.add(Timestamp.from(end));

        try {
            return jdbcTemplate.query(sql, new RollupRowMapper(), params.toArray());
        } catch (Exception e) {
            log.error("Failed to fetch {} rollups for {} entities", tier, entityIds.size(), e);
            throw new TransientStoreException("Failed to fetch rollup rows", e);
        }
    }

    /**
     * Applies one refresh window atomically. Rows whose summary is unchanged are left untouched,
     * so re-running a refresh over unchanged input rewrites nothing.
     */
    @Transactional
    public void applyWindowChanges(String tier, String entityId,
                                   List<RollupRow> upserts, List<Instant> deletedBuckets) {
        try {
            if (!upserts.isEmpty()) {
                upsertRows(upserts);
            }
            if (!deletedBuckets.isEmpty()) {
                deleteBuckets(tier, entityId, deletedBuckets);
            }
        } catch (TransientStoreException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to apply {} rollup window for entity {}", tier, entityId, e);
            throw new TransientStoreException("Failed to apply rollup window", e);
        }
    }

    public int purgeBefore(String tier, String entityId, Instant cutoff) {
        String sql = "DELETE FROM rollup_rows WHERE tier = ? AND entity_id = ? AND bucket_end <= ?";
        try {
            return jdbcTemplate.update(sql, tier, entityId, Timestamp.from(cutoff));
        } catch (Exception e) {
            log.error("Failed to purge {} rollups for entity {} before {}", tier, entityId, cutoff, e);
            throw new TransientStoreException("Failed to purge rollup rows", e);
        }
    }

    private void upsertRows(List<RollupRow> rows) {
        String sql = """
            INSERT INTO rollup_rows (
                tier, entity_id, bucket_start, bucket_end, sample_count, summary, refreshed_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (tier, entity_id, bucket_start)
            DO UPDATE SET
                bucket_end = EXCLUDED.bucket_end,
                sample_count = EXCLUDED.sample_count,
                summary = EXCLUDED.summary,
                refreshed_at = EXCLUDED.refreshed_at
            WHERE rollup_rows.summary IS DISTINCT FROM EXCLUDED.summary
               OR rollup_rows.sample_count IS DISTINCT FROM EXCLUDED.sample_count
            """;

        List<Object[]> batch = new ArrayList<>(rows.size());
        for (RollupRow row : rows) {
            batch.add(new Object[]{
                    row.getTier(),
                    row.getEntityId(),
                    Timestamp.from(row.getBucketStart()),
                    Timestamp.from(row.getBucketEnd()),
                    row.getSampleCount(),
                    writeSummary(row.getChannels()),
                    Timestamp.from(row.getRefreshedAt() != null ? row.getRefreshedAt() : Instant.now())
            });
        }
        jdbcTemplate.batchUpdate(sql, batch);
    }

    private void deleteBuckets(String tier, String entityId, List<Instant> bucketStarts) {
        String sql = "DELETE FROM rollup_rows WHERE tier = ? AND entity_id = ? AND bucket_start = ?";
        List<Object[]> batch = new ArrayList<>(bucketStarts.size());
        for (Instant bucketStart : bucketStarts) {
            batch.add(new Object[]{tier, entityId, Timestamp.from(bucketStart)});
        }
        jdbcTemplate.batchUpdate(sql, batch);
    }

    private String writeSummary(Map<ReadingChannel, ChannelSummary> channels) {
        Map<String, ChannelSummary> byCode = new LinkedHashMap<>();
        channels.forEach((channel, summary) -> byCode.put(channel.getCode(), summary));
        try {
            return objectMapper.writeValueAsString(byCode);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rollup summary", e);
        }
    }

    private Map<ReadingChannel, ChannelSummary> readSummary(String json) {
        Map<ReadingChannel, ChannelSummary> channels = new EnumMap<>(ReadingChannel.class);
        if (json == null || json.isBlank()) {
            return channels;
        }
        try {
            Map<String, ChannelSummary> byCode = objectMapper.readValue(json, SUMMARY_TYPE);
            byCode.forEach((code, summary) ->
                    ReadingChannel.fromCode(code).ifPresent(channel -> channels.put(channel, summary)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse rollup summary", e);
        }
        return channels;
    }

    private class RollupRowMapper implements RowMapper<RollupRow> {
        @Override
        public RollupRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp refreshedAt = rs.getTimestamp("refreshed_at");
            return RollupRow.builder()
                    .tier(rs.getString("tier"))
                    .entityId(rs.getString("entity_id"))
                    .bucketStart(rs.getTimestamp("bucket_start").toInstant())
                    .bucketEnd(rs.getTimestamp("bucket_end").toInstant())
                    .sampleCount(rs.getLong("sample_count"))
                    .channels(readSummary(rs.getString("summary")))
                    .refreshedAt(refreshedAt != null ? refreshedAt.toInstant() : null)
                    .build();
        }
    }
}
