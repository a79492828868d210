package com.company.energyperformance.repository;

import com.company.energyperformance.domain.RefreshWatermark;
import com.company.energyperformance.exception.TransientStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class RefreshWatermarkRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT tier, entity_id, last_refresh_at, window_start, window_end, covered_through,
               last_attempt_at, consecutive_failures, last_error
        FROM rollup_watermarks
        """;

    public Optional<RefreshWatermark> find(String tier, String entityId) {
        String sql = SELECT_BASE + " WHERE tier = ? AND entity_id = ?";
        try {
            List<RefreshWatermark> results = jdbcTemplate.query(sql, new WatermarkRowMapper(), tier, entityId);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (Exception e) {
            log.error("Failed to read watermark for {} / {}", tier, entityId, e);
            throw new TransientStoreException("Failed to read refresh watermark", e);
        }
    }

    /**
     * Oldest last successful refresh across the entities of a tier
     */
    public Optional<Instant> oldestRefresh(String tier) {
        Timestamp oldest = jdbcTemplate.queryForObject(
                "SELECT MIN(last_refresh_at) FROM rollup_watermarks WHERE tier = ?", Timestamp.class, tier);
        return Optional.ofNullable(oldest).map(Timestamp::toInstant);
    }

    /**
     * Records a successful refresh. Coverage only advances when the window starts at or before the
     * current coverage end, so a window past a gap never marks the gap as covered.
     */
    public void recordSuccess(String tier, String entityId, Instant refreshedAt,
                              Instant windowStart, Instant windowEnd) {
        String sql = """
            INSERT INTO rollup_watermarks (
                tier, entity_id, last_refresh_at, window_start, window_end, covered_through,
                last_attempt_at, consecutive_failures, last_error
            ) VALUES (?, ?, ?, ?, ?, ?, ?, 0, NULL)
            ON CONFLICT (tier, entity_id)
            DO UPDATE SET
                last_refresh_at = GREATEST(rollup_watermarks.last_refresh_at, EXCLUDED.last_refresh_at),
                window_start = EXCLUDED.window_start,
                window_end = EXCLUDED.window_end,
                covered_through = CASE
                    WHEN COALESCE(rollup_watermarks.covered_through, rollup_watermarks.window_end) IS NULL
                        THEN EXCLUDED.covered_through
                    WHEN EXCLUDED.window_start
                            <= COALESCE(rollup_watermarks.covered_through, rollup_watermarks.window_end)
                        THEN GREATEST(COALESCE(rollup_watermarks.covered_through, rollup_watermarks.window_end),
                                      EXCLUDED.covered_through)
                    ELSE COALESCE(rollup_watermarks.covered_through, rollup_watermarks.window_end)
                END,
                last_attempt_at = EXCLUDED.last_attempt_at,
                consecutive_failures = 0,
                last_error = NULL
            """;
        try {
            jdbcTemplate.update(sql, tier, entityId, Timestamp.from(refreshedAt),
                    Timestamp.from(windowStart), Timestamp.from(windowEnd), Timestamp.from(windowEnd),
                    Timestamp.from(refreshedAt));
        } catch (Exception e) {
            log.error("Failed to record refresh of {} / {}", tier, entityId, e);
            throw new TransientStoreException("Failed to record refresh watermark", e);
        }
    }

    public void recordFailure(String tier, String entityId, Instant attemptedAt, String error) {
        String sql = """
            INSERT INTO rollup_watermarks (
                tier, entity_id, last_attempt_at, consecutive_failures, last_error
            ) VALUES (?, ?, ?, 1, ?)
            ON CONFLICT (tier, entity_id)
            DO UPDATE SET
                last_attempt_at = EXCLUDED.last_attempt_at,
                consecutive_failures = rollup_watermarks.consecutive_failures + 1,
                last_error = EXCLUDED.last_error
            """;
        try {
            jdbcTemplate.update(sql, tier, entityId, Timestamp.from(attemptedAt), error);
        } catch (Exception e) {
            log.error("Failed to record refresh failure of {} / {}", tier, entityId, e);
            throw new TransientStoreException("Failed to record refresh failure", e);
        }
    }

    private static class WatermarkRowMapper implements RowMapper<RefreshWatermark> {
        @Override
        public RefreshWatermark mapRow(ResultSet rs, int rowNum) throws SQLException {
            return RefreshWatermark.builder()
                    .tier(rs.getString("tier"))
                    .entityId(rs.getString("entity_id"))
                    .lastRefreshAt(toInstant(rs.getTimestamp("last_refresh_at")))
                    .windowStart(toInstant(rs.getTimestamp("window_start")))
                    .windowEnd(toInstant(rs.getTimestamp("window_end")))
                    .coveredThrough(toInstant(rs.getTimestamp("covered_through")))
                    .lastAttemptAt(toInstant(rs.getTimestamp("last_attempt_at")))
                    .consecutiveFailures(rs.getInt("consecutive_failures"))
                    .lastError(rs.getString("last_error"))
                    .build();
        }

        private Instant toInstant(Timestamp timestamp) {
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
