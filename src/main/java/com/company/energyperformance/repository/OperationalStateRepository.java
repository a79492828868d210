package com.company.energyperformance.repository;

import com.company.energyperformance.domain.StateInterval;
import com.company.energyperformance.domain.enums.OperationalState;
import com.company.energyperformance.exception.TransientStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

/**
 * Read-only view of the operational-state feed
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class OperationalStateRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * State intervals of the given entities overlapping [start, end)
     */
    public List<StateInterval> findIntervals(Collection<String> entityIds, Instant start, Instant end) {
        if (entityIds == null || entityIds.isEmpty()) {
            return Collections.emptyList();
        }

        String placeholders = String.join(",", Collections.nCopies(entityIds.size(), "?"));

        String sql = String.format("""
            SELECT entity_id, state, started_at, ended_at
            FROM equipment_state_log
            WHERE entity_id IN (%s)
            AND started_at < ?
            AND (ended_at IS NULL OR ended_at > ?)
            ORDER BY entity_id, started_at
            """, placeholders);

        List<Object> params = new ArrayList<>(entityIds);
        params.add(Timestamp.from(end));
        params.add(Timestamp.from(start));

        try {
            return jdbcTemplate.query(sql, (rs, rowNum) -> {
                Timestamp endedAt = rs.getTimestamp("ended_at");
                return StateInterval.builder()
                        .entityId(rs.getString("entity_id"))
                        .state(OperationalState.fromString(rs.getString("state")))
                        .startedAt(rs.getTimestamp("started_at").toInstant())
                        .endedAt(endedAt != null ? endedAt.toInstant() : null)
                        .build();
            }, params.toArray());
        } catch (Exception e) {
            log.error("Failed to read operational state for {} entities", entityIds.size(), e);
            throw new TransientStoreException("Failed to read operational state", e);
        }
    }
}
