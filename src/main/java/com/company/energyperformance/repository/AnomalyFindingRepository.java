package com.company.energyperformance.repository;

import com.company.energyperformance.domain.AnomalyFinding;
import com.company.energyperformance.domain.enums.AnomalyType;
import com.company.energyperformance.domain.enums.ResolutionState;
import com.company.energyperformance.domain.enums.Severity;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class AnomalyFindingRepository {

    public enum UpsertOutcome {
        INSERTED,
        UPDATED,
        UNCHANGED
    }

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT finding_id, group_id, entity_id, finding_time, metric, anomaly_type,
               actual_value, expected_value, deviation, z_score, anomaly_score, threshold,
               confidence, severity, model_version, description, resolution_state,
               resolved_at, resolved_by, resolution_notes, detected_at, updated_at
        FROM anomaly_findings
        """;

    /**
     * Inserts a finding or refreshes the detector-owned columns of an existing one.
     * Resolution columns are never part of the update, and a row whose detector values did not
     * change is left untouched.
     */
    public UpsertOutcome upsert(AnomalyFinding finding) {
        String sql = """
            INSERT INTO anomaly_findings (
                group_id, entity_id, finding_time, metric, anomaly_type, actual_value,
                expected_value, deviation, z_score, anomaly_score, threshold, confidence,
                severity, model_version, description, resolution_state, detected_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 'OPEN', ?, ?)
            ON CONFLICT (group_id, finding_time, metric)
            DO UPDATE SET
                entity_id = EXCLUDED.entity_id,
                anomaly_type = EXCLUDED.anomaly_type,
                actual_value = EXCLUDED.actual_value,
                expected_value = EXCLUDED.expected_value,
                deviation = EXCLUDED.deviation,
                z_score = EXCLUDED.z_score,
                anomaly_score = EXCLUDED.anomaly_score,
                threshold = EXCLUDED.threshold,
                confidence = EXCLUDED.confidence,
                severity = EXCLUDED.severity,
                model_version = EXCLUDED.model_version,
                description = EXCLUDED.description,
                updated_at = EXCLUDED.updated_at
            WHERE (anomaly_findings.entity_id, anomaly_findings.anomaly_type, anomaly_findings.actual_value,
                   anomaly_findings.expected_value, anomaly_findings.anomaly_score,
                   anomaly_findings.severity, anomaly_findings.model_version)
                IS DISTINCT FROM
                  (EXCLUDED.entity_id, EXCLUDED.anomaly_type, EXCLUDED.actual_value,
                   EXCLUDED.expected_value, EXCLUDED.anomaly_score,
                   EXCLUDED.severity, EXCLUDED.model_version)
            RETURNING finding_id, (xmax = 0) AS inserted
            """;

        Instant detectedAt = finding.getDetectedAt() != null ? finding.getDetectedAt() : Instant.now();
        try {
            List<Object[]> returned = jdbcTemplate.query(sql,
                    (rs, rowNum) -> new Object[]{rs.getLong("finding_id"), rs.getBoolean("inserted")},
                    finding.getGroupId(),
                    finding.getEntityId(),
                    Timestamp.from(finding.getFindingTime()),
                    finding.getMetric(),
                    finding.getAnomalyType().name(),
                    finding.getActualValue(),
                    finding.getExpectedValue(),
                    finding.getDeviation(),
                    finding.getZScore(),
                    finding.getAnomalyScore(),
                    finding.getThreshold(),
                    finding.getConfidence(),
                    finding.getSeverity().name(),
                    finding.getModelVersion(),
                    finding.getDescription(),
                    Timestamp.from(detectedAt),
                    Timestamp.from(detectedAt));

            if (returned.isEmpty()) {
                return UpsertOutcome.UNCHANGED;
            }
            finding.setFindingId((Long) returned.get(0)[0]);
            return (Boolean) returned.get(0)[1] ? UpsertOutcome.INSERTED : UpsertOutcome.UPDATED;
        } catch (Exception e) {
            log.error("Failed to store anomaly finding for group {} at {} ({})",
                    finding.getGroupId(), finding.getFindingTime(), finding.getMetric(), e);
            throw new TransientStoreException("Failed to store anomaly finding", e);
        }
    }

    public Optional<AnomalyFinding> findById(long findingId) {
        List<AnomalyFinding> results = jdbcTemplate.query(SELECT_BASE + " WHERE finding_id = ?",
                new AnomalyFindingRowMapper(), findingId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Filtered listing, newest first. Null criteria are ignored.
     */
    public List<AnomalyFinding> find(String groupId, String entityId, Instant from, Instant to,
                                     Severity severity, ResolutionState state, int limit) {
        StringBuilder sql = new StringBuilder(SELECT_BASE).append(" WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (groupId != null) {
            sql.append(" AND group_id = ?");
            args.add(groupId);
        }
        if (entityId != null) {
            sql.append(" AND entity_id = ?");
            args.add(entityId);
        }
        if (from != null) {
            sql.append(" AND finding_time >= ?");
            args.add(Timestamp.from(from));
        }
        if (to != null) {
            sql.append(" AND finding_time < ?");
            args.add(Timestamp.from(to));
        }
        if (severity != null) {
            sql.append(" AND severity = ?");
            args.add(severity.name());
        }
        if (state != null) {
            sql.append(" AND resolution_state = ?");
            args.add(state.name());
        }
        sql.append(" ORDER BY finding_time DESC, finding_id DESC LIMIT ?");
        args.add(limit);

        return jdbcTemplate.query(sql.toString(), new AnomalyFindingRowMapper(), args.toArray());
    }

    /**
     * @return false when the finding does not exist or is already resolved
     */
    public boolean resolve(long findingId, String notes, String resolvedBy, Instant resolvedAt) {
        String sql = """
            UPDATE anomaly_findings
            SET resolution_state = 'RESOLVED',
                resolved_at = ?,
                resolved_by = ?,
                resolution_notes = ?,
                updated_at = ?
            WHERE finding_id = ?
            AND resolution_state = 'OPEN'
            """;

        try {
            return jdbcTemplate.update(sql, Timestamp.from(resolvedAt), resolvedBy, notes,
                    Timestamp.from(resolvedAt), findingId) > 0;
        } catch (Exception e) {
            log.error("Failed to resolve anomaly finding {}", findingId, e);
            throw new TransientStoreException("Failed to resolve anomaly finding", e);
        }
    }

    public long countOpen() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM anomaly_findings WHERE resolution_state = 'OPEN'", Long.class);
        return count != null ? count : 0L;
    }

    private static class AnomalyFindingRowMapper implements RowMapper<AnomalyFinding> {
        @Override
        public AnomalyFinding mapRow(ResultSet rs, int rowNum) throws SQLException {
            int version = rs.getInt("model_version");
            Integer modelVersion = rs.wasNull() ? null : version;
            Timestamp resolvedAt = rs.getTimestamp("resolved_at");

            return AnomalyFinding.builder()
                    .findingId(rs.getLong("finding_id"))
                    .groupId(rs.getString("group_id"))
                    .entityId(rs.getString("entity_id"))
                    .findingTime(rs.getTimestamp("finding_time").toInstant())
                    .metric(rs.getString("metric"))
                    .anomalyType(AnomalyType.valueOf(rs.getString("anomaly_type")))
                    .actualValue(rs.getDouble("actual_value"))
                    .expectedValue(rs.getDouble("expected_value"))
                    .deviation(rs.getDouble("deviation"))
                    .zScore(rs.getDouble("z_score"))
                    .anomalyScore(rs.getDouble("anomaly_score"))
                    .threshold(rs.getDouble("threshold"))
                    .confidence(rs.getDouble("confidence"))
                    .severity(Severity.fromString(rs.getString("severity")))
                    .modelVersion(modelVersion)
                    .description(rs.getString("description"))
                    .resolutionState(ResolutionState.fromString(rs.getString("resolution_state")))
                    .resolvedAt(resolvedAt != null ? resolvedAt.toInstant() : null)
                    .resolvedBy(rs.getString("resolved_by"))
                    .resolutionNotes(rs.getString("resolution_notes"))
                    .detectedAt(rs.getTimestamp("detected_at").toInstant())
                    .updatedAt(rs.getTimestamp("updated_at").toInstant())
                    .build();
        }
    }
}
