package com.company.energyperformance.repository;

import com.company.energyperformance.domain.BaselineAdjustment;
import com.company.energyperformance.exception.TransientStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;

@Repository
@RequiredArgsConstructor
@Slf4j
public class BaselineAdjustmentRepository {

    private final JdbcTemplate jdbcTemplate;

    public BaselineAdjustment save(BaselineAdjustment adjustment) {
        String sql = """
            INSERT INTO baseline_adjustments (group_id, effective_at, reason, recorded_by, recorded_at)
            VALUES (?, ?, ?, ?, ?)
            RETURNING adjustment_id
            """;
        try {
            Long id = jdbcTemplate.queryForObject(sql, Long.class,
                    adjustment.getGroupId(),
                    Timestamp.from(adjustment.getEffectiveAt()),
                    adjustment.getReason(),
                    adjustment.getRecordedBy(),
                    Timestamp.from(adjustment.getRecordedAt()));
            adjustment.setAdjustmentId(id);
            return adjustment;
        } catch (Exception e) {
            log.error("Failed to record baseline adjustment for group {}", adjustment.getGroupId(), e);
            throw new TransientStoreException("Failed to record baseline adjustment", e);
        }
    }

    /**
     * Adjustments of a group in effective order
     */
    public List<BaselineAdjustment> findByGroup(String groupId) {
        String sql = """
            SELECT adjustment_id, group_id, effective_at, reason, recorded_by, recorded_at
            FROM baseline_adjustments
            WHERE group_id = ?
            ORDER BY effective_at, adjustment_id
            """;
        return jdbcTemplate.query(sql, new AdjustmentRowMapper(), groupId);
    }

    private static class AdjustmentRowMapper implements RowMapper<BaselineAdjustment> {
        @Override
        public BaselineAdjustment mapRow(ResultSet rs, int rowNum) throws SQLException {
            return BaselineAdjustment.builder()
                    .adjustmentId(rs.getLong("adjustment_id"))
                    .groupId(rs.getString("group_id"))
                    .effectiveAt(rs.getTimestamp("effective_at").toInstant())
                    .reason(rs.getString("reason"))
                    .recordedBy(rs.getString("recorded_by"))
                    .recordedAt(rs.getTimestamp("recorded_at").toInstant())
                    .build();
        }
    }
}
