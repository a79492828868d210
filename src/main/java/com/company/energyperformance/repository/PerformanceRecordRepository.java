package com.company.energyperformance.repository;

import com.company.energyperformance.domain.PerformanceRecord;
import com.company.energyperformance.domain.enums.ComplianceGrade;
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
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class PerformanceRecordRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT record_id, group_id, energy_source_id, period_start, period_end, period_label,
               model_version, model_tier, actual_tier, actual_consumption, expected_consumption,
               deviation, deviation_percent, lower_bound, upper_bound, statistically_significant,
               cumulative_deviation, trend_segment_id, sustained_drift, grade, statistical_severity,
               deviation_cost, buckets_predicted, buckets_missing_features,
               negative_predictions_clamped, finalized, stale_data, generated_at
        FROM performance_records
        """;

    public Optional<PerformanceRecord> findByPeriod(String groupId, Instant periodStart, Instant periodEnd) {
        String sql = SELECT_BASE + " WHERE group_id = ? AND period_start = ? AND period_end = ?";
        List<PerformanceRecord> results = jdbcTemplate.query(sql, new PerformanceRecordRowMapper(),
                groupId, Timestamp.from(periodStart), Timestamp.from(periodEnd));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Records of a group ending at or before {@code end}, latest end first
     */
    public List<PerformanceRecord> findEndingAtOrBefore(String groupId, Instant end) {
        String sql = SELECT_BASE + " WHERE group_id = ? AND period_end <= ? ORDER BY period_end DESC, period_start DESC";
        return jdbcTemplate.query(sql, new PerformanceRecordRowMapper(), groupId, Timestamp.from(end));
    }

    public List<PerformanceRecord> findInRange(String groupId, Instant from, Instant to) {
        String sql = SELECT_BASE + """
             WHERE group_id = ?
            AND period_start >= ?
            AND period_end <= ?
            ORDER BY period_start, period_end
            """;
        return jdbcTemplate.query(sql, new PerformanceRecordRowMapper(),
                groupId, Timestamp.from(from), Timestamp.from(to));
    }

    /**
     * Inserts or regenerates the record of a period. Finalized records are never overwritten.
     *
     * @return false when a finalized record already exists
     */
    public boolean upsert(PerformanceRecord record) {
        String sql = """
            INSERT INTO performance_records (
                group_id, energy_source_id, period_start, period_end, period_label, model_version,
                model_tier, actual_tier, actual_consumption, expected_consumption, deviation,
                deviation_percent, lower_bound, upper_bound, statistically_significant,
                cumulative_deviation, trend_segment_id, sustained_drift, grade, statistical_severity,
                deviation_cost, buckets_predicted, buckets_missing_features,
                negative_predictions_clamped, finalized, stale_data, generated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (group_id, period_start, period_end)
            DO UPDATE SET
                energy_source_id = EXCLUDED.energy_source_id,
                period_label = EXCLUDED.period_label,
                model_version = EXCLUDED.model_version,
                model_tier = EXCLUDED.model_tier,
                actual_tier = EXCLUDED.actual_tier,
                actual_consumption = EXCLUDED.actual_consumption,
                expected_consumption = EXCLUDED.expected_consumption,
                deviation = EXCLUDED.deviation,
                deviation_percent = EXCLUDED.deviation_percent,
                lower_bound = EXCLUDED.lower_bound,
                upper_bound = EXCLUDED.upper_bound,
                statistically_significant = EXCLUDED.statistically_significant,
                cumulative_deviation = EXCLUDED.cumulative_deviation,
                trend_segment_id = EXCLUDED.trend_segment_id,
                sustained_drift = EXCLUDED.sustained_drift,
                grade = EXCLUDED.grade,
                statistical_severity = EXCLUDED.statistical_severity,
                deviation_cost = EXCLUDED.deviation_cost,
                buckets_predicted = EXCLUDED.buckets_predicted,
                buckets_missing_features = EXCLUDED.buckets_missing_features,
                negative_predictions_clamped = EXCLUDED.negative_predictions_clamped,
                finalized = EXCLUDED.finalized,
                stale_data = EXCLUDED.stale_data,
                generated_at = EXCLUDED.generated_at
            WHERE performance_records.finalized = false
            """;

        try {
            int updated = jdbcTemplate.update(sql,
                    record.getGroupId(),
                    record.getEnergySourceId(),
                    Timestamp.from(record.getPeriodStart()),
                    Timestamp.from(record.getPeriodEnd()),
                    record.getPeriodLabel(),
                    record.getModelVersion(),
                    record.getModelTier(),
                    record.getActualTier(),
                    record.getActualConsumption(),
                    record.getExpectedConsumption(),
                    record.getDeviation(),
                    record.getDeviationPercent(),
                    record.getLowerBound(),
                    record.getUpperBound(),
                    record.isStatisticallySignificant(),
                    record.getCumulativeDeviation(),
                    record.getTrendSegmentId(),
                    record.isSustainedDrift(),
                    record.getGrade().name(),
                    record.getStatisticalSeverity().name(),
                    record.getDeviationCost(),
                    record.getBucketsPredicted(),
                    record.getBucketsMissingFeatures(),
                    record.getNegativePredictionsClamped(),
                    record.isFinalized(),
                    record.isStaleData(),
                    Timestamp.from(record.getGeneratedAt()));
            return updated > 0;
        } catch (Exception e) {
            log.error("Failed to store performance record for group {} [{} - {})",
                    record.getGroupId(), record.getPeriodStart(), record.getPeriodEnd(), e);
            throw new TransientStoreException("Failed to store performance record", e);
        }
    }

    private static class PerformanceRecordRowMapper implements RowMapper<PerformanceRecord> {
        @Override
        public PerformanceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            double deviationPercent = rs.getDouble("deviation_percent");
            Double percent = rs.wasNull() ? null : deviationPercent;
            double deviationCost = rs.getDouble("deviation_cost");
            Double cost = rs.wasNull() ? null : deviationCost;
            long segment = rs.getLong("trend_segment_id");
            Long segmentId = rs.wasNull() ? null : segment;

            return PerformanceRecord.builder()
                    .recordId(rs.getLong("record_id"))
                    .groupId(rs.getString("group_id"))
                    .energySourceId(rs.getString("energy_source_id"))
                    .periodStart(rs.getTimestamp("period_start").toInstant())
                    .periodEnd(rs.getTimestamp("period_end").toInstant())
                    .periodLabel(rs.getString("period_label"))
                    .modelVersion(rs.getInt("model_version"))
                    .modelTier(rs.getString("model_tier"))
                    .actualTier(rs.getString("actual_tier"))
                    .actualConsumption(rs.getDouble("actual_consumption"))
                    .expectedConsumption(rs.getDouble("expected_consumption"))
                    .deviation(rs.getDouble("deviation"))
                    .deviationPercent(percent)
                    .lowerBound(rs.getDouble("lower_bound"))
                    .upperBound(rs.getDouble("upper_bound"))
                    .statisticallySignificant(rs.getBoolean("statistically_significant"))
                    .cumulativeDeviation(rs.getDouble("cumulative_deviation"))
                    .trendSegmentId(segmentId)
                    .sustainedDrift(rs.getBoolean("sustained_drift"))
                    .grade(ComplianceGrade.fromString(rs.getString("grade")))
                    .statisticalSeverity(Severity.fromString(rs.getString("statistical_severity")))
                    .deviationCost(cost)
                    .bucketsPredicted(rs.getInt("buckets_predicted"))
                    .bucketsMissingFeatures(rs.getInt("buckets_missing_features"))
                    .negativePredictionsClamped(rs.getInt("negative_predictions_clamped"))
                    .finalized(rs.getBoolean("finalized"))
                    .staleData(rs.getBoolean("stale_data"))
                    .generatedAt(rs.getTimestamp("generated_at").toInstant())
                    .build();
        }
    }
}
