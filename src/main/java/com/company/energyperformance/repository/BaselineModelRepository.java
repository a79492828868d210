package com.company.energyperformance.repository;

import com.company.energyperformance.domain.ActiveModelPointer;
import com.company.energyperformance.domain.BaselineModel;
import com.company.energyperformance.exception.ConcurrentActivationException;
import com.company.energyperformance.exception.QualityGateFailureException;
import com.company.energyperformance.exception.ResourceNotFoundException;
import com.company.energyperformance.exception.TransientStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
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
 * Versioned baseline models and the active pointer of each (group, energy source).
 *
 * <p>Every write that can change which version is active runs in one transaction that locks the
 * pointer row, swaps the active flag and advances the pointer with a compare-and-set on its
 * {@code pointer_version}. A partial unique index keeps at most one active row per pair.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class BaselineModelRepository {

    private static final TypeReference<ArrayList<String>> NAMES_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, Double>> VALUES_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String SELECT_BASE = """
        SELECT model_id, group_id, energy_source_id, version, tier, feature_names, coefficients,
               p_values, intercept, intercept_included, training_start, training_end, sample_count,
               r_squared, adjusted_r_squared, rmse, mae, is_active, quality_gate_passed,
               quality_gate_reason, consumption_unit, trained_by, trained_at,
               deactivated_at, deactivation_reason
        FROM baseline_models
        """;

    /**
     * Persists {@code model} as the next version of its (group, energy source). When
     * {@code activate} is set the new version becomes the only active one in the same transaction.
     */
    @Transactional
    public BaselineModel saveNewVersion(BaselineModel model, boolean activate) {
        try {
            ActiveModelPointer pointer = lockPointer(model.getGroupId(), model.getEnergySourceId());

            Integer maxVersion = jdbcTemplate.queryForObject(
                    "SELECT COALESCE(MAX(version), 0) FROM baseline_models WHERE group_id = ? AND energy_source_id = ?",
                    Integer.class, model.getGroupId(), model.getEnergySourceId());
            model.setVersion(maxVersion + 1);
            model.setActive(false);

            Long modelId = jdbcTemplate.queryForObject("""
                INSERT INTO baseline_models (
                    group_id, energy_source_id, version, tier, feature_names, coefficients, p_values,
                    intercept, intercept_included, training_start, training_end, sample_count,
                    r_squared, adjusted_r_squared, rmse, mae, is_active, quality_gate_passed,
                    quality_gate_reason, consumption_unit, trained_by, trained_at
                ) VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, false, ?, ?, ?, ?, ?)
                RETURNING model_id
                """, Long.class,
                    model.getGroupId(),
                    model.getEnergySourceId(),
                    model.getVersion(),
                    model.getTier(),
                    writeJson(model.getFeatureNames()),
                    writeJson(model.getCoefficients()),
                    writeJson(model.getPValues()),
                    model.getIntercept(),
                    model.isInterceptIncluded(),
                    Timestamp.from(model.getTrainingStart()),
                    Timestamp.from(model.getTrainingEnd()),
                    model.getSampleCount(),
                    model.getRSquared(),
                    model.getAdjustedRSquared(),
                    model.getRmse(),
                    model.getMae(),
                    model.isQualityGatePassed(),
                    model.getQualityGateReason(),
                    model.getConsumptionUnit(),
                    model.getTrainedBy(),
                    Timestamp.from(model.getTrainedAt()));
            model.setModelId(modelId);

            if (activate) {
                switchActive(pointer, model.getVersion(), model.getTrainedAt(),
                        "Superseded by version " + model.getVersion());
                model.setActive(true);
            }
            return model;

        } catch (DataAccessException e) {
            log.error("Failed to persist baseline for group {} / {}", model.getGroupId(), model.getEnergySourceId(), e);
            throw new TransientStoreException("Failed to persist baseline model", e);
        }
    }

    @Transactional
    public BaselineModel activate(String groupId, String energySourceId, int version, Instant at) {
        ActiveModelPointer pointer = lockPointer(groupId, energySourceId);
        BaselineModel model = findByVersion(groupId, energySourceId, version)
                .orElseThrow(() -> new ResourceNotFoundException("Baseline model", groupId + " v" + version));

        if (model.isActive()) {
            return model;
        }
        if (!model.isQualityGatePassed()) {
            throw new QualityGateFailureException(model);
        }
        switchActive(pointer, version, at, "Superseded by version " + version);
        return findByVersion(groupId, energySourceId, version).orElseThrow();
    }

    /**
     * Deactivates {@code version} if it is the active one; the pair is left without an active model
     */
    @Transactional
    public BaselineModel deactivate(String groupId, String energySourceId, int version, String reason, Instant at) {
        ActiveModelPointer pointer = lockPointer(groupId, energySourceId);
        BaselineModel model = findByVersion(groupId, energySourceId, version)
                .orElseThrow(() -> new ResourceNotFoundException("Baseline model", groupId + " v" + version));

        if (!model.isActive()) {
            return model;
        }

        jdbcTemplate.update("""
            UPDATE baseline_models
            SET is_active = false, deactivated_at = ?, deactivation_reason = ?
            WHERE group_id = ? AND energy_source_id = ? AND version = ?
            """, Timestamp.from(at), reason, groupId, energySourceId, version);
        advancePointer(pointer, null, at);
        return findByVersion(groupId, energySourceId, version).orElseThrow();
    }

    public Optional<BaselineModel> findActive(String groupId, String energySourceId) {
        String sql = SELECT_BASE + " WHERE group_id = ? AND energy_source_id = ? AND is_active = true";
        try {
            List<BaselineModel> results = jdbcTemplate.query(sql, new BaselineModelRowMapper(), groupId, energySourceId);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (Exception e) {
            log.error("Failed to read active baseline of group {}", groupId, e);
            throw new TransientStoreException("Failed to read active baseline", e);
        }
    }

    public Optional<BaselineModel> findByVersion(String groupId, String energySourceId, int version) {
        String sql = SELECT_BASE + " WHERE group_id = ? AND energy_source_id = ? AND version = ?";
        List<BaselineModel> results = jdbcTemplate.query(sql, new BaselineModelRowMapper(),
                groupId, energySourceId, version);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * All versions of a group, newest first
     */
    public List<BaselineModel> findHistory(String groupId, String energySourceId) {
        String sql = SELECT_BASE + " WHERE group_id = ? AND energy_source_id = ? ORDER BY version DESC";
        return jdbcTemplate.query(sql, new BaselineModelRowMapper(), groupId, energySourceId);
    }

    public List<BaselineModel> findAllActive() {
        return jdbcTemplate.query(SELECT_BASE + " WHERE is_active = true ORDER BY group_id",
                new BaselineModelRowMapper());
    }

    public long countActive() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM baseline_models WHERE is_active = true", Long.class);
        return count != null ? count : 0L;
    }

    private ActiveModelPointer lockPointer(String groupId, String energySourceId) {
        jdbcTemplate.update("""
            INSERT INTO active_model_pointers (group_id, energy_source_id, active_version, pointer_version, updated_at)
            VALUES (?, ?, NULL, 0, NOW())
            ON CONFLICT (group_id, energy_source_id) DO NOTHING
            """, groupId, energySourceId);

        return jdbcTemplate.queryForObject("""
            SELECT group_id, energy_source_id, active_version, pointer_version, updated_at
            FROM active_model_pointers
            WHERE group_id = ? AND energy_source_id = ?
            FOR UPDATE
            """, new PointerRowMapper(), groupId, energySourceId);
    }

    // Deactivate first so the partial unique index never sees two active rows
    private void switchActive(ActiveModelPointer pointer, int version, Instant at, String reason) {
        jdbcTemplate.update("""
            UPDATE baseline_models
            SET is_active = false, deactivated_at = ?, deactivation_reason = ?
            WHERE group_id = ? AND energy_source_id = ? AND is_active = true AND version <> ?
            """, Timestamp.from(at), reason, pointer.getGroupId(), pointer.getEnergySourceId(), version);

        jdbcTemplate.update("""
            UPDATE baseline_models
            SET is_active = true, deactivated_at = NULL, deactivation_reason = NULL
            WHERE group_id = ? AND energy_source_id = ? AND version = ?
            """, pointer.getGroupId(), pointer.getEnergySourceId(), version);

        advancePointer(pointer, version, at);
    }

    private void advancePointer(ActiveModelPointer pointer, Integer activeVersion, Instant at) {
        int updated = jdbcTemplate.update("""
            UPDATE active_model_pointers
            SET active_version = ?, pointer_version = pointer_version + 1, updated_at = ?
            WHERE group_id = ? AND energy_source_id = ? AND pointer_version = ?
            """, activeVersion, Timestamp.from(at),
                pointer.getGroupId(), pointer.getEnergySourceId(), pointer.getPointerVersion());

        if (updated == 0) {
            throw new ConcurrentActivationException(pointer.getGroupId(), pointer.getPointerVersion());
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize baseline model field", e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse baseline model field", e);
        }
    }

    private class BaselineModelRowMapper implements RowMapper<BaselineModel> {
        @Override
        public BaselineModel mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp deactivatedAt = rs.getTimestamp("deactivated_at");
            return BaselineModel.builder()
                    .modelId(rs.getLong("model_id"))
                    .groupId(rs.getString("group_id"))
                    .energySourceId(rs.getString("energy_source_id"))
                    .version(rs.getInt("version"))
                    .tier(rs.getString("tier"))
                    .featureNames(readJson(rs.getString("feature_names"), NAMES_TYPE))
                    .coefficients(readJson(rs.getString("coefficients"), VALUES_TYPE))
                    .pValues(readJson(rs.getString("p_values"), VALUES_TYPE))
                    .intercept(rs.getDouble("intercept"))
                    .interceptIncluded(rs.getBoolean("intercept_included"))
                    .trainingStart(rs.getTimestamp("training_start").toInstant())
                    .trainingEnd(rs.getTimestamp("training_end").toInstant())
                    .sampleCount(rs.getInt("sample_count"))
                    .rSquared(rs.getDouble("r_squared"))
                    .adjustedRSquared(rs.getDouble("adjusted_r_squared"))
                    .rmse(rs.getDouble("rmse"))
                    .mae(rs.getDouble("mae"))
                    .active(rs.getBoolean("is_active"))
                    .qualityGatePassed(rs.getBoolean("quality_gate_passed"))
                    .qualityGateReason(rs.getString("quality_gate_reason"))
                    .consumptionUnit(rs.getString("consumption_unit"))
                    .trainedBy(rs.getString("trained_by"))
                    .trainedAt(rs.getTimestamp("trained_at").toInstant())
                    .deactivatedAt(deactivatedAt != null ? deactivatedAt.toInstant() : null)
                    .deactivationReason(rs.getString("deactivation_reason"))
                    .build();
        }
    }

    private static class PointerRowMapper implements RowMapper<ActiveModelPointer> {
        @Override
        public ActiveModelPointer mapRow(ResultSet rs, int rowNum) throws SQLException {
            int activeVersion = rs.getInt("active_version");
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return ActiveModelPointer.builder()
                    .groupId(rs.getString("group_id"))
                    .energySourceId(rs.getString("energy_source_id"))
                    .activeVersion(rs.wasNull() ? null : activeVersion)
                    .pointerVersion(rs.getLong("pointer_version"))
                    .updatedAt(updatedAt != null ? updatedAt.toInstant() : null)
                    .build();
        }
    }
}
