package com.company.energyperformance.repository;

import com.company.energyperformance.domain.Equipment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class EquipmentRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT entity_id, name, equipment_type, rated_capacity_kw, active, created_at
        FROM equipment
        """;

    public Optional<Equipment> findById(String entityId) {
        String sql = SELECT_BASE + " WHERE entity_id = ?";

        List<Equipment> results = jdbcTemplate.query(sql, new EquipmentRowMapper(), entityId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Equipment> findAllActive() {
        String sql = SELECT_BASE + " WHERE active = true ORDER BY entity_id";
        return jdbcTemplate.query(sql, new EquipmentRowMapper());
    }

    private static class EquipmentRowMapper implements RowMapper<Equipment> {
        @Override
        public Equipment mapRow(ResultSet rs, int rowNum) throws SQLException {
            double capacity = rs.getDouble("rated_capacity_kw");
            Double ratedCapacity = rs.wasNull() ? null : capacity;
            Timestamp createdAt = rs.getTimestamp("created_at");
            return Equipment.builder()
                    .entityId(rs.getString("entity_id"))
                    .name(rs.getString("name"))
                    .equipmentType(rs.getString("equipment_type"))
                    .ratedCapacityKw(ratedCapacity)
                    .active(rs.getBoolean("active"))
                    .createdAt(createdAt != null ? createdAt.toInstant() : null)
                    .build();
        }
    }
}
