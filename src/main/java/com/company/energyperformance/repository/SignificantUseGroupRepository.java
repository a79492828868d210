package com.company.energyperformance.repository;

import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.exception.TransientStoreException;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class SignificantUseGroupRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT group_id, name, energy_source_id, region, active, created_at
        FROM significant_use_groups
        """;

    public Optional<SignificantUseGroup> findById(String groupId) {
        String sql = SELECT_BASE + " WHERE group_id = ?";

        List<SignificantUseGroup> results = jdbcTemplate.query(sql, new GroupRowMapper(), groupId);
        if (results.isEmpty()) {
            return Optional.empty();
        }
        SignificantUseGroup group = results.get(0);
        group.setEntityIds(findMembers(groupId));
        return Optional.of(group);
    }

    public List<SignificantUseGroup> findAllActive() {
        String sql = SELECT_BASE + " WHERE active = true ORDER BY group_id";
        List<SignificantUseGroup> groups = jdbcTemplate.query(sql, new GroupRowMapper());
        groups.forEach(group -> group.setEntityIds(findMembers(group.getGroupId())));
        return groups;
    }

    /**
     * Groups of other ids that already claim one of the entities under the same energy source
     */
    public List<String> findConflictingMemberships(String groupId, String energySourceId, List<String> entityIds) {
        if (entityIds.isEmpty()) {
            return new ArrayList<>();
        }
        String placeholders = String.join(",", java.util.Collections.nCopies(entityIds.size(), "?"));
        String sql = String.format("""
            SELECT DISTINCT entity_id || ' (group ' || group_id || ')'
            FROM group_members
            WHERE energy_source_id = ?
            AND group_id <> ?
            AND entity_id IN (%s)
            ORDER BY 1
            """, placeholders);

        List<Object> params = new ArrayList<>();
        params.add(energySourceId);
        params.add(groupId);
        params.addAll(entityIds);
        return jdbcTemplate.queryForList(sql, String.class, params.toArray());
    }

    @Transactional
    public SignificantUseGroup save(SignificantUseGroup group) {
        if (group.getCreatedAt() == null) {
            group.setCreatedAt(Instant.now());
        }

        String sql = """
            INSERT INTO significant_use_groups (
                group_id, name, energy_source_id, region, active, created_at
            ) VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (group_id) DO UPDATE SET
                name = EXCLUDED.name,
                region = EXCLUDED.region,
                active = EXCLUDED.active
            """;

        try {
            jdbcTemplate.update(sql,
                    group.getGroupId(),
                    group.getName(),
                    group.getEnergySourceId(),
                    group.getRegion(),
                    group.getActive() == null || group.getActive(),
                    Timestamp.from(group.getCreatedAt()));

            jdbcTemplate.update("DELETE FROM group_members WHERE group_id = ?", group.getGroupId());

            List<Object[]> members = new ArrayList<>();
            for (String entityId : group.getEntityIds()) {
                members.add(new Object[]{group.getGroupId(), entityId, group.getEnergySourceId()});
            }
            jdbcTemplate.batchUpdate(
                    "INSERT INTO group_members (group_id, entity_id, energy_source_id) VALUES (?, ?, ?)",
                    members);
        } catch (Exception e) {
            log.error("Failed to save group {}", group.getGroupId(), e);
            throw new TransientStoreException("Failed to save significant use group", e);
        }
        return group;
    }

    private List<String> findMembers(String groupId) {
        return new ArrayList<>(jdbcTemplate.queryForList(
                "SELECT entity_id FROM group_members WHERE group_id = ? ORDER BY entity_id",
                String.class, groupId));
    }

    private static class GroupRowMapper implements RowMapper<SignificantUseGroup> {
        @Override
        public SignificantUseGroup mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return SignificantUseGroup.builder()
                    .groupId(rs.getString("group_id"))
                    .name(rs.getString("name"))
                    .energySourceId(rs.getString("energy_source_id"))
                    .region(rs.getString("region"))
                    .active(rs.getBoolean("active"))
                    .createdAt(createdAt != null ? createdAt.toInstant() : null)
                    .build();
        }
    }
}
