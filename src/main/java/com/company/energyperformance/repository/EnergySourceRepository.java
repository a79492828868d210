package com.company.energyperformance.repository;

import com.company.energyperformance.domain.EnergySource;
import com.company.energyperformance.domain.enums.EnergySourceType;
import com.company.energyperformance.domain.enums.ReadingChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class EnergySourceRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT energy_source_id, name, source_type, unit, unit_cost, emission_factor,
               consumption_channel, demand_channel
        FROM energy_sources
        """;

    public Optional<EnergySource> findById(String energySourceId) {
        String sql = SELECT_BASE + " WHERE energy_source_id = ?";

        List<EnergySource> results = jdbcTemplate.query(sql, new EnergySourceRowMapper(), energySourceId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private static class EnergySourceRowMapper implements RowMapper<EnergySource> {
        @Override
        public EnergySource mapRow(ResultSet rs, int rowNum) throws SQLException {
            return EnergySource.builder()
                    .energySourceId(rs.getString("energy_source_id"))
                    .name(rs.getString("name"))
                    .type(EnergySourceType.fromString(rs.getString("source_type")))
                    .unit(rs.getString("unit"))
                    .unitCost(nullableDouble(rs, "unit_cost"))
                    .emissionFactor(nullableDouble(rs, "emission_factor"))
                    .consumptionChannel(ReadingChannel.fromCode(rs.getString("consumption_channel")).orElse(null))
                    .demandChannel(ReadingChannel.fromCode(rs.getString("demand_channel")).orElse(null))
                    .build();
        }

        private Double nullableDouble(ResultSet rs, String column) throws SQLException {
            double value = rs.getDouble(column);
            return rs.wasNull() ? null : value;
        }
    }
}
