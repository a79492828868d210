package com.company.energyperformance.repository;

import com.company.energyperformance.domain.EmissionFactor;
import com.company.energyperformance.domain.enums.EnergySourceType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class EmissionFactorRepository {

    private final JdbcTemplate jdbcTemplate;

    public List<EmissionFactor> findByRegionAndType(String region, EnergySourceType type) {
        String sql = """
            SELECT factor_id, region, source_type, valid_from, valid_to, factor
            FROM emission_factors
            WHERE region = ?
            AND source_type = ?
            ORDER BY valid_from DESC NULLS LAST, factor_id
            """;

        return new ArrayList<>(jdbcTemplate.query(sql, new EmissionFactorRowMapper(), region, type.name()));
    }

    private static class EmissionFactorRowMapper implements RowMapper<EmissionFactor> {
        @Override
        public EmissionFactor mapRow(ResultSet rs, int rowNum) throws SQLException {
            Date validFrom = rs.getDate("valid_from");
            Date validTo = rs.getDate("valid_to");

            return EmissionFactor.builder()
                    .factorId(rs.getLong("factor_id"))
                    .region(rs.getString("region"))
                    .energySourceType(EnergySourceType.fromString(rs.getString("source_type")))
                    .validFrom(validFrom != null ? validFrom.toLocalDate() : null)
                    .validTo(validTo != null ? validTo.toLocalDate() : null)
                    .factor(rs.getDouble("factor"))
                    .build();
        }
    }
}
