package com.company.energyperformance.repository;

import com.company.energyperformance.domain.TariffRate;
import com.company.energyperformance.domain.enums.EnergySourceType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Time;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class TariffRateRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Tariffs of a region and source type, highest priority first.
     * {@code days_of_week} holds ISO day numbers as a comma separated list (1 = Monday).
     */
    public List<TariffRate> findByRegionAndType(String region, EnergySourceType type) {
        String sql = """
            SELECT tariff_id, name, region, source_type, valid_from, valid_to,
                   days_of_week, start_time, end_time, rate, priority
            FROM tariff_rates
            WHERE region = ?
            AND source_type = ?
            ORDER BY priority DESC, tariff_id
            """;

        return new ArrayList<>(jdbcTemplate.query(sql, new TariffRateRowMapper(), region, type.name()));
    }

    private static class TariffRateRowMapper implements RowMapper<TariffRate> {
        @Override
        public TariffRate mapRow(ResultSet rs, int rowNum) throws SQLException {
            Date validFrom = rs.getDate("valid_from");
            Date validTo = rs.getDate("valid_to");
            Time startTime = rs.getTime("start_time");
            Time endTime = rs.getTime("end_time");

            return TariffRate.builder()
                    .tariffId(rs.getLong("tariff_id"))
                    .name(rs.getString("name"))
                    .region(rs.getString("region"))
                    .energySourceType(EnergySourceType.fromString(rs.getString("source_type")))
                    .validFrom(validFrom != null ? validFrom.toLocalDate() : null)
                    .validTo(validTo != null ? validTo.toLocalDate() : null)
                    .daysOfWeek(parseDays(rs.getString("days_of_week")))
                    .startTime(startTime != null ? startTime.toLocalTime() : null)
                    .endTime(endTime != null ? endTime.toLocalTime() : null)
                    .rate(rs.getDouble("rate"))
                    .priority(rs.getInt("priority"))
                    .build();
        }

        private List<DayOfWeek> parseDays(String value) {
            List<DayOfWeek> days = new ArrayList<>();
            if (value == null || value.isBlank()) {
                return days;
            }
            Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(s -> DayOfWeek.of(Integer.parseInt(s)))
                    .forEach(days::add);
            return days;
        }
    }
}
