package com.company.energyperformance.repository;

import com.company.energyperformance.domain.RawReading;
import com.company.energyperformance.domain.enums.ReadingChannel;
import com.company.energyperformance.exception.TransientStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the append-only raw store, plus retention purges.
 * Rows are (entity_id, reading_time, channel, value); the ingestion boundary owns inserts.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RawReadingRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Readings in [start, end), one {@link RawReading} per timestamp, ordered by time
     */
    public List<RawReading> findReadings(String entityId, Instant start, Instant end) {
        String sql = """
            SELECT reading_time, channel, value
            FROM raw_readings
            WHERE entity_id = ?
            AND reading_time >= ?
            AND reading_time < ?
            ORDER BY reading_time, channel
            """;

        Map<Instant, RawReading> byTime = new LinkedHashMap<>();
        try {
            jdbcTemplate.query(sql, (RowCallbackHandler) rs -> {
                Instant time = rs.getTimestamp("reading_time").toInstant();
                String code = rs.getString("channel");
                double value = rs.getDouble("value");
                if (rs.wasNull()) {
                    return;
                }
                Optional<ReadingChannel> channel = ReadingChannel.fromCode(code);
                if (channel.isEmpty()) {
                    log.debug("Ignoring unknown channel {} for entity {}", code, entityId);
                    return;
                }
                byTime.computeIfAbsent(time, t -> RawReading.builder()
                                .entityId(entityId)
                                .timestamp(t)
                                .values(new EnumMap<>(ReadingChannel.class))
                                .build())
                        .getValues()
                        .putIfAbsent(channel.get(), value);
            }, entityId, Timestamp.from(start), Timestamp.from(end));
        } catch (Exception e) {
            log.error("Failed to read raw readings for entity {} in [{}, {})", entityId, start, end, e);
            throw new TransientStoreException("Failed to read raw readings", e);
        }
        return new ArrayList<>(byTime.values());
    }

    public int purgeBefore(String entityId, Instant cutoff) {
        String sql = "DELETE FROM raw_readings WHERE entity_id = ? AND reading_time < ?";
        try {
            return jdbcTemplate.update(sql, entityId, Timestamp.from(cutoff));
        } catch (Exception e) {
            log.error("Failed to purge raw readings for entity {} before {}", entityId, cutoff, e);
            throw new TransientStoreException("Failed to purge raw readings", e);
        }
    }
}
