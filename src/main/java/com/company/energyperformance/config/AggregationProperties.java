package com.company.energyperformance.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Rollup tier chain and raw retention
 */
@Data
@ConfigurationProperties(prefix = "energy.aggregation")
public class AggregationProperties {

    public static final String RAW_SOURCE = "raw";

    private Duration rawRetention = Duration.ofDays(90);

    private List<TierSpec> tiers = defaultTiers();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierSpec {
        private String name;
        private String source = RAW_SOURCE;
        private Duration bucketWidth;
        private Duration refreshInterval;
        private Duration settle;
        private Duration lookback;
        private Duration retention;
        // Longest span one refresh may recompute while catching up after missed refreshes
        private Duration maxCatchUp;
    }

    public static List<TierSpec> defaultTiers() {
        List<TierSpec> tiers = new ArrayList<>();
        tiers.add(new TierSpec("1min", RAW_SOURCE, Duration.ofMinutes(1), Duration.ofMinutes(1),
                Duration.ofMinutes(1), Duration.ofHours(3), Duration.ofDays(30), null));
        tiers.add(new TierSpec("15min", "1min", Duration.ofMinutes(15), Duration.ofMinutes(5),
                Duration.ofMinutes(15), Duration.ofHours(6), null, null));
        tiers.add(new TierSpec("1hour", "15min", Duration.ofHours(1), Duration.ofMinutes(15),
                Duration.ofHours(1), Duration.ofDays(1), null, null));
        tiers.add(new TierSpec("1day", "1hour", Duration.ofDays(1), Duration.ofHours(1),
                Duration.ofDays(1), Duration.ofDays(7), null, null));
        return tiers;
    }
}
