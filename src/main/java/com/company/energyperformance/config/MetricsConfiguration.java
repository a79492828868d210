package com.company.energyperformance.config;

import com.company.energyperformance.repository.AnomalyFindingRepository;
import com.company.energyperformance.repository.BaselineModelRepository;
import com.company.energyperformance.repository.RefreshWatermarkRepository;
import com.company.energyperformance.service.aggregation.TierDefinition;
import com.company.energyperformance.service.aggregation.TierGraph;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.Instant;

/**
 * Application-specific gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final BaselineModelRepository modelRepository;
    private final AnomalyFindingRepository findingRepository;
    private final RefreshWatermarkRepository watermarkRepository;
    private final TierGraph tierGraph;

    @Bean
    public MeterBinder energyMetrics() {
        return (reg) -> {
            Gauge.builder("baseline.models.active", modelRepository, repo -> {
                        try {
                            return repo.countActive();
                        } catch (Exception e) {
                            log.warn("Failed to count active baselines", e);
                            return 0;
                        }
                    })
                    .description("Number of active baseline models")
                    .register(reg);

            Gauge.builder("anomaly.findings.open", findingRepository, repo -> {
                        try {
                            return repo.countOpen();
                        } catch (Exception e) {
                            log.warn("Failed to count open anomaly findings", e);
                            return 0;
                        }
                    })
                    .description("Number of unresolved anomaly findings")
                    .register(reg);

            for (TierDefinition tier : tierGraph.inTopologicalOrder()) {
                Gauge.builder("rollup.refresh.lag", watermarkRepository, repo -> {
                            try {
                                return repo.oldestRefresh(tier.getName())
                                        .map(at -> (double) Duration.between(at, Instant.now()).toSeconds())
                                        .orElse(0.0);
                            } catch (Exception e) {
                                log.warn("Failed to read refresh lag of tier {}", tier.getName(), e);
                                return 0;
                            }
                        })
                        .tag("tier", tier.getName())
                        .description("Seconds since the least recent successful refresh of the tier")
                        .baseUnit("seconds")
                        .register(reg);
            }

            log.info("Energy metrics registered");
        };
    }
}
