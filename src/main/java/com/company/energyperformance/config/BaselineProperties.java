package com.company.energyperformance.config;

import com.company.energyperformance.domain.enums.OperationalState;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "energy.baseline")
public class BaselineProperties {

    private int minSamples = 50;

    private double minRSquared = 0.80;

    private String defaultTier = "1hour";

    private Duration trainingDeadline = Duration.ofSeconds(60);

    private Duration retrainLookback = Duration.ofDays(30);

    // Buckets touching these states are not representative of normal operation
    private List<OperationalState> excludedStates = new ArrayList<>(List.of(
            OperationalState.MAINTENANCE, OperationalState.FAULT, OperationalState.OFFLINE));
}
