package com.company.energyperformance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "energy.anomaly")
public class AnomalyProperties {

    private double contamination = 0.10;

    private int numberOfTrees = 50;

    private int sampleSize = 256;

    private long randomSeed = 42L;

    private int minReferenceSamples = 16;

    private int maxReferenceSamples = 2048;

    private Duration sweepWindow = Duration.ofHours(6);

    private Duration detectionDeadline = Duration.ofSeconds(30);
}
