package com.company.energyperformance.domain;

import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All energy indicators of one group over one period, computed in a single pass
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KpiBundle {

    private String groupId;
    private Instant periodStart;
    private Instant periodEnd;
    private String tier;
    private String unit;

    private double totalConsumption;
    private double totalProduction;
    private Double specificConsumption;
    private double peakDemand;
    private double averageDemand;
    private double loadFactor;

    private double totalCost;
    private Double costPerUnit;
    @Builder.Default
    private Map<String, Double> costByTariff = new LinkedHashMap<>();
    private int bucketsAtDefaultRate;

    private double emissionsKgCo2;
    private Double emissionsPerUnit;
    private double emissionFactor;

    private int bucketCount;
    private boolean staleData;
}
