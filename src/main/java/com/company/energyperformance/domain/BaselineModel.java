package com.company.energyperformance.domain;

import lombok.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A trained regression baseline for one (group, energy source, version).
 * Rows are never deleted; retired models keep their metrics for audit.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BaselineModel implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long modelId;
    private String groupId;
    private String energySourceId;
    private Integer version;
    private String tier;

    @Builder.Default
    private List<String> featureNames = new ArrayList<>();
    @Builder.Default
    private Map<String, Double> coefficients = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Double> pValues = new LinkedHashMap<>();
    private double intercept;
    private boolean interceptIncluded;

    private Instant trainingStart;
    private Instant trainingEnd;
    private int sampleCount;
    private double rSquared;
    private double adjustedRSquared;
    private double rmse;
    private double mae;

    private boolean active;
    private boolean qualityGatePassed;
    private String qualityGateReason;
    private String consumptionUnit;

    private String trainedBy;
    private Instant trainedAt;
    private Instant deactivatedAt;
    private String deactivationReason;
}
