package com.company.energyperformance.dto.response;

import com.company.energyperformance.domain.enums.EnergySourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureCatalogResponse {
    private EnergySourceType energySourceType;
    private List<String> defaultFeatures;
    private List<Feature> features;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Feature {
        private String name;
        private String description;
        private String aggregation;
        private boolean regressionEligible;
    }
}
