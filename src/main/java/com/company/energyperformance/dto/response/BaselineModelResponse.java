package com.company.energyperformance.dto.response;

import com.company.energyperformance.domain.BaselineModel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselineModelResponse {
    private String groupId;
    private String energySourceId;
    private Integer version;
    private String tier;
    private String formula;
    private List<String> featureNames;
    private Map<String, Double> coefficients;
    private Map<String, Double> pValues;
    private double intercept;
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
    private String trainedBy;
    private Instant trainedAt;
    private Instant deactivatedAt;
    private String deactivationReason;

    public static BaselineModelResponse from(BaselineModel model, String formula) {
        return BaselineModelResponse.builder()
                .groupId(model.getGroupId())
                .energySourceId(model.getEnergySourceId())
                .version(model.getVersion())
                .tier(model.getTier())
                .formula(formula)
                .featureNames(model.getFeatureNames())
                .coefficients(model.getCoefficients())
                .pValues(model.getPValues())
                .intercept(model.getIntercept())
                .trainingStart(model.getTrainingStart())
                .trainingEnd(model.getTrainingEnd())
                .sampleCount(model.getSampleCount())
                .rSquared(model.getRSquared())
                .adjustedRSquared(model.getAdjustedRSquared())
                .rmse(model.getRmse())
                .mae(model.getMae())
                .active(model.isActive())
                .qualityGatePassed(model.isQualityGatePassed())
                .qualityGateReason(model.getQualityGateReason())
                .trainedBy(model.getTrainedBy())
                .trainedAt(model.getTrainedAt())
                .deactivatedAt(model.getDeactivatedAt())
                .deactivationReason(model.getDeactivationReason())
                .build();
    }
}
