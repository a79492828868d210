package com.company.energyperformance.controller;

import com.company.energyperformance.domain.BaselineModel;
import com.company.energyperformance.domain.Prediction;
import com.company.energyperformance.domain.enums.EnergySourceType;
import com.company.energyperformance.dto.request.DeactivateBaselineRequest;
import com.company.energyperformance.dto.request.PredictRequest;
import com.company.energyperformance.dto.request.TrainBaselineRequest;
import com.company.energyperformance.dto.response.BaselineModelResponse;
import com.company.energyperformance.dto.response.FeatureCatalogResponse;
import com.company.energyperformance.exception.QualityGateFailureException;
import com.company.energyperformance.security.OperatorContext;
import com.company.energyperformance.service.baseline.BaselineModelRegistry;
import com.company.energyperformance.service.baseline.BaselinePredictor;
import com.company.energyperformance.service.baseline.FeatureCatalog;
import com.company.energyperformance.service.baseline.TrainingCommand;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/baselines")
@Tag(name = "Baselines", description = "Train, version and query regression baselines")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class BaselineController {

    private final BaselineModelRegistry registry;
    private final BaselinePredictor predictor;
    private final FeatureCatalog featureCatalog;
    private final OperatorContext operatorContext;
    private final MeterRegistry meterRegistry;

    @PostMapping("/train")
    @Operation(summary = "Train a new baseline version",
            description = "Passing the quality gate activates the version; a failed gate stores it inactive and answers 422")
    @PreAuthorize("hasAnyRole('ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<BaselineModelResponse> train(@Valid @RequestBody TrainBaselineRequest request) {
        String operator = operatorContext.currentOperator();
        log.info("Training request from {} for group {} [{} - {})", operator, request.getGroupId(),
                request.getWindowStart(), request.getWindowEnd());

        meterRegistry.counter("api.baselines.train.requests").increment();

        BaselineModel model = registry.train(TrainingCommand.builder()
                .groupId(request.getGroupId())
                .windowStart(request.getWindowStart())
                .windowEnd(request.getWindowEnd())
                .features(request.getFeatures())
                .tier(request.getTier())
                .minSamples(request.getMinSamples())
                .minRSquared(request.getMinRSquared())
                .includeIntercept(request.getIncludeIntercept() == null || request.getIncludeIntercept())
                .trainedBy(operator)
                .build());

        if (!model.isQualityGatePassed()) {
            throw new QualityGateFailureException(model);
        }

        return ResponseEntity
                .created(URI.create("/api/v1/baselines/groups/" + model.getGroupId() + "/versions/" + model.getVersion()))
                .body(BaselineModelResponse.from(model, predictor.formula(model)));
    }

    @GetMapping("/groups/{groupId}/active")
    @Operation(summary = "Active baseline of a group")
    @PreAuthorize("hasAnyRole('ENERGY_READER', 'ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<BaselineModelResponse> active(@PathVariable String groupId) {
        BaselineModel model = registry.activeModel(groupId);
        return ResponseEntity.ok(BaselineModelResponse.from(model, predictor.formula(model)));
    }

    @GetMapping("/groups/{groupId}/history")
    @Operation(summary = "Every stored version of a group, newest first")
    @PreAuthorize("hasAnyRole('ENERGY_READER', 'ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<List<BaselineModelResponse>> history(@PathVariable String groupId) {
        return ResponseEntity.ok(registry.history(groupId).stream()
                .map(m -> BaselineModelResponse.from(m, predictor.formula(m)))
                .collect(Collectors.toList()));
    }

    @PostMapping("/groups/{groupId}/versions/{version}/activate")
    @Operation(summary = "Make a stored version the active one")
    @PreAuthorize("hasAnyRole('ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<BaselineModelResponse> activate(@PathVariable String groupId, @PathVariable int version) {
        log.info("Activation of v{} for group {} requested by {}", version, groupId, operatorContext.currentOperator());
        BaselineModel model = registry.activate(groupId, version);
        return ResponseEntity.ok(BaselineModelResponse.from(model, predictor.formula(model)));
    }

    @PostMapping("/groups/{groupId}/versions/{version}/deactivate")
    @Operation(summary = "Retire the active version, leaving the group without a baseline")
    @PreAuthorize("hasAnyRole('ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<BaselineModelResponse> deactivate(
            @PathVariable String groupId,
            @PathVariable int version,
            @Valid @RequestBody(required = false) DeactivateBaselineRequest request) {
        String operator = operatorContext.currentOperator();
        String reason = request != null && request.getReason() != null
                ? request.getReason() + " (" + operator + ")"
                : "Deactivated by " + operator;
        BaselineModel model = registry.deactivate(groupId, version, reason);
        return ResponseEntity.ok(BaselineModelResponse.from(model, predictor.formula(model)));
    }

    @PostMapping("/groups/{groupId}/predict")
    @Operation(summary = "Expected consumption for one set of feature values")
    @PreAuthorize("hasAnyRole('ENERGY_READER', 'ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<Prediction> predict(@PathVariable String groupId,
                                              @Valid @RequestBody PredictRequest request) {
        meterRegistry.counter("api.baselines.predict.requests").increment();
        return ResponseEntity.ok(registry.predict(groupId, request.getFeatures()));
    }

    @GetMapping("/features/{energySourceType}")
    @Operation(summary = "Features available for an energy source type")
    @PreAuthorize("hasAnyRole('ENERGY_READER', 'ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<FeatureCatalogResponse> features(@PathVariable EnergySourceType energySourceType) {
        return ResponseEntity.ok(FeatureCatalogResponse.builder()
                .energySourceType(energySourceType)
                .defaultFeatures(featureCatalog.defaultFeatures(energySourceType))
                .features(featureCatalog.featuresFor(energySourceType).stream()
                        .map(f -> FeatureCatalogResponse.Feature.builder()
                                .name(f.getName())
                                .description(f.getDescription())
                                .aggregation(f.getDerived() != null ? f.getDerived().name() : f.getAggregation().name())
                                .regressionEligible(f.isRegressionEligible())
                                .build())
                        .collect(Collectors.toList()))
                .build());
    }
}
