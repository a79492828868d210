package com.company.energyperformance.controller;

import com.company.energyperformance.domain.AnomalyFinding;
import com.company.energyperformance.domain.enums.ResolutionState;
import com.company.energyperformance.domain.enums.Severity;
import com.company.energyperformance.dto.request.DetectAnomaliesRequest;
import com.company.energyperformance.dto.request.ResolveFindingRequest;
import com.company.energyperformance.security.OperatorContext;
import com.company.energyperformance.service.anomaly.AnomalyDetectionResult;
import com.company.energyperformance.service.anomaly.AnomalyService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Outlier detection and finding resolution")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class AnomalyController {

    private final AnomalyService anomalyService;
    private final OperatorContext operatorContext;
    private final MeterRegistry meterRegistry;

    @PostMapping("/groups/{groupId}/detect")
    @Operation(summary = "Score a window against the active baseline",
            description = "Re-running a window updates existing findings instead of duplicating them")
    @PreAuthorize("hasAnyRole('ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<AnomalyDetectionResult> detect(@PathVariable String groupId,
                                                         @Valid @RequestBody DetectAnomaliesRequest request) {
        meterRegistry.counter("api.anomalies.detect.requests").increment();
        return ResponseEntity.ok(anomalyService.detect(groupId, request.getWindowStart(), request.getWindowEnd(),
                request.getContamination()));
    }

    @GetMapping
    @Operation(summary = "Findings by group or entity, newest first")
    @PreAuthorize("hasAnyRole('ENERGY_READER', 'ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<List<AnomalyFinding>> findings(
            @RequestParam(required = false) String groupId,
            @RequestParam(required = false) String entityId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) ResolutionState state,
            @RequestParam(defaultValue = "200") @Min(1) @Max(1000) int limit) {
        meterRegistry.counter("api.anomalies.query.requests").increment();
        return ResponseEntity.ok(anomalyService.findings(groupId, entityId, from, to, severity, state, limit));
    }

    @PostMapping("/{findingId}/resolve")
    @Operation(summary = "Mark a finding resolved")
    @PreAuthorize("hasAnyRole('ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<AnomalyFinding> resolve(@PathVariable long findingId,
                                                  @Valid @RequestBody(required = false) ResolveFindingRequest request) {
        String operator = operatorContext.currentOperator();
        return ResponseEntity.ok(anomalyService.resolve(findingId,
                request != null ? request.getNotes() : null, operator));
    }
}
