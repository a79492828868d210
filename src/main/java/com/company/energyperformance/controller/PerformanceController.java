package com.company.energyperformance.controller;

import com.company.energyperformance.domain.BaselineAdjustment;
import com.company.energyperformance.domain.PerformanceRecord;
import com.company.energyperformance.dto.request.BaselineAdjustmentRequest;
import com.company.energyperformance.dto.request.EvaluatePeriodRequest;
import com.company.energyperformance.security.OperatorContext;
import com.company.energyperformance.service.deviation.PerformanceReport;
import com.company.energyperformance.service.deviation.PerformanceService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/performance")
@Tag(name = "Performance", description = "Deviation from baseline, compliance grades and trends")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class PerformanceController {

    private final PerformanceService performanceService;
    private final OperatorContext operatorContext;
    private final MeterRegistry meterRegistry;

    @PostMapping("/groups/{groupId}/evaluate")
    @Operation(summary = "Evaluate a period against the active baseline",
            description = "Finalized periods are returned as stored; open periods are regenerated")
    @PreAuthorize("hasAnyRole('ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<PerformanceRecord> evaluate(@PathVariable String groupId,
                                                      @Valid @RequestBody EvaluatePeriodRequest request) {
        meterRegistry.counter("api.performance.evaluate.requests").increment();
        return ResponseEntity.ok(performanceService.evaluate(groupId, request.getPeriodStart(), request.getPeriodEnd()));
    }

    @GetMapping("/groups/{groupId}")
    @Operation(summary = "Stored performance records of a group within a range")
    @PreAuthorize("hasAnyRole('ENERGY_READER', 'ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<List<PerformanceRecord>> history(
            @PathVariable String groupId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ResponseEntity.ok(performanceService.history(groupId, from, to));
    }

    @GetMapping("/groups/{groupId}/report")
    @Operation(summary = "Compliance report for a calendar period",
            description = "Quarters and years include a monthly breakdown")
    @PreAuthorize("hasAnyRole('ENERGY_READER', 'ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<PerformanceReport> report(
            @PathVariable String groupId,
            @RequestParam int year,
            @Parameter(description = "Q1..Q4, annual, month number or YYYY-MM")
            @RequestParam(defaultValue = "annual") String period) {
        meterRegistry.counter("api.performance.report.requests").increment();
        return ResponseEntity.ok(performanceService.report(groupId, year, period));
    }

    @PostMapping("/groups/{groupId}/adjustments")
    @Operation(summary = "Record a baseline adjustment",
            description = "Periods starting at or after the adjustment begin a new cumulative trend segment")
    @PreAuthorize("hasAnyRole('ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<BaselineAdjustment> recordAdjustment(@PathVariable String groupId,
                                                               @Valid @RequestBody BaselineAdjustmentRequest request) {
        BaselineAdjustment adjustment = performanceService.recordAdjustment(groupId, request.getEffectiveAt(),
                request.getReason(), operatorContext.currentOperator());
        return ResponseEntity.status(HttpStatus.CREATED).body(adjustment);
    }
}
