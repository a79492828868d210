package com.company.energyperformance.controller;

import com.company.energyperformance.service.aggregation.RollupQueryResult;
import com.company.energyperformance.service.aggregation.RollupQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/rollups")
@Tag(name = "Rollups", description = "Tiered aggregates of entities and groups")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class RollupController {

    private final RollupQueryService queryService;
    private final MeterRegistry meterRegistry;

    @GetMapping("/entities/{entityId}")
    @Operation(summary = "Rollup rows of one entity",
            description = "staleData is set when part of the range may still change")
    @PreAuthorize("hasAnyRole('ENERGY_READER', 'ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<RollupQueryResult> entityRollups(
            @PathVariable String entityId,
            @RequestParam String tier,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {

        meterRegistry.counter("api.rollups.requests", "scope", "entity", "tier", tier).increment();
        return ResponseEntity.ok(queryService.queryEntity(entityId, tier, start, end, Instant.now()));
    }

    @GetMapping("/groups/{groupId}")
    @Operation(summary = "Merged rollup series of a significant use group")
    @PreAuthorize("hasAnyRole('ENERGY_READER', 'ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<RollupQueryResult> groupRollups(
            @PathVariable String groupId,
            @RequestParam String tier,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {

        meterRegistry.counter("api.rollups.requests", "scope", "group", "tier", tier).increment();
        return ResponseEntity.ok(queryService.queryGroup(groupId, tier, start, end, Instant.now()));
    }
}
