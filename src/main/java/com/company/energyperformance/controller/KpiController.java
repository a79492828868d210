package com.company.energyperformance.controller;

import com.company.energyperformance.domain.KpiBundle;
import com.company.energyperformance.service.kpi.KpiService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/kpis")
@Tag(name = "KPIs", description = "Specific consumption, demand, cost and emissions")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class KpiController {

    private final KpiService kpiService;
    private final MeterRegistry meterRegistry;

    @GetMapping("/groups/{groupId}")
    @Operation(summary = "Indicator bundle of a group over a period")
    @PreAuthorize("hasAnyRole('ENERGY_READER', 'ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<KpiBundle> kpis(
            @PathVariable String groupId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {

        meterRegistry.counter("api.kpis.requests").increment();
        KpiBundle bundle = kpiService.calculate(groupId, start, end);

        // Provisional figures change with every refresh
        CacheControl cacheControl = bundle.isStaleData()
                ? CacheControl.noCache()
                : CacheControl.maxAge(5, TimeUnit.MINUTES).cachePrivate();
        return ResponseEntity.ok().cacheControl(cacheControl).body(bundle);
    }
}
