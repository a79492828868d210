package com.company.energyperformance.controller;

import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.dto.request.RegisterGroupRequest;
import com.company.energyperformance.service.GroupRegistryService;
import com.company.energyperformance.service.ReferenceDataService;
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
import java.util.ArrayList;

@RestController
@RequestMapping("/api/v1/groups")
@Tag(name = "Significant Use Groups", description = "Register and look up monitoring groups")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class GroupController {

    private final GroupRegistryService registryService;
    private final ReferenceDataService referenceDataService;

    @PostMapping
    @Operation(summary = "Register or update a group",
            description = "An entity may join several groups only under different energy sources")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<SignificantUseGroup> register(@Valid @RequestBody RegisterGroupRequest request) {
        SignificantUseGroup group = registryService.register(SignificantUseGroup.builder()
                .groupId(request.getGroupId())
                .name(request.getName())
                .energySourceId(request.getEnergySourceId())
                .entityIds(new ArrayList<>(request.getEntityIds()))
                .region(request.getRegion())
                .active(request.getActive() == null || request.getActive())
                .build());

        return ResponseEntity
                .created(URI.create("/api/v1/groups/" + group.getGroupId()))
                .body(group);
    }

    @GetMapping("/{groupId}")
    @Operation(summary = "Group with its members")
    @PreAuthorize("hasAnyRole('ENERGY_READER', 'ENERGY_ANALYST', 'ADMIN')")
    public ResponseEntity<SignificantUseGroup> group(@PathVariable String groupId) {
        return ResponseEntity.ok(referenceDataService.getGroup(groupId));
    }
}
