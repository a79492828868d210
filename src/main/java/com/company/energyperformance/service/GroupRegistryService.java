package com.company.energyperformance.service;

import com.company.energyperformance.domain.EnergySource;
import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.event.GroupRegisteredEvent;
import com.company.energyperformance.exception.ResourceNotFoundException;
import com.company.energyperformance.exception.ValidationException;
import com.company.energyperformance.repository.EquipmentRepository;
import com.company.energyperformance.repository.SignificantUseGroupRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Registers significant use groups. A group has exactly one energy source and at least one
 * entity; an entity may sit in several groups only under different energy sources.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GroupRegistryService {

    private final SignificantUseGroupRepository groupRepository;
    private final EquipmentRepository equipmentRepository;
    private final ReferenceDataService referenceDataService;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    @Transactional
    public SignificantUseGroup register(SignificantUseGroup group) {
        if (group.getGroupId() == null || group.getGroupId().isBlank()) {
            throw new ValidationException("groupId is required");
        }
        if (group.getEntityIds() == null || group.getEntityIds().isEmpty()) {
            throw new ValidationException("A significant use group needs at least one entity",
                    Map.of("groupId", group.getGroupId()));
        }

        List<String> entityIds = new ArrayList<>(new LinkedHashSet<>(group.getEntityIds()));
        if (entityIds.size() != group.getEntityIds().size()) {
            throw new ValidationException("Duplicate entity ids in group " + group.getGroupId());
        }

        EnergySource source = referenceDataService.getEnergySource(group.getEnergySourceId());

        for (String entityId : entityIds) {
            if (equipmentRepository.findById(entityId).isEmpty()) {
                throw new ResourceNotFoundException("Equipment", entityId);
            }
        }

        List<String> conflicts = groupRepository.findConflictingMemberships(
                group.getGroupId(), source.getEnergySourceId(), entityIds);
        if (!conflicts.isEmpty()) {
            throw new ValidationException(
                    "Entities already belong to another group for energy source " + source.getEnergySourceId(),
                    Map.of("conflicts", conflicts));
        }

        groupRepository.findById(group.getGroupId()).ifPresent(existing -> {
            if (!existing.getEnergySourceId().equals(group.getEnergySourceId())) {
                throw new ValidationException("The energy source of an existing group cannot change",
                        Map.of("groupId", group.getGroupId(),
                                "energySourceId", existing.getEnergySourceId()));
            }
        });

        group.setEntityIds(entityIds);
        if (group.getActive() == null) {
            group.setActive(true);
        }
        SignificantUseGroup saved = groupRepository.save(group);

        eventPublisher.publishEvent(new GroupRegisteredEvent(saved));
        meterRegistry.counter("groups.registered", "energy_source", source.getType().name()).increment();

        log.info("Registered group {} ({} entities, energy source {})",
                saved.getGroupId(), entityIds.size(), source.getEnergySourceId());
        return saved;
    }
}
