package com.company.energyperformance.service;

import com.company.energyperformance.domain.EmissionFactor;
import com.company.energyperformance.domain.EnergySource;
import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.domain.TariffRate;
import com.company.energyperformance.domain.enums.EnergySourceType;
import com.company.energyperformance.exception.ResourceNotFoundException;
import com.company.energyperformance.repository.EmissionFactorRepository;
import com.company.energyperformance.repository.EnergySourceRepository;
import com.company.energyperformance.repository.SignificantUseGroupRepository;
import com.company.energyperformance.repository.TariffRateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Cached lookups of slowly changing reference data
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReferenceDataService {

    private final SignificantUseGroupRepository groupRepository;
    private final EnergySourceRepository energySourceRepository;
    private final TariffRateRepository tariffRateRepository;
    private final EmissionFactorRepository emissionFactorRepository;

    @Cacheable(value = "significantGroups", key = "#groupId")
    public SignificantUseGroup getGroup(String groupId) {
        log.debug("Cache miss for group {}", groupId);
        return groupRepository.findById(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Significant use group", groupId));
    }

    @Cacheable(value = "energySources", key = "#energySourceId")
    public EnergySource getEnergySource(String energySourceId) {
        return energySourceRepository.findById(energySourceId)
                .orElseThrow(() -> new ResourceNotFoundException("Energy source", energySourceId));
    }

    @Cacheable(value = "tariffRates", key = "#region + '-' + #type")
    public List<TariffRate> getTariffs(String region, EnergySourceType type) {
        return tariffRateRepository.findByRegionAndType(region, type);
    }

    @Cacheable(value = "emissionFactors", key = "#region + '-' + #type")
    public List<EmissionFactor> getEmissionFactors(String region, EnergySourceType type) {
        return emissionFactorRepository.findByRegionAndType(region, type);
    }
}
