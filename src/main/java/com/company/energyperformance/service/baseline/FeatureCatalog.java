package com.company.energyperformance.service.baseline;

import com.company.energyperformance.domain.enums.EnergySourceType;
import com.company.energyperformance.domain.enums.FeatureAggregation;
import com.company.energyperformance.domain.enums.ReadingChannel;
import com.company.energyperformance.exception.UnknownFeatureException;
import com.company.energyperformance.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Registry of the features each energy source recognizes, and the default training set per
 * source. Training and prediction requests are validated against it before any data is read.
 */
@Component
public class FeatureCatalog {

    private final Map<EnergySourceType, Map<String, FeatureDefinition>> features =
            new EnumMap<>(EnergySourceType.class);
    private final Map<EnergySourceType, List<String>> defaults = new EnumMap<>(EnergySourceType.class);

    public FeatureCatalog() {
        register(EnergySourceType.ELECTRICITY,
                sum("total_production_count", ReadingChannel.PRODUCTION_COUNT, "Units produced in the bucket"),
                avg("avg_outdoor_temp_c", ReadingChannel.OUTDOOR_TEMP_C, "Mean outdoor temperature (°C)"),
                avg("avg_throughput_units_per_hour", ReadingChannel.THROUGHPUT, "Mean throughput (units/h)"),
                avg("avg_machine_temp_c", ReadingChannel.MACHINE_TEMP_C, "Mean machine temperature (°C)"),
                derived("avg_load_factor", DerivedFeature.LOAD_FACTOR, "Mean power over rated capacity"),
                avg("avg_pressure_bar", ReadingChannel.PRESSURE_BAR, "Mean operating pressure (bar)"),
                avg("avg_indoor_temp_c", ReadingChannel.INDOOR_TEMP_C, "Mean indoor temperature (°C)"),
                avg("avg_power_factor", ReadingChannel.POWER_FACTOR, "Mean power factor"),
                avg("avg_voltage_v", ReadingChannel.VOLTAGE_V, "Mean supply voltage (V)"),
                avg("avg_current_a", ReadingChannel.CURRENT_A, "Mean current draw (A)"),
                derived("heating_degree_hours", DerivedFeature.HEATING_DEGREE_HOURS, "Heating degree-hours, 18 °C base"),
                derived("cooling_degree_hours", DerivedFeature.COOLING_DEGREE_HOURS, "Cooling degree-hours, 18 °C base"),
                descriptive("avg_power_kw", ReadingChannel.POWER_KW, FeatureAggregation.AVG, "Mean demand (kW)"),
                descriptive("max_power_kw", ReadingChannel.POWER_KW, FeatureAggregation.MAX, "Peak demand (kW)"));
        defaults.put(EnergySourceType.ELECTRICITY, List.of(
                "total_production_count", "avg_outdoor_temp_c", "avg_throughput_units_per_hour",
                "avg_machine_temp_c", "avg_load_factor", "avg_pressure_bar"));

        register(EnergySourceType.NATURAL_GAS,
                derived("heating_degree_hours", DerivedFeature.HEATING_DEGREE_HOURS, "Heating degree-hours, 18 °C base"),
                avg("avg_outdoor_temp_c", ReadingChannel.OUTDOOR_TEMP_C, "Mean outdoor temperature (°C)"),
                sum("total_production_count", ReadingChannel.PRODUCTION_COUNT, "Units produced in the bucket"),
                avg("avg_pressure_bar", ReadingChannel.PRESSURE_BAR, "Mean supply pressure (bar)"),
                avg("avg_gas_temp_c", ReadingChannel.GAS_TEMP_C, "Mean gas temperature (°C)"),
                descriptive("avg_flow_rate_m3h", ReadingChannel.GAS_FLOW_M3H, FeatureAggregation.AVG, "Mean gas flow (m³/h)"),
                descriptive("max_flow_rate_m3h", ReadingChannel.GAS_FLOW_M3H, FeatureAggregation.MAX, "Peak gas flow (m³/h)"));
        defaults.put(EnergySourceType.NATURAL_GAS, List.of(
                "heating_degree_hours", "avg_outdoor_temp_c", "total_production_count"));

        register(EnergySourceType.STEAM,
                sum("total_production_count", ReadingChannel.PRODUCTION_COUNT, "Units produced in the bucket"),
                avg("avg_pressure_bar", ReadingChannel.PRESSURE_BAR, "Mean steam pressure (bar)"),
                avg("avg_steam_temp_c", ReadingChannel.STEAM_TEMP_C, "Mean steam temperature (°C)"),
                avg("avg_outdoor_temp_c", ReadingChannel.OUTDOOR_TEMP_C, "Mean outdoor temperature (°C)"),
                descriptive("avg_flow_rate_kgh", ReadingChannel.STEAM_FLOW_KGH, FeatureAggregation.AVG, "Mean steam flow (kg/h)"));
        defaults.put(EnergySourceType.STEAM, List.of(
                "total_production_count", "avg_pressure_bar", "avg_outdoor_temp_c"));

        register(EnergySourceType.COMPRESSED_AIR,
                sum("total_production_count", ReadingChannel.PRODUCTION_COUNT, "Units produced in the bucket"),
                avg("avg_pressure_bar", ReadingChannel.PRESSURE_BAR, "Mean line pressure (bar)"),
                avg("avg_throughput_units_per_hour", ReadingChannel.THROUGHPUT, "Mean throughput (units/h)"),
                avg("avg_outdoor_temp_c", ReadingChannel.OUTDOOR_TEMP_C, "Mean outdoor temperature (°C)"),
                descriptive("avg_flow_rate_m3h", ReadingChannel.AIR_FLOW_M3H, FeatureAggregation.AVG, "Mean air flow (m³/h)"));
        defaults.put(EnergySourceType.COMPRESSED_AIR, List.of(
                "total_production_count", "avg_pressure_bar"));
    }

    public List<FeatureDefinition> featuresFor(EnergySourceType type) {
        return new ArrayList<>(features.get(type).values());
    }

    public List<String> defaultFeatures(EnergySourceType type) {
        return defaults.get(type);
    }

    public List<String> regressionFeatureNames(EnergySourceType type) {
        List<String> names = new ArrayList<>();
        features.get(type).values().stream()
                .filter(FeatureDefinition::isRegressionEligible)
                .forEach(f -> names.add(f.getName()));
        return names;
    }

    /**
     * Resolves a training feature list, rejecting unknown, descriptive-only and duplicate names
     */
    public List<FeatureDefinition> resolveForTraining(EnergySourceType type, List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new ValidationException("At least one feature is required");
        }

        Map<String, FeatureDefinition> known = features.get(type);
        List<String> unknown = new ArrayList<>();
        List<String> notEligible = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<String> duplicates = new ArrayList<>();

        for (String name : names) {
            FeatureDefinition definition = known.get(name);
            if (definition == null) {
                unknown.add(name);
            } else if (!definition.isRegressionEligible()) {
                notEligible.add(name);
            }
            if (!seen.add(name)) {
                duplicates.add(name);
            }
        }

        if (!unknown.isEmpty()) {
            throw new UnknownFeatureException(type.name(), unknown, regressionFeatureNames(type));
        }
        if (!notEligible.isEmpty()) {
            throw new ValidationException("Features describe consumption and cannot be regression inputs",
                    Map.of("features", notEligible));
        }
        if (!duplicates.isEmpty()) {
            throw new ValidationException("Duplicate feature names", Map.of("features", duplicates));
        }

        List<FeatureDefinition> resolved = new ArrayList<>();
        names.forEach(name -> resolved.add(known.get(name)));
        return resolved;
    }

    private void register(EnergySourceType type, FeatureDefinition... definitions) {
        Map<String, FeatureDefinition> byName = new LinkedHashMap<>();
        for (FeatureDefinition definition : definitions) {
            byName.put(definition.getName(), definition);
        }
        features.put(type, byName);
    }

    private static FeatureDefinition sum(String name, ReadingChannel channel, String description) {
        return eligible(name, channel, FeatureAggregation.SUM, description);
    }

    private static FeatureDefinition avg(String name, ReadingChannel channel, String description) {
        return eligible(name, channel, FeatureAggregation.AVG, description);
    }

    private static FeatureDefinition eligible(String name, ReadingChannel channel,
                                              FeatureAggregation aggregation, String description) {
        return FeatureDefinition.builder()
                .name(name)
                .channel(channel)
                .aggregation(aggregation)
                .description(description)
                .regressionEligible(true)
                .build();
    }

    private static FeatureDefinition derived(String name, DerivedFeature derived, String description) {
        return FeatureDefinition.builder()
                .name(name)
                .aggregation(FeatureAggregation.CUSTOM)
                .derived(derived)
                .description(description)
                .regressionEligible(true)
                .build();
    }

    private static FeatureDefinition descriptive(String name, ReadingChannel channel,
                                                 FeatureAggregation aggregation, String description) {
        return FeatureDefinition.builder()
                .name(name)
                .channel(channel)
                .aggregation(aggregation)
                .description(description)
                .regressionEligible(false)
                .build();
    }
}
