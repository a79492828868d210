package com.company.energyperformance.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Telemetry channels carried by raw readings and rollup rows.
 * The code is the value stored in the raw store and in rollup summaries.
 */
public enum ReadingChannel {
    POWER_KW("power_kw", ChannelKind.RATE, "kW"),
    ENERGY_KWH("energy_kwh", ChannelKind.INCREMENT, "kWh"),
    VOLTAGE_V("voltage_v", ChannelKind.GAUGE, "V"),
    CURRENT_A("current_a", ChannelKind.GAUGE, "A"),
    POWER_FACTOR("power_factor", ChannelKind.GAUGE, ""),
    PRODUCTION_COUNT("production_count", ChannelKind.INCREMENT, "units"),
    THROUGHPUT("throughput", ChannelKind.GAUGE, "units/h"),
    OUTDOOR_TEMP_C("outdoor_temp_c", ChannelKind.GAUGE, "°C"),
    INDOOR_TEMP_C("indoor_temp_c", ChannelKind.GAUGE, "°C"),
    MACHINE_TEMP_C("machine_temp_c", ChannelKind.GAUGE, "°C"),
    PRESSURE_BAR("pressure_bar", ChannelKind.GAUGE, "bar"),
    GAS_FLOW_M3H("gas_flow_m3h", ChannelKind.RATE, "m³/h"),
    GAS_M3("gas_m3", ChannelKind.INCREMENT, "m³"),
    GAS_TEMP_C("gas_temp_c", ChannelKind.GAUGE, "°C"),
    STEAM_FLOW_KGH("steam_flow_kgh", ChannelKind.RATE, "kg/h"),
    STEAM_KG("steam_kg", ChannelKind.INCREMENT, "kg"),
    STEAM_TEMP_C("steam_temp_c", ChannelKind.GAUGE, "°C"),
    AIR_FLOW_M3H("air_flow_m3h", ChannelKind.RATE, "m³/h"),
    AIR_M3("air_m3", ChannelKind.INCREMENT, "m³");

    private final String code;
    private final ChannelKind kind;
    private final String unit;

    ReadingChannel(String code, ChannelKind kind, String unit) {
        this.code = code;
        this.kind = kind;
        this.unit = unit;
    }

    public String getCode() {
        return code;
    }

    public ChannelKind getKind() {
        return kind;
    }

    public String getUnit() {
        return unit;
    }

    public static Optional<ReadingChannel> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(c -> c.code.equalsIgnoreCase(code))
                .findFirst();
    }
}
