package com.company.energyperformance.domain.enums;

public enum EnergySourceType {
    ELECTRICITY("Electrical energy", ReadingChannel.ENERGY_KWH, ReadingChannel.POWER_KW),
    NATURAL_GAS("Natural gas (thermal)", ReadingChannel.GAS_M3, ReadingChannel.GAS_FLOW_M3H),
    STEAM("Process steam (thermal)", ReadingChannel.STEAM_KG, ReadingChannel.STEAM_FLOW_KGH),
    COMPRESSED_AIR("Compressed air (pneumatic)", ReadingChannel.AIR_M3, ReadingChannel.AIR_FLOW_M3H);

    private final String description;
    private final ReadingChannel defaultConsumptionChannel;
    private final ReadingChannel defaultDemandChannel;

    EnergySourceType(String description, ReadingChannel defaultConsumptionChannel,
                     ReadingChannel defaultDemandChannel) {
        this.description = description;
        this.defaultConsumptionChannel = defaultConsumptionChannel;
        this.defaultDemandChannel = defaultDemandChannel;
    }

    public String getDescription() {
        return description;
    }

    public ReadingChannel getDefaultConsumptionChannel() {
        return defaultConsumptionChannel;
    }

    public ReadingChannel getDefaultDemandChannel() {
        return defaultDemandChannel;
    }

    public static EnergySourceType fromString(String type) {
        if (type == null) {
            throw new IllegalArgumentException("Energy source type is required");
        }
        return EnergySourceType.valueOf(type.trim().toUpperCase().replace('-', '_'));
    }
}
