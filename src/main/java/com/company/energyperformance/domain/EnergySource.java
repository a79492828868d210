package com.company.energyperformance.domain;

import com.company.energyperformance.domain.enums.EnergySourceType;
import com.company.energyperformance.domain.enums.ReadingChannel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnergySource implements Serializable {
    private static final long serialVersionUID = 1L;

    private String energySourceId;
    private String name;
    private EnergySourceType type;
    private String unit;
    private Double unitCost;
    private Double emissionFactor;
    private ReadingChannel consumptionChannel;
    private ReadingChannel demandChannel;

    @JsonIgnore
    public ReadingChannel resolvedConsumptionChannel() {
        return consumptionChannel != null ? consumptionChannel : type.getDefaultConsumptionChannel();
    }

    @JsonIgnore
    public ReadingChannel resolvedDemandChannel() {
        return demandChannel != null ? demandChannel : type.getDefaultDemandChannel();
    }

    @JsonIgnore
    public String resolvedUnit() {
        return unit != null ? unit : resolvedConsumptionChannel().getUnit();
    }
}
