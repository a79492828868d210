package com.company.energyperformance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "energy.kpi")
public class KpiProperties {

    /** Currency per consumption unit when neither a tariff nor the source cost applies */
    private double defaultRate = 0.15;

    /** kg CO2 per consumption unit when no scoped factor applies */
    private double defaultEmissionFactor = 0.45;

    private String zone = "UTC";
}
