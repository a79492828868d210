package com.company.energyperformance.service.deviation;

import com.company.energyperformance.domain.PerformanceRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceReport {
    private String groupId;
    private int year;
    private String period;
    private PerformanceRecord summary;
    @Builder.Default
    private List<PerformanceRecord> monthlyBreakdown = new ArrayList<>();
    private String baselineFormula;
}
