package com.company.energyperformance.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluatePeriodRequest {
    @NotNull(message = "Period start is required")
    private Instant periodStart;

    @NotNull(message = "Period end is required")
    private Instant periodEnd;
}
