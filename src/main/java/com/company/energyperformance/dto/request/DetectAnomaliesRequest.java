package com.company.energyperformance.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
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
public class DetectAnomaliesRequest {
    @NotNull(message = "Window start is required")
    private Instant windowStart;

    @NotNull(message = "Window end is required")
    private Instant windowEnd;

    @DecimalMin(value = "0.0", inclusive = false, message = "Contamination must be within (0, 0.5]")
    @DecimalMax(value = "0.5", message = "Contamination must be within (0, 0.5]")
    private Double contamination;
}
