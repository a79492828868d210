package com.company.energyperformance.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A process or equipment change after which the cumulative trend starts over
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselineAdjustmentRequest {
    @NotNull(message = "Effective time is required")
    private Instant effectiveAt;

    @NotBlank(message = "Reason is required")
    @Size(max = 500)
    private String reason;
}
