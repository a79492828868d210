package com.company.energyperformance.dto.request;

import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Training request. Omitted options use the configured defaults; omitted features use the
 * default set of the group's energy source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainBaselineRequest {
    @NotBlank(message = "Group ID is required")
    private String groupId;

    @NotNull(message = "Training window start is required")
    private Instant windowStart;

    @NotNull(message = "Training window end is required")
    private Instant windowEnd;

    private List<String> features;

    private String tier;

    @Min(value = 1, message = "minSamples must be at least 1")
    private Integer minSamples;

    @DecimalMin(value = "0.0", message = "minRSquared must be within [0, 1]")
    @DecimalMax(value = "1.0", message = "minRSquared must be within [0, 1]")
    private Double minRSquared;

    private Boolean includeIntercept;
}
