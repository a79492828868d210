package com.company.energyperformance.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterGroupRequest {
    @NotBlank(message = "Group ID is required")
    private String groupId;

    @NotBlank(message = "Group name is required")
    private String name;

    @NotBlank(message = "Energy source ID is required")
    private String energySourceId;

    @NotEmpty(message = "At least one entity is required")
    private List<String> entityIds;

    @NotBlank(message = "Region is required")
    private String region;

    private Boolean active;
}
