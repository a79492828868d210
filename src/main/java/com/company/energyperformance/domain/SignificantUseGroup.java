package com.company.energyperformance.domain;

import lombok.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Monitoring boundary: one energy source across one or more entities.
 * Unit of baseline training and compliance reporting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignificantUseGroup implements Serializable {
    private static final long serialVersionUID = 1L;

    private String groupId;
    private String name;
    private String energySourceId;
    @Builder.Default
    private List<String> entityIds = new ArrayList<>();
    private String region;
    private Boolean active;
    private Instant createdAt;
}
