package com.ruleflow.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

/**
 * Body of approve and advance. {@code step} must be the request's current step.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StepDecisionRequest {

    @NotNull(message = "step is required")
    @Min(value = 1, message = "step starts at 1")
    private Integer step;

    private String notes;

    // optimistic check against the version last read by the caller
    private Long expectedVersion;
}
