package com.ruleflow.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RejectRequest {

    @NotNull(message = "step is required")
    @Min(value = 1, message = "step starts at 1")
    private Integer step;

    @NotBlank(message = "reason is required")
    private String reason;

    private Long expectedVersion;
}
