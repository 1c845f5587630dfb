package com.ruleflow.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ApproverGroupRequest {

    @NotBlank(message = "name is required")
    private String name;

    private String description;

    // rotation order for round-robin assignment
    private List<String> memberIds;
}
