package com.ruleflow.dto;

import com.ruleflow.model.AssignmentRule;
import com.ruleflow.model.WorkflowConditions;
import com.ruleflow.model.WorkflowConfigStatus;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowConfigResponse {
    private UUID id;
    private String name;
    private String description;
    private List<WorkflowStepResponse> steps;
    private AssignmentRule assignmentRules;
    private WorkflowConditions conditions;
    private WorkflowConditions triggerRules;
    private WorkflowConfigStatus status;
    private Boolean isDefault;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;
}
