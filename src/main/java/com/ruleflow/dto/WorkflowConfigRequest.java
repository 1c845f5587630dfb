package com.ruleflow.dto;

import com.ruleflow.model.AssignmentRule;
import com.ruleflow.model.WorkflowConditions;
import com.ruleflow.model.WorkflowConfigStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.List;

/**
 * Example:
 * {
 *   "name": "High Risk Agent Onboarding",
 *   "status": "ACTIVE",
 *   "isDefault": false,
 *   "conditions": {"riskLevels": ["high", "critical"], "priority": 1},
 *   "assignmentRules": {"type": "ROLE", "role": "security_reviewer", "timeoutHours": 48},
 *   "steps": [
 *     {"stepName": "Security Review"},
 *     {"stepName": "Compliance Review", "required": false, "conditions": "risk_score >= 80"},
 *     {"stepName": "Notify Owner", "stepType": "NOTIFICATION"}
 *   ]
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowConfigRequest {

    @NotBlank(message = "name is required")
    private String name;

    private String description;

    @Valid
    private List<WorkflowStepRequest> steps;

    private AssignmentRule assignmentRules;
    private WorkflowConditions conditions;
    private WorkflowConditions triggerRules;
    private WorkflowConfigStatus status;
    private Boolean isDefault;
}
