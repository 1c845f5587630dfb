package com.ruleflow.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.Map;
import java.util.UUID;

/**
 * POST /api/workflow-requests
 * {
 *   "entityType": "agent",
 *   "entityId": "agent-7",
 *   "requestType": "onboarding",
 *   "workflowConfigId": null,
 *   "context": {"type": "ai", "risk_score": 72}
 * }
 *
 * Without workflowConfigId the workflow is selected from the entity data in context.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CreateWorkflowRequest {

    @NotBlank(message = "entityType is required")
    private String entityType;

    private String entityId;
    private String requestType;
    private UUID workflowConfigId;
    private Map<String, Object> context;
}
