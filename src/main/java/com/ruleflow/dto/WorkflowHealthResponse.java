package com.ruleflow.dto;

import lombok.*;

import java.util.List;
import java.util.UUID;

/**
 * GET /api/workflow-configs/health-check
 * {
 *   "hasDefault": true, "hasActive": true,
 *   "workflowCount": 3, "activeCount": 2,
 *   "defaultWorkflowId": "…", "defaultWorkflowName": "Standard Onboarding",
 *   "defaultStepCount": 4, "stepSequenceConsistent": true,
 *   "issues": []
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowHealthResponse {
    private boolean hasDefault;
    private boolean hasActive;
    private int workflowCount;
    private int activeCount;
    private UUID defaultWorkflowId;
    private String defaultWorkflowName;
    private int defaultStepCount;
    private boolean stepSequenceConsistent;
    private List<String> issues;
}
