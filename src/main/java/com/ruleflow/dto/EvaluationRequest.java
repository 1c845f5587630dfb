package com.ruleflow.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.Map;

/**
 * POST /api/rules/evaluate
 * {
 *   "entityType": "agent",
 *   "entityId": "agent-7",
 *   "screen": "onboarding",
 *   "ruleType": "approval",
 *   "context": {"risk_level": "high", "vendor": {"tier": 1}},
 *   "autoExecute": true
 * }
 *
 * - screen, ruleType: optional filters; omitted means no filtering on them
 * - autoExecute:      run the actions of matched automatic rules instead of
 *                     only suggesting them
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EvaluationRequest {

    @NotBlank(message = "entityType is required")
    private String entityType;

    private String entityId;
    private String screen;
    private String ruleType;
    private Map<String, Object> context;
    private boolean autoExecute;
}
