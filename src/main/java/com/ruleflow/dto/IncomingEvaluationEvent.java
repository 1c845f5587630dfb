package com.ruleflow.dto;

import lombok.*;

import java.util.Map;

/**
 * Evaluation request received on the {@code ruleflow.evaluations} topic.
 *
 * Example JSON:
 * {
 *   "eventId": "evt-abc-123",
 *   "tenantId": "acme",
 *   "requestedBy": "intake-service",
 *   "entityType": "agent",
 *   "entityId": "agent-7",
 *   "context": {"risk_level": "high"},
 *   "autoExecute": true
 * }
 *
 * - eventId: unique identifier for dedup (the same event is evaluated once)
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IncomingEvaluationEvent {

    private String eventId;
    private String tenantId;
    private String requestedBy;
    private String entityType;
    private String entityId;
    private String screen;
    private String ruleType;
    private Map<String, Object> context;
    private boolean autoExecute;

    public EvaluationRequest toRequest() {
        return EvaluationRequest.builder()
                .entityType(entityType)
                .entityId(entityId)
                .screen(screen)
                .ruleType(ruleType)
                .context(context)
                .autoExecute(autoExecute)
                .build();
    }
}
