package com.ruleflow.workflow;

import java.util.Map;
import java.util.UUID;

/**
 * Input for starting a workflow request. {@code workflowConfigId} may be null,
 * in which case the configuration is selected from the tenant's active ones.
 */
public record WorkflowStart(
        String tenantId,
        String entityType,
        String entityId,
        String requestType,
        String requestedBy,
        UUID workflowConfigId,
        Map<String, Object> context) {
}
