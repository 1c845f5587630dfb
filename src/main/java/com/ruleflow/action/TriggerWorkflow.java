package com.ruleflow.action;

import com.ruleflow.expression.Expression;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Starts an approval workflow for the evaluated entity. Without an explicit
 * {@code workflowConfigId} the workflow is selected from the tenant's active configurations.
 */
public record TriggerWorkflow(String name, Expression workflowConfigId, Expression requestType) implements Action {

    @Override
    public ActionType type() {
        return ActionType.TRIGGER_WORKFLOW;
    }

    @Override
    public Map<String, Expression> parameters() {
        Map<String, Expression> params = new LinkedHashMap<>();
        if (workflowConfigId != null) {
            params.put("workflow_config_id", workflowConfigId);
        }
        params.put("request_type", requestType);
        return params;
    }
}
