package com.ruleflow.engine.action;

import com.ruleflow.engine.CompiledRule;
import com.ruleflow.expression.ExpressionEvaluator;

import java.util.Map;

/**
 * The evaluation call an action batch belongs to.
 */
public record ActionRequest(
        String tenantId,
        String entityType,
        String entityId,
        String requestedBy,
        Map<String, Object> context,
        boolean autoExecute,
        ExpressionEvaluator evaluator) {

    ActionContext contextFor(CompiledRule rule) {
        return new ActionContext(tenantId, entityType, entityId, requestedBy,
                rule.ruleId(), rule.name(), context, evaluator);
    }
}
