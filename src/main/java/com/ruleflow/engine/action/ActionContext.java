package com.ruleflow.engine.action;

import com.ruleflow.expression.Expression;
import com.ruleflow.expression.ExpressionEvaluator;

import java.util.Map;

/**
 * Everything a handler needs to run one rule's action: who the action is for,
 * which rule produced it, and the context its parameters resolve against.
 */
public record ActionContext(
        String tenantId,
        String entityType,
        String entityId,
        String requestedBy,
        String ruleId,
        String ruleName,
        Map<String, Object> context,
        ExpressionEvaluator evaluator) {

    public Object resolve(Expression parameter) {
        return evaluator.resolveParameter(parameter, context);
    }

    public String resolveString(Expression parameter) {
        Object value = resolve(parameter);
        return value == null ? null : value.toString();
    }
}
