package com.ruleflow.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruleflow.action.Action;
import com.ruleflow.action.ActionFactory;
import com.ruleflow.exception.CompileException;
import com.ruleflow.expression.Expression;
import com.ruleflow.expression.ExpressionCompiler;
import com.ruleflow.model.BusinessRule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns a stored {@link BusinessRule} into a {@link CompiledRule}.
 *
 * The action comes from {@code actionExpression} when present, otherwise from
 * {@code actionType + actionConfig}. A rule with neither is rejected.
 */
@Component
@RequiredArgsConstructor
public class RuleCompiler {

    private final ExpressionCompiler expressionCompiler;
    private final ActionFactory actionFactory;
    private final ObjectMapper objectMapper;

    /**
     * @throws CompileException if the condition, the action or its parameters are invalid
     */
    public CompiledRule compile(BusinessRule rule) {
        String ruleId = rule.getRuleId();
        Expression condition = expressionCompiler.compileCondition(ruleId, rule.getConditionExpression());
        Action action = compileAction(rule);

        return new CompiledRule(
                rule.getId(),
                ruleId,
                rule.getName(),
                rule.getPriority(),
                rule.getRuleType(),
                rule.getApplicableEntities(),
                rule.getApplicableScreens(),
                rule.isActive(),
                rule.isAutomatic(),
                rule.getVersion(),
                condition,
                action);
    }

    private Action compileAction(BusinessRule rule) {
        String ruleId = rule.getRuleId();
        if (rule.getActionExpression() != null && !rule.getActionExpression().isBlank()) {
            return actionFactory.fromCall(ruleId, expressionCompiler.compileAction(ruleId, rule.getActionExpression()));
        }
        if (rule.getActionType() != null && !rule.getActionType().isBlank()) {
            return actionFactory.fromStructured(ruleId, rule.getActionType(), parseConfig(ruleId, rule.getActionConfig()));
        }
        throw new CompileException(ruleId, -1, "Rule has neither an action expression nor an action type");
    }

    private Map<String, Object> parseConfig(String ruleId, String actionConfig) {
        if (actionConfig == null || actionConfig.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(actionConfig, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new CompileException(ruleId, -1, "Action config is not a JSON object: " + e.getOriginalMessage());
        }
    }
}
