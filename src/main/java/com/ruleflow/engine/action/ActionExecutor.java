package com.ruleflow.engine.action;

import com.ruleflow.action.Action;
import com.ruleflow.action.FieldMutation;
import com.ruleflow.engine.CompiledRule;
import com.ruleflow.expression.Expression;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes or suggests the actions of matched rules.
 *
 * FLOW (per matched rule, in evaluation order):
 *   autoExecute requested AND rule is automatic
 *     → resolve parameters, dispatch to the handler for the action's variant
 *       → SUCCESS or FAILED outcome appended to "executed"
 *   otherwise
 *     → SUGGESTED outcome appended to "suggested"
 *
 * A parameter that fails to evaluate, or a handler that throws, is recorded on
 * that rule's outcome (FAILED when executing, the error on the SUGGESTED entry
 * otherwise) and the batch continues. A {@link DataAccessException} means
 * storage is gone and is rethrown.
 */
@Component
@Slf4j
public class ActionExecutor {

    private final Map<Class<?>, ActionHandler<?>> handlers = new HashMap<>();

    public ActionExecutor(List<ActionHandler<?>> handlers) {
        for (ActionHandler<?> handler : handlers) {
            this.handlers.put(handler.actionClass(), handler);
        }
    }

    public ActionResult execute(List<CompiledRule> matchedRules, ActionRequest request) {
        List<ActionOutcome> executed = new ArrayList<>();
        List<ActionOutcome> suggested = new ArrayList<>();
        Map<String, Object> fieldUpdates = new LinkedHashMap<>();

        for (CompiledRule rule : matchedRules) {
            ActionContext context = request.contextFor(rule);
            Action action = rule.action();
            boolean execute = request.autoExecute() && rule.automatic();
            Map<String, Object> parameters = new LinkedHashMap<>();

            try {
                resolveParameters(action, context, parameters);
                if (!execute) {
                    suggested.add(outcome(rule, parameters, ActionOutcome.Status.SUGGESTED, null, null));
                    continue;
                }

                String message = dispatch(action, context);
                executed.add(outcome(rule, parameters, ActionOutcome.Status.SUCCESS, message, null));
                if (action instanceof FieldMutation mutation) {
                    fieldUpdates.put(mutation.field(), parameters.get("value"));
                }
                log.info("Action executed: ruleId={}, action={}, entity={}/{}",
                        rule.ruleId(), action.name(), request.entityType(), request.entityId());
            } catch (DataAccessException e) {
                throw e;
            } catch (RuntimeException e) {
                if (execute) {
                    log.warn("Action failed: ruleId={}, action={}: {}", rule.ruleId(), action.name(), e.getMessage());
                    executed.add(outcome(rule, parameters, ActionOutcome.Status.FAILED, null, e.getMessage()));
                } else {
                    log.warn("Suggested action has unresolvable parameters: ruleId={}, action={}: {}",
                            rule.ruleId(), action.name(), e.getMessage());
                    suggested.add(outcome(rule, parameters, ActionOutcome.Status.SUGGESTED, null, e.getMessage()));
                }
            }
        }

        return new ActionResult(List.copyOf(executed), List.copyOf(suggested), Collections.unmodifiableMap(fieldUpdates));
    }

    private String dispatch(Action action, ActionContext context) {
        ActionHandler<?> handler = handlers.get(action.getClass());
        if (handler == null) {
            throw new IllegalStateException("No handler registered for " + action.getClass().getSimpleName());
        }
        return handler.handleAction(action, context);
    }

    private void resolveParameters(Action action, ActionContext context, Map<String, Object> resolved) {
        for (Map.Entry<String, Expression> entry : action.parameters().entrySet()) {
            resolved.put(entry.getKey(), context.resolve(entry.getValue()));
        }
    }

    private ActionOutcome outcome(CompiledRule rule, Map<String, Object> parameters,
                                  ActionOutcome.Status status, String message, String error) {
        Action action = rule.action();
        return new ActionOutcome(rule.ruleId(), rule.name(), action.type(), action.name(),
                Collections.unmodifiableMap(parameters), status, message, error);
    }
}
