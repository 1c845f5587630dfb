package com.ruleflow.action;

import com.ruleflow.exception.CompileException;
import com.ruleflow.expression.ActionCall;
import com.ruleflow.expression.Expression;
import com.ruleflow.expression.Expression.FieldRef;
import com.ruleflow.expression.Expression.Literal;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link Action} variants from either a parsed action expression or a
 * structured {@code actionType + actionConfig} pair, validating each variant's
 * parameter schema. Both inputs go through the same schema check, so a rule
 * produces the same action whichever form its author used.
 * <p>
 * In structured configs a string of the form {@code ${path}} is a field reference;
 * every other value is a literal.
 * <p>
 * The prefixed form {@code name:value} carries one value and no field, so a
 * field-mutation name other than {@code assign*} used that way
 * ({@code set_field:status}) becomes a {@link CustomAction} with a single
 * {@code value} parameter instead of a {@link FieldMutation}.
 */
@Component
public class ActionFactory {

    private static final String ASSIGNED_TO_FIELD = "assigned_to";
    private static final String DEFAULT_REQUEST_TYPE = "onboarding";

    private static final Map<String, ActionType> BUILT_IN = Map.ofEntries(
            Map.entry("set_field", ActionType.FIELD_MUTATION),
            Map.entry("set", ActionType.FIELD_MUTATION),
            Map.entry("update_field", ActionType.FIELD_MUTATION),
            Map.entry("field_mutation", ActionType.FIELD_MUTATION),
            Map.entry("assign", ActionType.FIELD_MUTATION),
            Map.entry("assign_to", ActionType.FIELD_MUTATION),
            Map.entry("trigger_workflow", ActionType.TRIGGER_WORKFLOW),
            Map.entry("start_workflow", ActionType.TRIGGER_WORKFLOW),
            Map.entry("notify", ActionType.SEND_NOTIFICATION),
            Map.entry("send_notification", ActionType.SEND_NOTIFICATION));

    public Action fromCall(String ruleId, ActionCall call) {
        if (call.prefixed() && isFieldWrite(call.name())) {
            return new CustomAction(call.name(), Map.of("value", call.positional().get(0)));
        }
        return build(ruleId, call.name(), call.positional(), call.named());
    }

    public Action fromStructured(String ruleId, String actionType, Map<String, Object> config) {
        if (actionType == null || actionType.isBlank()) {
            throw new CompileException(ruleId, -1, "Structured action requires an actionType");
        }
        Map<String, Expression> named = new LinkedHashMap<>();
        if (config != null) {
            config.forEach((key, value) -> named.put(key, toExpression(value)));
        }
        return build(ruleId, actionType.trim(), List.of(), named);
    }

    private Action build(String ruleId, String name, List<Expression> positional, Map<String, Expression> named) {
        ActionType type = resolveType(name);
        String normalized = name.toLowerCase();

        return switch (type) {
            case FIELD_MUTATION -> {
                if (normalized.startsWith("assign")) {
                    Map<String, Expression> args = bind(ruleId, name, positional, named, List.of("value"), Set.of("value", "to"));
                    Expression target = args.containsKey("to") ? args.get("to") : args.get("value");
                    yield new FieldMutation(name, ASSIGNED_TO_FIELD, required(ruleId, name, "value", target));
                }
                Map<String, Expression> args = bind(ruleId, name, positional, named, List.of("field", "value"), Set.of("field", "value"));
                String field = fieldName(ruleId, name, required(ruleId, name, "field", args.get("field")));
                if (!args.containsKey("value")) {
                    throw new CompileException(ruleId, -1, "Action '" + name + "' requires parameter 'value'");
                }
                yield new FieldMutation(name, field, args.get("value"));
            }
            case TRIGGER_WORKFLOW -> {
                Map<String, Expression> args = bind(ruleId, name, positional, named,
                        List.of("workflow_config_id", "request_type"), Set.of("workflow_config_id", "request_type"));
                Expression requestType = args.getOrDefault("request_type", new Literal(DEFAULT_REQUEST_TYPE));
                yield new TriggerWorkflow(name, args.get("workflow_config_id"), requestType);
            }
            case SEND_NOTIFICATION -> {
                Map<String, Expression> args = bind(ruleId, name, positional, named,
                        List.of("recipient", "message"), Set.of("recipient", "subject", "message"));
                yield new SendNotification(name, required(ruleId, name, "recipient", args.get("recipient")),
                        args.get("subject"), args.get("message"));
            }
            case CUSTOM -> {
                Map<String, Expression> args = new LinkedHashMap<>();
                for (int i = 0; i < positional.size(); i++) {
                    args.put("arg" + i, positional.get(i));
                }
                args.putAll(named);
                yield new CustomAction(name, Collections.unmodifiableMap(args));
            }
        };
    }

    private boolean isFieldWrite(String name) {
        return resolveType(name) == ActionType.FIELD_MUTATION && !name.toLowerCase().startsWith("assign");
    }

    private ActionType resolveType(String name) {
        ActionType builtIn = BUILT_IN.get(name.toLowerCase());
        if (builtIn != null) {
            return builtIn;
        }
        for (ActionType type : ActionType.values()) {
            if (type != ActionType.CUSTOM && type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        return ActionType.CUSTOM;
    }

    private Map<String, Expression> bind(String ruleId, String name,
                                         List<Expression> positional, Map<String, Expression> named,
                                         List<String> positionalNames, Set<String> allowed) {
        if (positional.size() > positionalNames.size()) {
            throw new CompileException(ruleId, -1, "Action '" + name + "' accepts at most "
                    + positionalNames.size() + " positional arguments, got " + positional.size());
        }
        Map<String, Expression> args = new LinkedHashMap<>();
        for (int i = 0; i < positional.size(); i++) {
            args.put(positionalNames.get(i), positional.get(i));
        }
        for (Map.Entry<String, Expression> entry : named.entrySet()) {
            if (!allowed.contains(entry.getKey())) {
                throw new CompileException(ruleId, -1, "Unknown parameter '" + entry.getKey()
                        + "' for action '" + name + "'; expected one of " + allowed);
            }
            if (args.containsKey(entry.getKey())) {
                throw new CompileException(ruleId, -1, "Parameter '" + entry.getKey()
                        + "' given twice for action '" + name + "'");
            }
            args.put(entry.getKey(), entry.getValue());
        }
        return args;
    }

    private Expression required(String ruleId, String name, String parameter, Expression value) {
        if (value == null) {
            throw new CompileException(ruleId, -1, "Action '" + name + "' requires parameter '" + parameter + "'");
        }
        return value;
    }

    private String fieldName(String ruleId, String name, Expression field) {
        if (field instanceof FieldRef ref) {
            return ref.path();
        }
        if (field instanceof Literal literal && literal.value() instanceof String s && !s.isBlank()) {
            return s;
        }
        throw new CompileException(ruleId, -1, "Action '" + name + "' requires 'field' to be a field name");
    }

    private Expression toExpression(Object value) {
        if (value instanceof String s && s.startsWith("${") && s.endsWith("}") && s.length() > 3) {
            return FieldRef.of(s.substring(2, s.length() - 1).trim());
        }
        return new Literal(value);
    }
}
