package com.ruleflow.action;

import com.ruleflow.expression.Expression;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sets {@code field} on the evaluated entity to {@code value}.
 */
public record FieldMutation(String name, String field, Expression value) implements Action {

    @Override
    public ActionType type() {
        return ActionType.FIELD_MUTATION;
    }

    @Override
    public Map<String, Expression> parameters() {
        Map<String, Expression> params = new LinkedHashMap<>();
        params.put("field", new Expression.Literal(field));
        params.put("value", value);
        return params;
    }
}
