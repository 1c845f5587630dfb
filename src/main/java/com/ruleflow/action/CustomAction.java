package com.ruleflow.action;

import com.ruleflow.expression.Expression;

import java.util.Map;

/**
 * Any action outside the built-in capabilities. A {@code url} parameter turns it
 * into a webhook call.
 */
public record CustomAction(String name, Map<String, Expression> parameters) implements Action {

    @Override
    public ActionType type() {
        return ActionType.CUSTOM;
    }
}
