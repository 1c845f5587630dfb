package com.ruleflow.action;

import com.ruleflow.expression.Expression;

import java.util.Map;

/**
 * A compiled rule action. Both action expressions and structured
 * {@code actionType + actionConfig} definitions compile to one of these variants.
 */
public sealed interface Action permits FieldMutation, TriggerWorkflow, SendNotification, CustomAction {

    /** Action name as written by the rule author, e.g. {@code require_additional_approval}. */
    String name();

    ActionType type();

    /** Unresolved parameters keyed by schema name, in declaration order. */
    Map<String, Expression> parameters();
}
