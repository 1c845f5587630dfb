package com.ruleflow.engine.action;

import com.ruleflow.action.Action;

/**
 * Executes one action variant.
 *
 * @param <A> the action variant this handler executes
 */
public interface ActionHandler<A extends Action> {

    Class<A> actionClass();

    /**
     * Run the action.
     *
     * @return a short human-readable description of what was done
     */
    String handle(A action, ActionContext context);

    /**
     * Run an action looked up by its runtime class.
     *
     * @throws ClassCastException if {@code action} is not this handler's variant
     */
    default String handleAction(Action action, ActionContext context) {
        return handle(actionClass().cast(action), context);
    }
}
