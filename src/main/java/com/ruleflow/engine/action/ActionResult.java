package com.ruleflow.engine.action;

import java.util.List;
import java.util.Map;

/**
 * Actions of the matched rules, split by whether they ran.
 * {@code fieldUpdates} holds the value each field ended up with after all
 * successful field mutations, later rules overwriting earlier ones.
 */
public record ActionResult(List<ActionOutcome> executed, List<ActionOutcome> suggested, Map<String, Object> fieldUpdates) {

    public static ActionResult empty() {
        return new ActionResult(List.of(), List.of(), Map.of());
    }
}
