package com.ruleflow.workflow;

import java.util.List;

/**
 * Who acts on a step: a single user, or a queue whose candidates may pick it up.
 */
public record Assignment(String assignedTo, String queue, List<String> candidates) {

    public Assignment {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static Assignment user(String userId) {
        return new Assignment(userId, null, List.of(userId));
    }

    public static Assignment queue(String queue, List<String> candidates) {
        return new Assignment(null, queue, candidates);
    }

    public static Assignment none() {
        return new Assignment(null, null, List.of());
    }

    public String describe() {
        if (assignedTo != null) {
            return assignedTo;
        }
        return queue != null ? queue : "nobody";
    }
}
