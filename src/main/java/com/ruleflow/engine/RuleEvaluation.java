package com.ruleflow.engine;

import java.util.List;

/**
 * Result of a condition pass: one {@link RuleResult} per candidate in evaluation
 * order, plus the matched rules in the same order.
 */
public record RuleEvaluation(List<RuleResult> results, List<CompiledRule> matched) {

    public int matchedCount() {
        return matched.size();
    }
}
