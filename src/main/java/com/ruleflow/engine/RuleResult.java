package com.ruleflow.engine;

/**
 * Outcome of evaluating one rule's condition. A rule whose condition failed to
 * evaluate is non-matching and carries the error.
 */
public record RuleResult(String ruleId, String ruleName, int priority, boolean matched, String error) {

    public static RuleResult matched(CompiledRule rule, boolean matched) {
        return new RuleResult(rule.ruleId(), rule.name(), rule.priority(), matched, null);
    }

    public static RuleResult failed(CompiledRule rule, String error) {
        return new RuleResult(rule.ruleId(), rule.name(), rule.priority(), false, error);
    }
}
