package com.ruleflow.engine;

import com.ruleflow.expression.ExpressionEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Evaluates the conditions of ordered candidate rules against a context.
 *
 * FLOW:
 *   for each rule in the given order
 *     evaluate its condition
 *       true  → matched
 *       false → skipped
 *       error → recorded on that rule's result, rule is non-matching,
 *               the remaining rules are still evaluated
 *
 * Every rule is evaluated (no first-match-wins). The engine holds no state and
 * never changes the context, so identical inputs give identical results.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RuleEvaluationEngine {

    private final ExpressionEvaluator evaluator;

    public RuleEvaluation evaluate(List<CompiledRule> orderedRules, Map<String, Object> context) {
        List<RuleResult> results = new ArrayList<>(orderedRules.size());
        List<CompiledRule> matched = new ArrayList<>();

        for (CompiledRule rule : orderedRules) {
            try {
                boolean result = evaluator.evaluateCondition(rule.condition(), context);
                results.add(RuleResult.matched(rule, result));
                if (result) {
                    matched.add(rule);
                    log.debug("Rule matched: ruleId={}, priority={}", rule.ruleId(), rule.priority());
                } else {
                    log.debug("Rule skipped: ruleId={}, priority={}", rule.ruleId(), rule.priority());
                }
            } catch (RuntimeException e) {
                log.warn("Rule evaluation failed, treating as non-matching: ruleId={}: {}",
                        rule.ruleId(), e.getMessage());
                results.add(RuleResult.failed(rule, e.getMessage()));
            }
        }
        return new RuleEvaluation(List.copyOf(results), List.copyOf(matched));
    }
}
