package com.ruleflow.engine;

import com.ruleflow.action.CustomAction;
import com.ruleflow.expression.ExpressionCompiler;
import com.ruleflow.expression.ExpressionEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RuleEvaluationEngineTest {

    private final ExpressionCompiler compiler = new ExpressionCompiler();
    private final RuleEvaluationEngine engine = new RuleEvaluationEngine(new ExpressionEvaluator());

    private CompiledRule rule(String ruleId, int priority, String condition) {
        return new CompiledRule(UUID.randomUUID(), ruleId, ruleId, priority, "validation", Set.of(), Set.of(),
                true, true, 0L, compiler.compileCondition(ruleId, condition), new CustomAction("noop", Map.of()));
    }

    @Test
    @DisplayName("Every rule is evaluated, not just the first match")
    void allRulesEvaluated() {
        List<CompiledRule> rules = List.of(
                rule("a", 1, "amount > 100"),
                rule("b", 2, "amount > 1000"),
                rule("c", 3, "country == 'US'"));

        RuleEvaluation evaluation = engine.evaluate(rules, Map.of("amount", 500, "country", "US"));

        assertEquals(3, evaluation.results().size());
        assertEquals(List.of("a", "c"), evaluation.matched().stream().map(CompiledRule::ruleId).toList());
        assertEquals(2, evaluation.matchedCount());
    }

    @Test
    @DisplayName("A failing condition is recorded and treated as non-matching; later rules still run")
    void failOpen() {
        List<CompiledRule> rules = List.of(
                rule("broken", 1, "name > 5"),
                rule("ok", 2, "name == 'acme'"));

        RuleEvaluation evaluation = engine.evaluate(rules, Map.of("name", "acme"));

        RuleResult broken = evaluation.results().get(0);
        assertFalse(broken.matched());
        assertNotNull(broken.error());
        assertTrue(evaluation.results().get(1).matched());
        assertEquals(1, evaluation.matchedCount());
    }

    @Test
    @DisplayName("Same rules and context give the same result, and the context is untouched")
    void idempotent() {
        List<CompiledRule> rules = List.of(rule("a", 1, "risk_level == 'high'"), rule("b", 2, "score >= 80"));
        Map<String, Object> context = new HashMap<>(Map.of("risk_level", "high", "score", 42));
        Map<String, Object> snapshot = new HashMap<>(context);

        RuleEvaluation first = engine.evaluate(rules, context);
        RuleEvaluation second = engine.evaluate(rules, context);

        assertEquals(first.results(), second.results());
        assertEquals(snapshot, context);
    }
}
