package com.ruleflow.engine;

import com.ruleflow.dto.EvaluationRequest;
import com.ruleflow.dto.EvaluationResponse;
import com.ruleflow.engine.action.ActionExecutor;
import com.ruleflow.engine.action.ActionRequest;
import com.ruleflow.engine.action.ActionResult;
import com.ruleflow.exception.CompileException;
import com.ruleflow.expression.ExpressionEvaluator;
import com.ruleflow.model.BusinessRule;
import com.ruleflow.repository.BusinessRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for rule evaluation, used by the REST endpoint and the Kafka listener.
 *
 * FLOW:
 *   1. Load the tenant's active rules and fetch their compiled form from the cache
 *   2. RuleMatcher       → candidates for this entity type / screen / rule type,
 *                          ordered by priority then ruleId
 *   3. RuleEvaluationEngine → evaluate every candidate's condition (fail-open)
 *   4. ActionExecutor    → execute (autoExecute + automatic) or suggest the
 *                          actions of the matched rules
 *
 * Runs outside a transaction: each action that writes (e.g. starting a
 * workflow) commits on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BusinessRuleEngine {

    private final BusinessRuleRepository ruleRepository;
    private final CompiledRuleCache compiledRules;
    private final RuleMatcher matcher;
    private final RuleEvaluationEngine evaluationEngine;
    private final ActionExecutor actionExecutor;
    private final ExpressionEvaluator expressionEvaluator;

    public EvaluationResponse evaluate(String tenantId, String requestedBy, EvaluationRequest request) {
        Map<String, Object> context = request.getContext() == null
                ? Map.of()
                : new HashMap<>(request.getContext());

        List<CompiledRule> candidates = matcher.match(
                loadCompiledRules(tenantId), request.getEntityType(), request.getScreen(), request.getRuleType());
        RuleEvaluation evaluation = evaluationEngine.evaluate(candidates, context);

        ActionResult actions = evaluation.matched().isEmpty()
                ? ActionResult.empty()
                : actionExecutor.execute(evaluation.matched(), new ActionRequest(
                        tenantId, request.getEntityType(), request.getEntityId(), requestedBy,
                        context, request.isAutoExecute(), expressionEvaluator));

        log.info("Evaluated {} rule(s) for {}/{} (tenant={}): matched={}, executed={}, suggested={}",
                candidates.size(), request.getEntityType(), request.getEntityId(), tenantId,
                evaluation.matchedCount(), actions.executed().size(), actions.suggested().size());

        return EvaluationResponse.builder()
                .matchedRules(evaluation.matchedCount())
                .ruleResults(evaluation.results())
                .actionResults(actions)
                .build();
    }

    private List<CompiledRule> loadCompiledRules(String tenantId) {
        List<CompiledRule> compiled = new ArrayList<>();
        for (BusinessRule rule : ruleRepository.findByTenantIdAndActiveTrue(tenantId)) {
            try {
                compiled.add(compiledRules.get(rule));
            } catch (CompileException e) {
                // only possible for rows written outside the API
                log.warn("Skipping rule that no longer compiles: {}", e.getMessage());
            }
        }
        return compiled;
    }
}
