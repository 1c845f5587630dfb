package com.ruleflow.workflow;

import com.ruleflow.expression.Expression;
import com.ruleflow.expression.ExpressionCompiler;
import com.ruleflow.expression.ExpressionEvaluator;
import com.ruleflow.model.WorkflowStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Decides whether a workflow step is entered, using the same expression language
 * as business rules.
 *
 *   required step                 → always entered
 *   no conditions                 → entered
 *   conditions true               → entered
 *   conditions false or erroring  → skipped
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StepConditionEvaluator {

    private final ExpressionCompiler compiler;
    private final ExpressionEvaluator evaluator;

    public boolean applies(WorkflowStep step, Map<String, Object> context) {
        if (step.isRequired() || step.getConditions() == null || step.getConditions().isBlank()) {
            return true;
        }
        try {
            return evaluator.evaluateCondition(compile(step), context);
        } catch (RuntimeException e) {
            log.warn("Step {} '{}' condition failed, skipping step: {}",
                    step.getStepNumber(), step.getStepName(), e.getMessage());
            return false;
        }
    }

    /**
     * @throws com.ruleflow.exception.CompileException if the step's conditions do not parse
     */
    public Expression compile(WorkflowStep step) {
        return compiler.compileCondition(stepRef(step), step.getConditions());
    }

    private static String stepRef(WorkflowStep step) {
        return "step " + step.getStepNumber();
    }
}
