package com.ruleflow.exception;

/**
 * A single rule could not be evaluated against a context (type mismatch,
 * non-boolean condition result). Recorded on that rule's result only.
 */
public class EvaluationException extends RuleflowException {

    public EvaluationException(String message) {
        super(message);
    }
}
