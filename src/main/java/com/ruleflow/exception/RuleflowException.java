package com.ruleflow.exception;

/**
 * Base exception for the rule and workflow engine.
 */
public class RuleflowException extends RuntimeException {

    public RuleflowException(String message) {
        super(message);
    }

    public RuleflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
