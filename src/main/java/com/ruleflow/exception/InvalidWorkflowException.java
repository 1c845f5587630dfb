package com.ruleflow.exception;

/**
 * A workflow configuration or approver group definition violates a structural invariant.
 */
public class InvalidWorkflowException extends RuleflowException {

    public InvalidWorkflowException(String message) {
        super(message);
    }
}
