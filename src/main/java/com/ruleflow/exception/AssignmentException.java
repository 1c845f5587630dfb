package com.ruleflow.exception;

/**
 * No concrete actor could be resolved for a workflow step.
 */
public class AssignmentException extends RuleflowException {

    public AssignmentException(String message) {
        super(message);
    }
}
