package com.ruleflow.exception;

/**
 * An external collaborator (notification channel, entity service, webhook) failed.
 */
public class DispatchException extends RuleflowException {

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public DispatchException(String message) {
        super(message);
    }
}
