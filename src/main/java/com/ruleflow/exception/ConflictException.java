package com.ruleflow.exception;

/**
 * The requested workflow transition does not apply to the current state of the
 * request: wrong step, terminal request, or a concurrent modification won the race.
 * Callers must re-read the request before retrying.
 */
public class ConflictException extends RuleflowException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
