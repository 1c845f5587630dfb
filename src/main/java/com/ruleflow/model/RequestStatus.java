package com.ruleflow.model;

/**
 * Lifecycle of a workflow request.
 *
 *   PENDING → IN_REVIEW → APPROVED | REJECTED
 *   any non-terminal    → CANCELLED
 */
public enum RequestStatus {
    PENDING,
    IN_REVIEW,
    APPROVED,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED || this == CANCELLED;
    }
}
