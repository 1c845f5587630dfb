package com.ruleflow.model;

/**
 * Only ACTIVE configurations are bound to new requests.
 */
public enum WorkflowConfigStatus {
    ACTIVE,
    INACTIVE,
    DRAFT
}
