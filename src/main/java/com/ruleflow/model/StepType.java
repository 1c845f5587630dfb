package com.ruleflow.model;

/**
 * APPROVAL      → waits for an approve/reject decision
 * NOTIFICATION  → announces itself on entry and passes through
 */
public enum StepType {
    APPROVAL,
    NOTIFICATION
}
