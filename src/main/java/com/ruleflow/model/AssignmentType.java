package com.ruleflow.model;

/**
 * ROLE        → the role's queue (all holders)
 * USER        → one specific user
 * GROUP       → the approver group's queue (all members)
 * ROUND_ROBIN → the next member of an approver group, by persisted rotation cursor
 */
public enum AssignmentType {
    ROLE,
    USER,
    GROUP,
    ROUND_ROBIN
}
