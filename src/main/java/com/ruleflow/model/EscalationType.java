package com.ruleflow.model;

/**
 * What happens when a step's timeout passes without a decision.
 * ROLE / USER / GROUP / ROUND_ROBIN reassign the step; ADVANCE moves the request past it.
 */
public enum EscalationType {
    ROLE,
    USER,
    GROUP,
    ROUND_ROBIN,
    ADVANCE
}
