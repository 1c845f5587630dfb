package com.ruleflow.engine.action;

import com.ruleflow.action.ActionType;

import java.util.Map;

/**
 * One executed or suggested action.
 *
 * Example (executed):
 *   {"ruleId": "high-risk-approval", "actionType": "CUSTOM",
 *    "action": "require_additional_approval", "status": "SUCCESS"}
 */
public record ActionOutcome(
        String ruleId,
        String ruleName,
        ActionType actionType,
        String action,
        Map<String, Object> parameters,
        Status status,
        String message,
        String error) {

    public enum Status {
        SUCCESS,
        FAILED,
        SUGGESTED
    }
}
