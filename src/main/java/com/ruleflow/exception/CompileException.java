package com.ruleflow.exception;

import lombok.Getter;

/**
 * Thrown when a condition or action expression cannot be compiled.
 * Rules and workflow steps that fail compilation are never persisted.
 */
@Getter
public class CompileException extends RuleflowException {

    private final String ruleId;
    private final int position;

    public CompileException(String ruleId, int position, String message) {
        super(format(ruleId, position, message));
        this.ruleId = ruleId;
        this.position = position;
    }

    private static String format(String ruleId, int position, String message) {
        StringBuilder sb = new StringBuilder();
        if (ruleId != null) {
            sb.append("Rule '").append(ruleId).append("': ");
        }
        if (position >= 0) {
            sb.append("at position ").append(position).append(": ");
        }
        return sb.append(message).toString();
    }
}
