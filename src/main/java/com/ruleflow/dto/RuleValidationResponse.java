package com.ruleflow.dto;

import lombok.*;

/**
 * Result of POST /api/rules/validate. {@code position} is the character offset
 * of a syntax error in the failing expression, -1 when not applicable.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RuleValidationResponse {
    private boolean valid;
    private String ruleId;
    private String actionType;
    private String actionName;
    private String error;
    private int position;
}
