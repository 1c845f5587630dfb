package com.ruleflow.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.Map;
import java.util.Set;

/**
 * Create/update payload for a business rule. Give either an actionExpression or
 * an actionType with its actionConfig.
 *
 * Example:
 * {
 *   "ruleId": "high-risk-approval",
 *   "name": "High risk needs extra approval",
 *   "ruleType": "approval",
 *   "conditionExpression": "risk_level == 'high' and vendor.tier in [1, 2]",
 *   "actionExpression": "require_additional_approval",
 *   "applicableEntities": ["agent"],
 *   "priority": 1,
 *   "automatic": true
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class BusinessRuleRequest {

    @NotBlank(message = "ruleId is required")
    private String ruleId;

    @NotBlank(message = "name is required")
    private String name;

    private String description;

    // null or blank = always matches
    private String conditionExpression;

    private String actionExpression;
    private String actionType;
    private Map<String, Object> actionConfig;

    @NotBlank(message = "ruleType is required")
    private String ruleType;

    private Set<String> applicableEntities;
    private Set<String> applicableScreens;

    private int priority;
    private Boolean active;
    private boolean automatic;
}
