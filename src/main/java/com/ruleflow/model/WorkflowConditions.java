package com.ruleflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

/**
 * Applicability filter of a workflow configuration, used for both
 * {@code conditions} and {@code triggerRules}.
 *
 * Example:
 *   {"agentTypes": ["ai"], "riskLevels": ["high", "critical"], "matchAll": false, "priority": 1}
 *
 * Null lists are not checked. With matchAll=false any checked criterion may match.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowConditions {

    private List<String> entityTypes;
    private List<String> agentTypes;
    private List<String> riskLevels;
    private List<String> categories;
    private boolean matchAll;
    private Integer priority;
}
