package com.ruleflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class EscalationTarget {

    private EscalationType type;
    private String role;
    private String userId;
    private String groupId;

    public boolean isAdvance() {
        return type == EscalationType.ADVANCE;
    }

    /**
     * The assignment an escalation reassigns to. Not defined for ADVANCE.
     */
    public AssignmentRule toAssignmentRule() {
        if (type == null || isAdvance()) {
            throw new IllegalStateException("Escalation of type " + type + " does not reassign");
        }
        return AssignmentRule.builder()
                .type(AssignmentType.valueOf(type.name()))
                .role(role)
                .userId(userId)
                .groupId(groupId)
                .build();
    }
}
