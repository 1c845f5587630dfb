package com.ruleflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * Who acts on a workflow step, and what happens when they don't.
 * Stored as JSON on the step (and on the configuration as the default).
 *
 * Example:
 *   {"type": "ROUND_ROBIN", "groupId": "…", "timeoutHours": 48,
 *    "escalateTo": {"type": "ROLE", "role": "tenant_admin"}}
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssignmentRule {

    private AssignmentType type;
    private String role;
    private String userId;
    private String groupId;
    private Integer timeoutHours;
    private EscalationTarget escalateTo;

    /**
     * Fill timeout and escalation from the configuration-level default when the
     * step does not declare its own.
     */
    public AssignmentRule withDefaults(AssignmentRule defaults) {
        if (defaults == null) {
            return this;
        }
        return toBuilder()
                .timeoutHours(timeoutHours != null ? timeoutHours : defaults.getTimeoutHours())
                .escalateTo(escalateTo != null ? escalateTo : defaults.getEscalateTo())
                .build();
    }

    public boolean referencesGroup(String id) {
        return id.equals(groupId)
                || (escalateTo != null && id.equals(escalateTo.getGroupId()));
    }
}
