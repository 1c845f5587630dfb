package com.ruleflow.dto;

import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class BusinessRuleResponse {
    private UUID id;
    private String ruleId;
    private String name;
    private String description;
    private String conditionExpression;
    private String actionExpression;
    private String actionType;
    private Map<String, Object> actionConfig;
    private String ruleType;
    private Set<String> applicableEntities;
    private Set<String> applicableScreens;
    private int priority;
    private boolean active;
    private boolean automatic;
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;
}
