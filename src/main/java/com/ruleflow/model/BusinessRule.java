package com.ruleflow.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A named, prioritized condition → action pair evaluated against a context.
 *
 * Example:
 *   ruleId              = "high-risk-approval"
 *   priority            = 1
 *   conditionExpression = "risk_level == 'high'"
 *   actionExpression    = "require_additional_approval"
 *   automatic           = true
 *
 * The action is given either as an expression or as a structured
 * actionType + actionConfig (JSON) pair. Rules are compiled when created or
 * updated and never mutated by the engine.
 */
@Entity
@Table(name = "business_rules", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"tenant_id", "rule_id"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class BusinessRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "rule_id", nullable = false)
    private String ruleId;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "condition_expression", columnDefinition = "TEXT")
    private String conditionExpression;

    @Column(name = "action_expression", columnDefinition = "TEXT")
    private String actionExpression;

    @Column(name = "action_type")
    private String actionType;

    @Column(name = "action_config", columnDefinition = "TEXT")
    private String actionConfig;

    @Column(name = "rule_type", nullable = false)
    private String ruleType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "business_rule_entities", joinColumns = @JoinColumn(name = "rule_id"))
    @Column(name = "entity_type")
    @Builder.Default
    private Set<String> applicableEntities = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "business_rule_screens", joinColumns = @JoinColumn(name = "rule_id"))
    @Column(name = "screen")
    @Builder.Default
    private Set<String> applicableScreens = new HashSet<>();

    @Column(nullable = false)
    private int priority;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(nullable = false)
    @Builder.Default
    private boolean automatic = false;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
