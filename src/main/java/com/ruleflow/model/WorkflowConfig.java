package com.ruleflow.model;

import com.ruleflow.model.converter.AssignmentRuleConverter;
import com.ruleflow.model.converter.WorkflowConditionsConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A tenant's approval workflow: an ordered list of steps plus the rules that
 * decide when the workflow applies and who acts by default.
 *
 * Example:
 *   name       = "High Risk Agent Onboarding"
 *   conditions = {"riskLevels": ["high", "critical"]}
 *   steps      = [ 1: Security Review, 2: Compliance Review, 3: Notify Owner ]
 *
 * Step numbers are contiguous from 1; step 1 is the first step a new request enters.
 * At most one ACTIVE configuration per tenant is the default.
 */
@Entity
@Table(name = "workflow_configs")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @OneToMany(mappedBy = "workflowConfig", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("stepNumber ASC")
    @Builder.Default
    private List<WorkflowStep> steps = new ArrayList<>();

    @Convert(converter = AssignmentRuleConverter.class)
    @Column(name = "assignment_rules", columnDefinition = "TEXT")
    private AssignmentRule assignmentRules;

    @Convert(converter = WorkflowConditionsConverter.class)
    @Column(columnDefinition = "TEXT")
    private WorkflowConditions conditions;

    @Convert(converter = WorkflowConditionsConverter.class)
    @Column(name = "trigger_rules", columnDefinition = "TEXT")
    private WorkflowConditions triggerRules;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private WorkflowConfigStatus status = WorkflowConfigStatus.DRAFT;

    @Column(name = "is_default", nullable = false)
    @Builder.Default
    private boolean defaultConfig = false;

    @Column(name = "created_by")
    private String createdBy;

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

    public Optional<WorkflowStep> findStep(int stepNumber) {
        return steps.stream().filter(s -> s.getStepNumber() == stepNumber).findFirst();
    }

    public int lastStepNumber() {
        return steps.stream().mapToInt(WorkflowStep::getStepNumber).max().orElse(0);
    }

    /**
     * True when step numbers run 1..n without gaps or duplicates.
     */
    public boolean hasContiguousSteps() {
        List<Integer> numbers = steps.stream().map(WorkflowStep::getStepNumber).sorted().toList();
        for (int i = 0; i < numbers.size(); i++) {
            if (numbers.get(i) != i + 1) {
                return false;
            }
        }
        return true;
    }
}
