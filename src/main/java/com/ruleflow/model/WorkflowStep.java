package com.ruleflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ruleflow.model.converter.AssignmentRuleConverter;
import com.ruleflow.model.converter.StageSettingsConverter;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * One stage of a workflow configuration.
 *
 * {@code conditions} is a branch predicate in the rule expression language,
 * evaluated against the request's bound context: an optional step whose
 * predicate is false is skipped; a required step is always entered.
 */
@Entity
@Table(name = "workflow_steps")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowStep {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "workflow_config_id", nullable = false)
    @JsonIgnore
    private WorkflowConfig workflowConfig;

    @Column(name = "step_number", nullable = false)
    private int stepNumber;

    @Column(name = "step_name", nullable = false)
    private String stepName;

    @Enumerated(EnumType.STRING)
    @Column(name = "step_type", nullable = false)
    @Builder.Default
    private StepType stepType = StepType.APPROVAL;

    @Convert(converter = AssignmentRuleConverter.class)
    @Column(name = "assignment_rule", columnDefinition = "TEXT")
    private AssignmentRule assignmentRule;

    @Column(nullable = false)
    @Builder.Default
    private boolean required = true;

    @Column(name = "can_skip", nullable = false)
    @Builder.Default
    private boolean canSkip = false;

    @Column(columnDefinition = "TEXT")
    private String conditions;

    @Convert(converter = StageSettingsConverter.class)
    @Column(name = "stage_settings", columnDefinition = "TEXT")
    private StageSettings stageSettings;
}
