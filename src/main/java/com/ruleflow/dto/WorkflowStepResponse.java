package com.ruleflow.dto;

import com.ruleflow.model.AssignmentRule;
import com.ruleflow.model.StageSettings;
import com.ruleflow.model.StepType;
import lombok.*;

import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowStepResponse {
    private UUID id;
    private int stepNumber;
    private String stepName;
    private StepType stepType;
    private AssignmentRule assignmentRule;
    private boolean required;
    private boolean canSkip;
    private String conditions;
    private StageSettings stageSettings;
}
