package com.ruleflow.dto;

import com.ruleflow.model.AssignmentRule;
import com.ruleflow.model.StageSettings;
import com.ruleflow.model.StepType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowStepRequest {

    // null on every step = numbered 1..n in list order
    @Min(value = 1, message = "stepNumber starts at 1")
    private Integer stepNumber;

    @NotBlank(message = "stepName is required")
    private String stepName;

    private StepType stepType;
    private AssignmentRule assignmentRule;
    private Boolean required;
    private Boolean canSkip;

    // branch predicate, e.g. "risk_score >= 60"
    private String conditions;

    private StageSettings stageSettings;
}
