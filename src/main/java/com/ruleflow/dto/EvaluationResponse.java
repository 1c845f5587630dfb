package com.ruleflow.dto;

import com.ruleflow.engine.RuleResult;
import com.ruleflow.engine.action.ActionResult;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EvaluationResponse {
    private int matchedRules;
    private List<RuleResult> ruleResults;
    private ActionResult actionResults;
}
