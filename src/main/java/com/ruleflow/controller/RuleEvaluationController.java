package com.ruleflow.controller;

import com.ruleflow.dto.EvaluationRequest;
import com.ruleflow.dto.EvaluationResponse;
import com.ruleflow.engine.BusinessRuleEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST endpoint for evaluating the tenant's active rules against a context
 * (the synchronous alternative to the Kafka topic).
 *
 * POST /api/rules/evaluate
 * {
 *   "entityType": "agent",
 *   "entityId": "agent-7",
 *   "context": {"risk_level": "high"},
 *   "autoExecute": true
 * }
 */
@RestController
@RequestMapping("/api/rules")
@RequiredArgsConstructor
public class RuleEvaluationController {

    private final BusinessRuleEngine engine;

    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationResponse> evaluate(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @RequestHeader(value = "X-User-Id", defaultValue = "anonymous") String userId,
            @Valid @RequestBody EvaluationRequest request) {
        return ResponseEntity.ok(engine.evaluate(tenantId, userId, request));
    }
}
