package com.ruleflow.controller;

import com.ruleflow.dto.WorkflowConfigRequest;
import com.ruleflow.dto.WorkflowConfigResponse;
import com.ruleflow.dto.WorkflowHealthResponse;
import com.ruleflow.service.WorkflowConfigService;
import com.ruleflow.service.WorkflowHealthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/workflow-configs")
@RequiredArgsConstructor
public class WorkflowConfigController {

    private final WorkflowConfigService configService;
    private final WorkflowHealthService healthService;

    @PostMapping
    public ResponseEntity<WorkflowConfigResponse> create(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @RequestHeader(value = "X-User-Id", defaultValue = "anonymous") String userId,
            @Valid @RequestBody WorkflowConfigRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(configService.create(tenantId, userId, request));
    }

    @GetMapping
    public ResponseEntity<List<WorkflowConfigResponse>> list(@RequestHeader("X-Tenant-Id") String tenantId) {
        return ResponseEntity.ok(configService.list(tenantId));
    }

    @GetMapping("/health-check")
    public ResponseEntity<WorkflowHealthResponse> healthCheck(@RequestHeader("X-Tenant-Id") String tenantId) {
        return ResponseEntity.ok(healthService.check(tenantId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<WorkflowConfigResponse> get(
            @RequestHeader("X-Tenant-Id") String tenantId, @PathVariable UUID id) {
        return ResponseEntity.ok(configService.get(tenantId, id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<WorkflowConfigResponse> update(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @PathVariable UUID id, @Valid @RequestBody WorkflowConfigRequest request) {
        return ResponseEntity.ok(configService.update(tenantId, id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader("X-Tenant-Id") String tenantId, @PathVariable UUID id) {
        configService.delete(tenantId, id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/set-first-step")
    public ResponseEntity<WorkflowConfigResponse> setFirstStep(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @PathVariable UUID id, @RequestParam int stepNumber) {
        return ResponseEntity.ok(configService.setFirstStep(tenantId, id, stepNumber));
    }

    /**
     * Body is the current step numbers in their new order, e.g. [3, 1, 2].
     */
    @PostMapping("/{id}/reorder-steps")
    public ResponseEntity<WorkflowConfigResponse> reorderSteps(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @PathVariable UUID id, @RequestBody List<Integer> stepNumbers) {
        return ResponseEntity.ok(configService.reorderSteps(tenantId, id, stepNumbers));
    }
}
