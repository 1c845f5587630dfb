package com.ruleflow.controller;

import com.ruleflow.dto.CancelRequest;
import com.ruleflow.dto.CreateWorkflowRequest;
import com.ruleflow.dto.RejectRequest;
import com.ruleflow.dto.StepDecisionRequest;
import com.ruleflow.dto.WorkflowRequestResponse;
import com.ruleflow.model.RequestStatus;
import com.ruleflow.service.WorkflowRequestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Approval workflow requests.
 *
 *   POST /api/workflow-requests                 → start a request
 *   GET  /api/workflow-requests?status=&assignedTo=&unassigned=
 *   POST /api/workflow-requests/{id}/approve    {step, notes?}
 *   POST /api/workflow-requests/{id}/advance    {step}
 *   POST /api/workflow-requests/{id}/reject     {step, reason}
 *   POST /api/workflow-requests/{id}/cancel     {reason?}
 *
 * The acting user comes from X-User-Id. A stale step or version answers 409.
 */
@RestController
@RequestMapping("/api/workflow-requests")
@RequiredArgsConstructor
public class WorkflowRequestController {

    private final WorkflowRequestService requestService;

    @PostMapping
    public ResponseEntity<WorkflowRequestResponse> create(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @RequestHeader(value = "X-User-Id", defaultValue = "anonymous") String userId,
            @Valid @RequestBody CreateWorkflowRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(requestService.create(tenantId, userId, request));
    }

    @GetMapping
    public ResponseEntity<List<WorkflowRequestResponse>> list(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @RequestParam(required = false) RequestStatus status,
            @RequestParam(required = false) String assignedTo,
            @RequestParam(defaultValue = "false") boolean unassigned) {
        return ResponseEntity.ok(requestService.list(tenantId, status, assignedTo, unassigned));
    }

    @GetMapping("/{id}")
    public ResponseEntity<WorkflowRequestResponse> get(
            @RequestHeader("X-Tenant-Id") String tenantId, @PathVariable UUID id) {
        return ResponseEntity.ok(requestService.get(tenantId, id));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<WorkflowRequestResponse> approve(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @RequestHeader(value = "X-User-Id", defaultValue = "anonymous") String userId,
            @PathVariable UUID id, @Valid @RequestBody StepDecisionRequest request) {
        return ResponseEntity.ok(requestService.approve(tenantId, userId, id, request));
    }

    @PostMapping("/{id}/advance")
    public ResponseEntity<WorkflowRequestResponse> advance(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @RequestHeader(value = "X-User-Id", defaultValue = "anonymous") String userId,
            @PathVariable UUID id, @Valid @RequestBody StepDecisionRequest request) {
        return ResponseEntity.ok(requestService.advance(tenantId, userId, id, request));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<WorkflowRequestResponse> reject(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @RequestHeader(value = "X-User-Id", defaultValue = "anonymous") String userId,
            @PathVariable UUID id, @Valid @RequestBody RejectRequest request) {
        return ResponseEntity.ok(requestService.reject(tenantId, userId, id, request));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<WorkflowRequestResponse> cancel(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @RequestHeader(value = "X-User-Id", defaultValue = "anonymous") String userId,
            @PathVariable UUID id, @RequestBody(required = false) CancelRequest request) {
        return ResponseEntity.ok(requestService.cancel(tenantId, userId, id, request));
    }
}
