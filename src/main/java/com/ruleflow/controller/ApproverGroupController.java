package com.ruleflow.controller;

import com.ruleflow.dto.ApproverGroupRequest;
import com.ruleflow.dto.ApproverGroupResponse;
import com.ruleflow.service.ApproverGroupService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/approver-groups")
@RequiredArgsConstructor
public class ApproverGroupController {

    private final ApproverGroupService groupService;

    @PostMapping
    public ResponseEntity<ApproverGroupResponse> create(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @Valid @RequestBody ApproverGroupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(groupService.create(tenantId, request));
    }

    @GetMapping
    public ResponseEntity<List<ApproverGroupResponse>> list(@RequestHeader("X-Tenant-Id") String tenantId) {
        return ResponseEntity.ok(groupService.list(tenantId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApproverGroupResponse> get(
            @RequestHeader("X-Tenant-Id") String tenantId, @PathVariable UUID id) {
        return ResponseEntity.ok(groupService.get(tenantId, id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApproverGroupResponse> update(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @PathVariable UUID id, @Valid @RequestBody ApproverGroupRequest request) {
        return ResponseEntity.ok(groupService.update(tenantId, id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader("X-Tenant-Id") String tenantId, @PathVariable UUID id) {
        groupService.delete(tenantId, id);
        return ResponseEntity.noContent().build();
    }
}
