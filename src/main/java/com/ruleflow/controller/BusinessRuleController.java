package com.ruleflow.controller;

import com.ruleflow.dto.BusinessRuleRequest;
import com.ruleflow.dto.BusinessRuleResponse;
import com.ruleflow.dto.RuleValidationResponse;
import com.ruleflow.service.BusinessRuleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/rules")
@RequiredArgsConstructor
public class BusinessRuleController {

    private final BusinessRuleService ruleService;

    @PostMapping
    public ResponseEntity<BusinessRuleResponse> create(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @Valid @RequestBody BusinessRuleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ruleService.create(tenantId, request));
    }

    @GetMapping
    public ResponseEntity<List<BusinessRuleResponse>> list(@RequestHeader("X-Tenant-Id") String tenantId) {
        return ResponseEntity.ok(ruleService.list(tenantId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BusinessRuleResponse> get(
            @RequestHeader("X-Tenant-Id") String tenantId, @PathVariable UUID id) {
        return ResponseEntity.ok(ruleService.get(tenantId, id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BusinessRuleResponse> update(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @PathVariable UUID id, @Valid @RequestBody BusinessRuleRequest request) {
        return ResponseEntity.ok(ruleService.update(tenantId, id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader("X-Tenant-Id") String tenantId, @PathVariable UUID id) {
        ruleService.delete(tenantId, id);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{id}/toggle")
    public ResponseEntity<BusinessRuleResponse> toggle(
            @RequestHeader("X-Tenant-Id") String tenantId, @PathVariable UUID id) {
        return ResponseEntity.ok(ruleService.toggle(tenantId, id));
    }

    /**
     * Compile-only check: reports whether the condition and action compile,
     * without saving anything.
     */
    @PostMapping("/validate")
    public ResponseEntity<RuleValidationResponse> validate(@Valid @RequestBody BusinessRuleRequest request) {
        return ResponseEntity.ok(ruleService.validate(request));
    }
}
