package com.ruleflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruleflow.dto.BusinessRuleRequest;
import com.ruleflow.dto.BusinessRuleResponse;
import com.ruleflow.dto.RuleValidationResponse;
import com.ruleflow.engine.CompiledRule;
import com.ruleflow.engine.CompiledRuleCache;
import com.ruleflow.engine.RuleCompiler;
import com.ruleflow.exception.CompileException;
import com.ruleflow.exception.ConflictException;
import com.ruleflow.model.BusinessRule;
import com.ruleflow.repository.BusinessRuleRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Rule management. Every create and update compiles the rule first; a rule
 * that does not compile is rejected with {@link CompileException} and nothing
 * is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BusinessRuleService {

    private final BusinessRuleRepository ruleRepository;
    private final RuleCompiler ruleCompiler;
    private final CompiledRuleCache compiledRuleCache;
    private final ObjectMapper objectMapper;

    @Transactional
    public BusinessRuleResponse create(String tenantId, BusinessRuleRequest request) {
        if (ruleRepository.existsByTenantIdAndRuleId(tenantId, request.getRuleId())) {
            throw new ConflictException("Rule id already exists: " + request.getRuleId());
        }
        BusinessRule rule = BusinessRule.builder().tenantId(tenantId).build();
        apply(rule, request);
        ruleCompiler.compile(rule);

        BusinessRule saved = ruleRepository.save(rule);
        log.info("Rule created: {} (tenant={}, priority={})", saved.getRuleId(), tenantId, saved.getPriority());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<BusinessRuleResponse> list(String tenantId) {
        return ruleRepository.findByTenantIdOrderByPriorityAscRuleIdAsc(tenantId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public BusinessRuleResponse get(String tenantId, UUID id) {
        return toResponse(load(tenantId, id));
    }

    @Transactional
    public BusinessRuleResponse update(String tenantId, UUID id, BusinessRuleRequest request) {
        BusinessRule rule = load(tenantId, id);
        if (!rule.getRuleId().equals(request.getRuleId())
                && ruleRepository.existsByTenantIdAndRuleId(tenantId, request.getRuleId())) {
            throw new ConflictException("Rule id already exists: " + request.getRuleId());
        }
        apply(rule, request);
        ruleCompiler.compile(rule);

        BusinessRule saved = ruleRepository.saveAndFlush(rule);
        compiledRuleCache.invalidate(id);
        log.info("Rule updated: {} (tenant={})", saved.getRuleId(), tenantId);
        return toResponse(saved);
    }

    @Transactional
    public void delete(String tenantId, UUID id) {
        BusinessRule rule = load(tenantId, id);
        ruleRepository.delete(rule);
        compiledRuleCache.invalidate(id);
        log.info("Rule deleted: {} (tenant={})", rule.getRuleId(), tenantId);
    }

    @Transactional
    public BusinessRuleResponse toggle(String tenantId, UUID id) {
        BusinessRule rule = load(tenantId, id);
        rule.setActive(!rule.isActive());
        BusinessRule saved = ruleRepository.saveAndFlush(rule);
        compiledRuleCache.invalidate(id);
        log.info("Rule {} {}", saved.getRuleId(), saved.isActive() ? "activated" : "deactivated");
        return toResponse(saved);
    }

    /**
     * Compile without saving.
     */
    public RuleValidationResponse validate(BusinessRuleRequest request) {
        BusinessRule rule = new BusinessRule();
        try {
            apply(rule, request);
            CompiledRule compiled = ruleCompiler.compile(rule);
            return RuleValidationResponse.builder()
                    .valid(true)
                    .ruleId(request.getRuleId())
                    .actionType(compiled.action().type().name())
                    .actionName(compiled.action().name())
                    .position(-1)
                    .build();
        } catch (CompileException e) {
            return RuleValidationResponse.builder()
                    .valid(false)
                    .ruleId(request.getRuleId())
                    .error(e.getMessage())
                    .position(e.getPosition())
                    .build();
        }
    }

    private BusinessRule load(String tenantId, UUID id) {
        return ruleRepository.findByIdAndTenantId(id, tenantId)
                .orElseThrow(() -> new EntityNotFoundException("Rule not found: " + id));
    }

    private void apply(BusinessRule rule, BusinessRuleRequest request) {
        rule.setRuleId(request.getRuleId());
        rule.setName(request.getName());
        rule.setDescription(request.getDescription());
        rule.setConditionExpression(request.getConditionExpression());
        rule.setActionExpression(request.getActionExpression());
        rule.setActionType(request.getActionType());
        rule.setActionConfig(writeConfig(request));
        rule.setRuleType(request.getRuleType());
        rule.setApplicableEntities(request.getApplicableEntities() == null
                ? new HashSet<>() : new HashSet<>(request.getApplicableEntities()));
        rule.setApplicableScreens(request.getApplicableScreens() == null
                ? new HashSet<>() : new HashSet<>(request.getApplicableScreens()));
        rule.setPriority(request.getPriority());
        if (request.getActive() != null) {
            rule.setActive(request.getActive());
        }
        rule.setAutomatic(request.isAutomatic());
    }

    private String writeConfig(BusinessRuleRequest request) {
        if (request.getActionConfig() == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(request.getActionConfig());
        } catch (JsonProcessingException e) {
            throw new CompileException(request.getRuleId(), -1, "Action config cannot be serialized: " + e.getOriginalMessage());
        }
    }

    private Map<String, Object> readConfig(String actionConfig) {
        if (actionConfig == null || actionConfig.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(actionConfig, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored action config is not JSON", e);
        }
    }

    private BusinessRuleResponse toResponse(BusinessRule r) {
        return BusinessRuleResponse.builder()
                .id(r.getId())
                .ruleId(r.getRuleId())
                .name(r.getName())
                .description(r.getDescription())
                .conditionExpression(r.getConditionExpression())
                .actionExpression(r.getActionExpression())
                .actionType(r.getActionType())
                .actionConfig(readConfig(r.getActionConfig()))
                .ruleType(r.getRuleType())
                .applicableEntities(r.getApplicableEntities())
                .applicableScreens(r.getApplicableScreens())
                .priority(r.getPriority())
                .active(r.isActive())
                .automatic(r.isAutomatic())
                .version(r.getVersion())
                .createdAt(r.getCreatedAt())
                .updatedAt(r.getUpdatedAt())
                .build();
    }
}
