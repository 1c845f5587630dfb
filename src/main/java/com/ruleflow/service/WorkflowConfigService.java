package com.ruleflow.service;

import com.ruleflow.dto.WorkflowConfigRequest;
import com.ruleflow.dto.WorkflowConfigResponse;
import com.ruleflow.dto.WorkflowStepRequest;
import com.ruleflow.dto.WorkflowStepResponse;
import com.ruleflow.exception.ConflictException;
import com.ruleflow.exception.InvalidWorkflowException;
import com.ruleflow.model.*;
import com.ruleflow.repository.ApproverGroupRepository;
import com.ruleflow.repository.OnboardingRequestRepository;
import com.ruleflow.repository.WorkflowConfigRepository;
import com.ruleflow.workflow.StepConditionEvaluator;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Workflow configuration management.
 *
 * Invariants kept on every write:
 *   - step numbers are contiguous 1..n (step 1 is where new requests start)
 *   - every step condition compiles
 *   - every assignment rule names what its type needs (role, user, existing group)
 *   - at most one default configuration per tenant
 *   - an open request's current step keeps its number, name and type: while
 *     PENDING or IN_REVIEW requests exist, deleting the workflow or changing
 *     its step layout (add, remove, rename, renumber, retype) is a conflict
 *
 * Assignment rules, step conditions and stage settings may change at any time;
 * open requests pick them up on their next transition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowConfigService {

    private static final List<RequestStatus> OPEN_STATUSES = List.of(RequestStatus.PENDING, RequestStatus.IN_REVIEW);

    private final WorkflowConfigRepository configRepository;
    private final ApproverGroupRepository groupRepository;
    private final OnboardingRequestRepository requestRepository;
    private final StepConditionEvaluator stepConditions;

    @Transactional
    public WorkflowConfigResponse create(String tenantId, String actor, WorkflowConfigRequest request) {
        WorkflowConfig config = WorkflowConfig.builder()
                .tenantId(tenantId)
                .createdBy(actor)
                .build();
        apply(config, request);

        WorkflowConfig saved = configRepository.save(config);
        demoteOtherDefaults(saved);
        log.info("Workflow config created: '{}' (tenant={}, steps={}, status={})",
                saved.getName(), tenantId, saved.getSteps().size(), saved.getStatus());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<WorkflowConfigResponse> list(String tenantId) {
        return configRepository.findByTenantIdOrderByCreatedAtAsc(tenantId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public WorkflowConfigResponse get(String tenantId, UUID id) {
        return toResponse(load(tenantId, id));
    }

    @Transactional
    public WorkflowConfigResponse update(String tenantId, UUID id, WorkflowConfigRequest request) {
        WorkflowConfig config = load(tenantId, id);
        List<String> layoutBefore = stepLayout(config);
        apply(config, request);
        if (!layoutBefore.equals(stepLayout(config))) {
            requireNoOpenRequests(config, "changing its steps");
        }

        WorkflowConfig saved = configRepository.save(config);
        demoteOtherDefaults(saved);
        log.info("Workflow config updated: '{}' (tenant={}, steps={})", saved.getName(), tenantId, saved.getSteps().size());
        return toResponse(saved);
    }

    @Transactional
    public void delete(String tenantId, UUID id) {
        WorkflowConfig config = load(tenantId, id);
        requireNoOpenRequests(config, "deleting it");
        configRepository.delete(config);
        log.info("Workflow config deleted: '{}' (tenant={})", config.getName(), tenantId);
    }

    /**
     * Make {@code stepNumber} the first step. The chosen step becomes 1 and the
     * others follow as 2..n in their current relative order.
     */
    @Transactional
    public WorkflowConfigResponse setFirstStep(String tenantId, UUID id, int stepNumber) {
        WorkflowConfig config = load(tenantId, id);
        WorkflowStep first = config.findStep(stepNumber)
                .orElseThrow(() -> new EntityNotFoundException("Step " + stepNumber + " not found in workflow " + id));
        requireNoOpenRequests(config, "renumbering its steps");

        List<WorkflowStep> rest = sortedSteps(config).stream()
                .filter(s -> s != first)
                .toList();
        first.setStepNumber(1);
        int next = 2;
        for (WorkflowStep step : rest) {
            step.setStepNumber(next++);
        }

        log.info("Workflow '{}': step '{}' is now first", config.getName(), first.getStepName());
        return toResponse(configRepository.save(config));
    }

    /**
     * Renumber steps to the given order. {@code order} lists every current step
     * number exactly once; the step listed at index i becomes step i + 1.
     */
    @Transactional
    public WorkflowConfigResponse reorderSteps(String tenantId, UUID id, List<Integer> order) {
        WorkflowConfig config = load(tenantId, id);
        Map<Integer, WorkflowStep> byNumber = config.getSteps().stream()
                .collect(Collectors.toMap(WorkflowStep::getStepNumber, Function.identity()));

        if (order == null || order.size() != byNumber.size()
                || !new HashSet<>(order).equals(byNumber.keySet())) {
            throw new InvalidWorkflowException("Step order must list each of steps " + byNumber.keySet().stream().sorted().toList()
                    + " exactly once");
        }
        requireNoOpenRequests(config, "renumbering its steps");

        List<WorkflowStep> reordered = order.stream().map(byNumber::get).toList();
        for (int i = 0; i < reordered.size(); i++) {
            reordered.get(i).setStepNumber(i + 1);
        }

        log.info("Workflow '{}': steps reordered to {}", config.getName(), order);
        return toResponse(configRepository.save(config));
    }

    private void requireNoOpenRequests(WorkflowConfig config, String change) {
        long open = requestRepository.countByWorkflowConfigIdAndStatusIn(config.getId(), OPEN_STATUSES);
        if (open > 0) {
            throw new ConflictException("Workflow '" + config.getName() + "' has " + open
                    + " open request(s); finish or cancel them before " + change);
        }
    }

    private static List<String> stepLayout(WorkflowConfig config) {
        return sortedSteps(config).stream()
                .map(s -> s.getStepNumber() + ":" + s.getStepName() + ":" + s.getStepType())
                .toList();
    }

    private WorkflowConfig load(String tenantId, UUID id) {
        return configRepository.findByIdAndTenantId(id, tenantId)
                .orElseThrow(() -> new EntityNotFoundException("Workflow config not found: " + id));
    }

    private void apply(WorkflowConfig config, WorkflowConfigRequest request) {
        String tenantId = config.getTenantId();
        validateAssignmentRule(tenantId, request.getAssignmentRules(), "workflow default");

        config.setName(request.getName());
        config.setDescription(request.getDescription());
        config.setAssignmentRules(request.getAssignmentRules());
        config.setConditions(request.getConditions());
        config.setTriggerRules(request.getTriggerRules());
        if (request.getStatus() != null) {
            config.setStatus(request.getStatus());
        }
        if (request.getIsDefault() != null) {
            config.setDefaultConfig(request.getIsDefault());
        }

        // Replace all steps
        List<WorkflowStep> steps = buildSteps(config, request.getSteps() == null ? List.of() : request.getSteps());
        config.getSteps().clear();
        config.getSteps().addAll(steps);
    }

    private List<WorkflowStep> buildSteps(WorkflowConfig config, List<WorkflowStepRequest> requests) {
        long numbered = requests.stream().filter(r -> r.getStepNumber() != null).count();
        if (numbered != 0 && numbered != requests.size()) {
            throw new InvalidWorkflowException("Either number every step or none");
        }

        List<WorkflowStep> steps = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            WorkflowStepRequest r = requests.get(i);
            int number = numbered == 0 ? i + 1 : r.getStepNumber();
            validateAssignmentRule(config.getTenantId(), r.getAssignmentRule(), "step " + number);

            WorkflowStep step = WorkflowStep.builder()
                    .workflowConfig(config)
                    .stepNumber(number)
                    .stepName(r.getStepName())
                    .stepType(r.getStepType() != null ? r.getStepType() : StepType.APPROVAL)
                    .assignmentRule(r.getAssignmentRule())
                    .required(r.getRequired() == null || r.getRequired())
                    .canSkip(Boolean.TRUE.equals(r.getCanSkip()))
                    .conditions(r.getConditions())
                    .stageSettings(r.getStageSettings())
                    .build();
            stepConditions.compile(step);
            steps.add(step);
        }

        Set<Integer> numbers = steps.stream().map(WorkflowStep::getStepNumber).collect(Collectors.toSet());
        for (int n = 1; n <= steps.size(); n++) {
            if (!numbers.contains(n)) {
                throw new InvalidWorkflowException("Step numbers must run 1.." + steps.size() + " without gaps, missing " + n);
            }
        }
        steps.sort(Comparator.comparingInt(WorkflowStep::getStepNumber));
        return steps;
    }

    private void validateAssignmentRule(String tenantId, AssignmentRule rule, String where) {
        if (rule == null) {
            return;
        }
        if (rule.getType() == null) {
            throw new InvalidWorkflowException("Assignment rule of " + where + " has no type");
        }
        if (rule.getTimeoutHours() != null && rule.getTimeoutHours() < 1) {
            throw new InvalidWorkflowException("Assignment rule of " + where + ": timeoutHours must be at least 1");
        }
        switch (rule.getType()) {
            case ROLE -> require(rule.getRole(), "role", where);
            case USER -> require(rule.getUserId(), "userId", where);
            case GROUP -> requireGroup(tenantId, rule.getGroupId(), false, where);
            case ROUND_ROBIN -> requireGroup(tenantId, rule.getGroupId(), true, where);
        }

        EscalationTarget target = rule.getEscalateTo();
        if (target != null) {
            if (target.getType() == null) {
                throw new InvalidWorkflowException("Escalation target of " + where + " has no type");
            }
            if (!target.isAdvance()) {
                validateAssignmentRule(tenantId, target.toAssignmentRule(), "escalation of " + where);
            }
        }
    }

    private void require(String value, String field, String where) {
        if (value == null || value.isBlank()) {
            throw new InvalidWorkflowException("Assignment rule of " + where + " needs " + field);
        }
    }

    private void requireGroup(String tenantId, String groupId, boolean needsMembers, String where) {
        require(groupId, "groupId", where);
        UUID id;
        try {
            id = UUID.fromString(groupId);
        } catch (IllegalArgumentException e) {
            throw new InvalidWorkflowException("Assignment rule of " + where + ": invalid groupId " + groupId);
        }
        ApproverGroup group = groupRepository.findByIdAndTenantId(id, tenantId)
                .orElseThrow(() -> new InvalidWorkflowException("Assignment rule of " + where + ": unknown group " + groupId));
        if (needsMembers && group.getMemberIds().isEmpty()) {
            throw new InvalidWorkflowException("Assignment rule of " + where + ": group '" + group.getName()
                    + "' has no members to rotate through");
        }
    }

    private void demoteOtherDefaults(WorkflowConfig saved) {
        if (!saved.isDefaultConfig()) {
            return;
        }
        for (WorkflowConfig other : configRepository.findByTenantIdAndDefaultConfigTrueAndIdNot(saved.getTenantId(), saved.getId())) {
            other.setDefaultConfig(false);
            log.info("Workflow '{}' is no longer the default (replaced by '{}')", other.getName(), saved.getName());
        }
    }

    private static List<WorkflowStep> sortedSteps(WorkflowConfig config) {
        return config.getSteps().stream()
                .sorted(Comparator.comparingInt(WorkflowStep::getStepNumber))
                .toList();
    }

    // --- Mapping helpers ---

    WorkflowConfigResponse toResponse(WorkflowConfig c) {
        return WorkflowConfigResponse.builder()
                .id(c.getId())
                .name(c.getName())
                .description(c.getDescription())
                .steps(sortedSteps(c).stream().map(this::toStepResponse).toList())
                .assignmentRules(c.getAssignmentRules())
                .conditions(c.getConditions())
                .triggerRules(c.getTriggerRules())
                .status(c.getStatus())
                .isDefault(c.isDefaultConfig())
                .createdBy(c.getCreatedBy())
                .createdAt(c.getCreatedAt())
                .updatedAt(c.getUpdatedAt())
                .build();
    }

    private WorkflowStepResponse toStepResponse(WorkflowStep s) {
        return WorkflowStepResponse.builder()
                .id(s.getId())
                .stepNumber(s.getStepNumber())
                .stepName(s.getStepName())
                .stepType(s.getStepType())
                .assignmentRule(s.getAssignmentRule())
                .required(s.isRequired())
                .canSkip(s.isCanSkip())
                .conditions(s.getConditions())
                .stageSettings(s.getStageSettings())
                .build();
    }
}
