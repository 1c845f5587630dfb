package com.ruleflow.workflow;

import com.ruleflow.exception.AssignmentException;
import com.ruleflow.exception.ConflictException;
import com.ruleflow.exception.InvalidWorkflowException;
import com.ruleflow.model.*;
import com.ruleflow.repository.OnboardingRequestRepository;
import com.ruleflow.repository.WorkflowConfigRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The approval state machine.
 *
 *   PENDING ──approve──▶ IN_REVIEW ──approve (last step)──▶ APPROVED
 *      │                    │
 *      └──────reject────────┴──────▶ REJECTED
 *   any non-terminal ──cancel──▶ CANCELLED
 *
 * STEP ENTRY (create, approve, advance, forced escalation):
 *   walk the steps from the next step number upwards
 *     optional step whose conditions are false → skipped
 *     NOTIFICATION step                        → announced, passed through
 *     APPROVAL step                            → entered: assignee resolved,
 *                                                escalation deadline scheduled
 *   no step left → APPROVED
 *
 * Every transition is checked against the request's current step and status, and
 * is written with an optimistic version check; the loser of a race gets a
 * {@link ConflictException} and must re-read the request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowOrchestrator {

    static final String REQUEST_NUMBER_PREFIX = "AI-";
    static final String DEFAULT_REQUEST_TYPE = "onboarding";
    static final String ESCALATION_ACTOR = "system:escalation";

    private final WorkflowConfigRepository configRepository;
    private final OnboardingRequestRepository requestRepository;
    private final WorkflowSelector workflowSelector;
    private final StepConditionEvaluator stepConditions;
    private final AssignmentResolver assignmentResolver;
    private final EscalationScheduler escalationScheduler;
    private final StageNotifier stageNotifier;
    private final Clock clock;

    @Transactional
    public OnboardingRequest create(WorkflowStart start) {
        Map<String, Object> context = start.context() == null ? new HashMap<>() : new HashMap<>(start.context());
        WorkflowConfig config = resolveConfig(start, context);
        if (config.getSteps().isEmpty()) {
            throw new InvalidWorkflowException("Workflow '" + config.getName() + "' has no steps");
        }

        Instant now = Instant.now(clock);
        long sequence = requestRepository.findMaxRequestSequence(start.tenantId()) + 1;
        OnboardingRequest request = requestRepository.save(OnboardingRequest.builder()
                .tenantId(start.tenantId())
                .requestSequence(sequence)
                .requestNumber(REQUEST_NUMBER_PREFIX + sequence)
                .entityType(start.entityType())
                .entityId(start.entityId())
                .requestType(isBlank(start.requestType()) ? DEFAULT_REQUEST_TYPE : start.requestType())
                .requestedBy(start.requestedBy())
                .workflowConfigId(config.getId())
                .status(RequestStatus.PENDING)
                .context(context)
                .createdAt(now)
                .updatedAt(now)
                .build());

        enterNextApplicableStep(request, config, 1, now);
        if (request.getStatus() == RequestStatus.APPROVED) {
            request.setApprovedAt(now);
        }

        OnboardingRequest saved = save(request);
        log.info("Workflow request created: {} (workflow='{}', entity={}/{}, status={}, step={})",
                saved.getRequestNumber(), config.getName(), saved.getEntityType(), saved.getEntityId(),
                saved.getStatus(), saved.getCurrentStep());
        return saved;
    }

    @Transactional
    public OnboardingRequest approve(String tenantId, UUID requestId, StepDecision decision) {
        OnboardingRequest request = loadForTransition(tenantId, requestId, decision.expectedVersion());
        requireOnStep(request, decision.step(), "approve");
        WorkflowConfig config = loadConfig(request);
        Instant now = Instant.now(clock);

        request.setReviewedBy(decision.actor());
        request.setReviewedAt(now);
        request.setReviewNotes(decision.notes());
        request.setStatus(RequestStatus.IN_REVIEW);

        enterNextApplicableStep(request, config, decision.step() + 1, now);
        if (request.getStatus() == RequestStatus.APPROVED) {
            request.setApprovedBy(decision.actor());
            request.setApprovedAt(now);
        }

        OnboardingRequest saved = save(request);
        log.info("Request {} step {} approved by {} → status={}, step={}",
                saved.getRequestNumber(), decision.step(), decision.actor(), saved.getStatus(), saved.getCurrentStep());
        return saved;
    }

    /**
     * Skip the current step without approving it. Only steps marked {@code canSkip}.
     */
    @Transactional
    public OnboardingRequest advance(String tenantId, UUID requestId, StepDecision decision) {
        OnboardingRequest request = loadForTransition(tenantId, requestId, decision.expectedVersion());
        requireOnStep(request, decision.step(), "advance");
        WorkflowConfig config = loadConfig(request);
        WorkflowStep step = config.findStep(decision.step())
                .orElseThrow(() -> new ConflictException("Step " + decision.step() + " no longer exists in workflow '"
                        + config.getName() + "'"));
        if (!step.isCanSkip()) {
            throw new ConflictException("Step " + step.getStepNumber() + " '" + step.getStepName() + "' cannot be skipped");
        }

        Instant now = Instant.now(clock);
        enterNextApplicableStep(request, config, decision.step() + 1, now);
        if (request.getStatus() == RequestStatus.APPROVED) {
            request.setApprovedBy(decision.actor());
            request.setApprovedAt(now);
        }

        OnboardingRequest saved = save(request);
        log.info("Request {} step {} skipped by {} → status={}, step={}",
                saved.getRequestNumber(), decision.step(), decision.actor(), saved.getStatus(), saved.getCurrentStep());
        return saved;
    }

    @Transactional
    public OnboardingRequest reject(String tenantId, UUID requestId, StepDecision decision) {
        OnboardingRequest request = loadForTransition(tenantId, requestId, decision.expectedVersion());
        requireOnStep(request, decision.step(), "reject");

        request.setStatus(RequestStatus.REJECTED);
        request.setRejectedBy(decision.actor());
        request.setRejectedAt(Instant.now(clock));
        request.setRejectionReason(decision.notes());

        OnboardingRequest saved = save(request);
        log.info("Request {} rejected at step {} by {}", saved.getRequestNumber(), decision.step(), decision.actor());
        return saved;
    }

    @Transactional
    public OnboardingRequest cancel(String tenantId, UUID requestId, String actor, String reason, Long expectedVersion) {
        OnboardingRequest request = loadForTransition(tenantId, requestId, expectedVersion);
        if (request.isTerminal()) {
            throw new ConflictException("Request " + request.getRequestNumber() + " is already " + request.getStatus());
        }

        request.setStatus(RequestStatus.CANCELLED);
        request.setCancelledBy(actor);
        request.setCancelledAt(Instant.now(clock));
        request.setCancellationReason(reason);

        OnboardingRequest saved = save(request);
        log.info("Request {} cancelled by {} at step {}", saved.getRequestNumber(), actor, saved.getCurrentStep());
        return saved;
    }

    /**
     * Apply a due escalation. Called once per timer, inside the transaction that
     * claimed it.
     *
     *   request finished or moved on → nothing to do
     *   escalateTo unset             → assignee re-notified
     *   escalateTo ADVANCE           → step force-advanced
     *   escalateTo ROLE/USER/...     → step reassigned; on failure the current
     *                                  assignee stays and the error is recorded
     *
     * @return a description of what happened, stored on the timer
     */
    @Transactional
    public String escalate(OnboardingRequest request, EscalationTimer timer) {
        if (request.isTerminal() || request.getCurrentStep() != timer.getStepNumber()) {
            return "skipped: request is " + request.getStatus() + " on step " + request.getCurrentStep();
        }

        WorkflowConfig config = loadConfig(request);
        AssignmentRule rule = config.findStep(timer.getStepNumber())
                .map(step -> effectiveRule(config, step))
                .orElse(config.getAssignmentRules());
        EscalationTarget target = rule == null ? null : rule.getEscalateTo();
        Instant now = Instant.now(clock);

        String outcome;
        if (target == null || target.getType() == null) {
            outcome = "notified";
        } else if (target.isAdvance()) {
            enterNextApplicableStep(request, config, timer.getStepNumber() + 1, now);
            if (request.getStatus() == RequestStatus.APPROVED) {
                request.setApprovedBy(ESCALATION_ACTOR);
                request.setApprovedAt(now);
                outcome = "advanced: request approved";
            } else {
                outcome = "advanced to step " + request.getCurrentStep();
            }
        } else {
            try {
                Assignment assignment = assignmentResolver.resolve(request.getTenantId(), target.toAssignmentRule());
                request.clearAssignment();
                apply(request, assignment);
                outcome = "reassigned to " + assignment.describe();
            } catch (AssignmentException e) {
                request.setAssignmentError(e.getMessage());
                outcome = "reassignment failed: " + e.getMessage();
            }
        }

        OnboardingRequest saved = save(request);
        stageNotifier.escalated(saved, timer.getStepNumber(), outcome);
        log.info("Escalation fired: request={}, step={}, outcome={}", saved.getRequestNumber(), timer.getStepNumber(), outcome);
        return outcome;
    }

    private void enterNextApplicableStep(OnboardingRequest request, WorkflowConfig config, int fromStep, Instant now) {
        List<WorkflowStep> steps = config.getSteps().stream()
                .sorted(Comparator.comparingInt(WorkflowStep::getStepNumber))
                .toList();

        for (WorkflowStep step : steps) {
            if (step.getStepNumber() < fromStep) {
                continue;
            }
            if (!stepConditions.applies(step, request.getContext())) {
                log.debug("Request {} skips step {} '{}'", request.getRequestNumber(), step.getStepNumber(), step.getStepName());
                continue;
            }
            if (step.getStepType() == StepType.NOTIFICATION) {
                request.setCurrentStep(step.getStepNumber());
                request.clearAssignment();
                stageNotifier.stepEntered(request, step);
                continue;
            }
            enterStep(request, config, step, now);
            return;
        }

        request.setStatus(RequestStatus.APPROVED);
        request.clearAssignment();
        if (request.getCurrentStep() < 1) {
            request.setCurrentStep(config.lastStepNumber());
        }
    }

    private void enterStep(OnboardingRequest request, WorkflowConfig config, WorkflowStep step, Instant now) {
        request.setCurrentStep(step.getStepNumber());
        request.clearAssignment();
        AssignmentRule rule = effectiveRule(config, step);

        try {
            Assignment assignment = assignmentResolver.resolve(request.getTenantId(), rule);
            apply(request, assignment);
            log.info("Request {} entered step {} '{}', assigned to {}",
                    request.getRequestNumber(), step.getStepNumber(), step.getStepName(), assignment.describe());
        } catch (AssignmentException e) {
            request.setAssignmentError(e.getMessage());
            log.warn("Request {} entered step {} '{}' unassigned: {}",
                    request.getRequestNumber(), step.getStepNumber(), step.getStepName(), e.getMessage());
        }

        escalationScheduler.schedule(request, step.getStepNumber(), rule, now);
        if (step.getStageSettings() != null && step.getStageSettings().notifiesOnEntry()) {
            stageNotifier.stepEntered(request, step);
        }
    }

    private AssignmentRule effectiveRule(WorkflowConfig config, WorkflowStep step) {
        if (step.getAssignmentRule() == null) {
            return config.getAssignmentRules();
        }
        return step.getAssignmentRule().withDefaults(config.getAssignmentRules());
    }

    private void apply(OnboardingRequest request, Assignment assignment) {
        request.setAssignedTo(assignment.assignedTo());
        request.setAssignedQueue(assignment.queue());
        request.setCandidateAssignees(assignment.candidates());
    }

    private WorkflowConfig resolveConfig(WorkflowStart start, Map<String, Object> context) {
        if (start.workflowConfigId() != null) {
            WorkflowConfig config = configRepository.findByIdAndTenantId(start.workflowConfigId(), start.tenantId())
                    .orElseThrow(() -> new EntityNotFoundException("Workflow config not found: " + start.workflowConfigId()));
            if (config.getStatus() != WorkflowConfigStatus.ACTIVE) {
                throw new InvalidWorkflowException("Workflow '" + config.getName() + "' is " + config.getStatus());
            }
            return config;
        }
        return workflowSelector.select(start.tenantId(), start.entityType(), context)
                .orElseThrow(() -> new InvalidWorkflowException(
                        "No active workflow configuration applies to " + start.entityType()));
    }

    private OnboardingRequest loadForTransition(String tenantId, UUID requestId, Long expectedVersion) {
        OnboardingRequest request = requestRepository.findByIdAndTenantId(requestId, tenantId)
                .orElseThrow(() -> new EntityNotFoundException("Workflow request not found: " + requestId));
        if (expectedVersion != null && !expectedVersion.equals(request.getVersion())) {
            throw new ConflictException("Request " + request.getRequestNumber() + " has version "
                    + request.getVersion() + ", expected " + expectedVersion);
        }
        return request;
    }

    private void requireOnStep(OnboardingRequest request, int step, String transition) {
        if (request.isTerminal()) {
            throw new ConflictException("Cannot " + transition + " request " + request.getRequestNumber()
                    + ": it is " + request.getStatus());
        }
        if (request.getCurrentStep() != step) {
            throw new ConflictException("Cannot " + transition + " step " + step + " of request "
                    + request.getRequestNumber() + ": it is on step " + request.getCurrentStep());
        }
    }

    private WorkflowConfig loadConfig(OnboardingRequest request) {
        return configRepository.findById(request.getWorkflowConfigId())
                .orElseThrow(() -> new EntityNotFoundException("Workflow config not found: " + request.getWorkflowConfigId()));
    }

    private OnboardingRequest save(OnboardingRequest request) {
        try {
            return requestRepository.saveAndFlush(request);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new ConflictException("Request " + request.getRequestNumber()
                    + " was modified concurrently; re-read and retry", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
