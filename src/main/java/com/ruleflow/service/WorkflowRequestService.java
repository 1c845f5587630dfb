package com.ruleflow.service;

import com.ruleflow.dto.CancelRequest;
import com.ruleflow.dto.CreateWorkflowRequest;
import com.ruleflow.dto.RejectRequest;
import com.ruleflow.dto.StepDecisionRequest;
import com.ruleflow.dto.WorkflowRequestResponse;
import com.ruleflow.model.OnboardingRequest;
import com.ruleflow.model.RequestStatus;
import com.ruleflow.model.WorkflowConfig;
import com.ruleflow.model.WorkflowStep;
import com.ruleflow.repository.OnboardingRequestRepository;
import com.ruleflow.repository.WorkflowConfigRepository;
import com.ruleflow.workflow.StepDecision;
import com.ruleflow.workflow.WorkflowOrchestrator;
import com.ruleflow.workflow.WorkflowStart;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * API-facing side of workflow requests: maps payloads onto
 * {@link WorkflowOrchestrator} transitions and requests onto responses.
 */
@Service
@RequiredArgsConstructor
public class WorkflowRequestService {

    private static final List<RequestStatus> OPEN_STATUSES = List.of(RequestStatus.PENDING, RequestStatus.IN_REVIEW);

    private final WorkflowOrchestrator orchestrator;
    private final OnboardingRequestRepository requestRepository;
    private final WorkflowConfigRepository configRepository;

    public WorkflowRequestResponse create(String tenantId, String actor, CreateWorkflowRequest request) {
        OnboardingRequest created = orchestrator.create(new WorkflowStart(
                tenantId,
                request.getEntityType(),
                request.getEntityId(),
                request.getRequestType(),
                actor,
                request.getWorkflowConfigId(),
                request.getContext()));
        return toResponse(created);
    }

    @Transactional(readOnly = true)
    public WorkflowRequestResponse get(String tenantId, UUID id) {
        OnboardingRequest request = requestRepository.findByIdAndTenantId(id, tenantId)
                .orElseThrow(() -> new EntityNotFoundException("Workflow request not found: " + id));
        return toResponse(request);
    }

    /**
     * @param status     only requests in this status; with an assignee filter, defaults to open requests
     * @param assignedTo only requests assigned to this user
     * @param unassigned only requests nobody is assigned to (queued or failed assignment)
     */
    @Transactional(readOnly = true)
    public List<WorkflowRequestResponse> list(String tenantId, RequestStatus status, String assignedTo, boolean unassigned) {
        List<RequestStatus> statuses = status != null ? List.of(status) : OPEN_STATUSES;
        List<OnboardingRequest> requests;
        if (assignedTo != null && !assignedTo.isBlank()) {
            requests = requestRepository.findByTenantIdAndStatusInAndAssignedToOrderByCreatedAtAsc(tenantId, statuses, assignedTo);
        } else if (unassigned) {
            requests = requestRepository.findByTenantIdAndStatusInAndAssignedToIsNullOrderByCreatedAtAsc(tenantId, statuses);
        } else if (status != null) {
            requests = requestRepository.findByTenantIdAndStatusOrderByCreatedAtDesc(tenantId, status);
        } else {
            requests = requestRepository.findByTenantIdOrderByCreatedAtDesc(tenantId);
        }

        Set<UUID> configIds = requests.stream().map(OnboardingRequest::getWorkflowConfigId).collect(Collectors.toSet());
        Map<UUID, WorkflowConfig> configs = configRepository.findAllById(configIds).stream()
                .collect(Collectors.toMap(WorkflowConfig::getId, Function.identity()));
        return requests.stream()
                .map(r -> toResponse(r, configs.get(r.getWorkflowConfigId())))
                .toList();
    }

    public WorkflowRequestResponse approve(String tenantId, String actor, UUID id, StepDecisionRequest request) {
        return toResponse(orchestrator.approve(tenantId, id,
                new StepDecision(request.getStep(), actor, request.getNotes(), request.getExpectedVersion())));
    }

    public WorkflowRequestResponse advance(String tenantId, String actor, UUID id, StepDecisionRequest request) {
        return toResponse(orchestrator.advance(tenantId, id,
                new StepDecision(request.getStep(), actor, request.getNotes(), request.getExpectedVersion())));
    }

    public WorkflowRequestResponse reject(String tenantId, String actor, UUID id, RejectRequest request) {
        return toResponse(orchestrator.reject(tenantId, id,
                new StepDecision(request.getStep(), actor, request.getReason(), request.getExpectedVersion())));
    }

    public WorkflowRequestResponse cancel(String tenantId, String actor, UUID id, CancelRequest request) {
        CancelRequest body = request != null ? request : new CancelRequest();
        return toResponse(orchestrator.cancel(tenantId, id, actor, body.getReason(), body.getExpectedVersion()));
    }

    // --- Mapping helpers ---

    private WorkflowRequestResponse toResponse(OnboardingRequest r) {
        return toResponse(r, configRepository.findById(r.getWorkflowConfigId()).orElse(null));
    }

    private WorkflowRequestResponse toResponse(OnboardingRequest r, WorkflowConfig config) {
        String stepName = config == null ? null : config.findStep(r.getCurrentStep())
                .map(WorkflowStep::getStepName)
                .orElse(null);
        return WorkflowRequestResponse.builder()
                .id(r.getId())
                .requestNumber(r.getRequestNumber())
                .entityType(r.getEntityType())
                .entityId(r.getEntityId())
                .requestType(r.getRequestType())
                .requestedBy(r.getRequestedBy())
                .workflowConfigId(r.getWorkflowConfigId())
                .status(r.getStatus())
                .currentStep(r.getCurrentStep())
                .currentStepName(stepName)
                .assignedTo(r.getAssignedTo())
                .assignedQueue(r.getAssignedQueue())
                .candidateAssignees(r.getCandidateAssignees())
                .assignmentError(r.getAssignmentError())
                .context(r.getContext())
                .reviewedBy(r.getReviewedBy())
                .reviewedAt(r.getReviewedAt())
                .reviewNotes(r.getReviewNotes())
                .approvedBy(r.getApprovedBy())
                .approvedAt(r.getApprovedAt())
                .rejectedBy(r.getRejectedBy())
                .rejectedAt(r.getRejectedAt())
                .rejectionReason(r.getRejectionReason())
                .cancelledBy(r.getCancelledBy())
                .cancelledAt(r.getCancelledAt())
                .cancellationReason(r.getCancellationReason())
                .version(r.getVersion())
                .createdAt(r.getCreatedAt())
                .updatedAt(r.getUpdatedAt())
                .build();
    }
}
