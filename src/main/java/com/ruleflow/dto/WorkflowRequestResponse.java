package com.ruleflow.dto;

import com.ruleflow.model.RequestStatus;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowRequestResponse {
    private UUID id;
    private String requestNumber;
    private String entityType;
    private String entityId;
    private String requestType;
    private String requestedBy;
    private UUID workflowConfigId;
    private RequestStatus status;
    private int currentStep;
    private String currentStepName;
    private String assignedTo;
    private String assignedQueue;
    private List<String> candidateAssignees;
    private String assignmentError;
    private Map<String, Object> context;
    private String reviewedBy;
    private Instant reviewedAt;
    private String reviewNotes;
    private String approvedBy;
    private Instant approvedAt;
    private String rejectedBy;
    private Instant rejectedAt;
    private String rejectionReason;
    private String cancelledBy;
    private Instant cancelledAt;
    private String cancellationReason;
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;
}
