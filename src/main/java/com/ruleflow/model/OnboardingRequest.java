package com.ruleflow.model;

import com.ruleflow.model.converter.ContextMapConverter;
import com.ruleflow.model.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A running instance of a workflow configuration for one entity.
 *
 * Example:
 *   requestNumber = "AI-42"
 *   entityType    = "agent", entityId = "agent-7"
 *   status        = IN_REVIEW, currentStep = 2
 *   assignedQueue = "role:compliance_officer"
 *
 * {@code context} is the evaluation context bound at creation; step branch
 * conditions are evaluated against it. Concurrent transitions are serialized by
 * the optimistic {@code version}.
 */
@Entity
@Table(name = "onboarding_requests", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"tenant_id", "request_sequence"})
}, indexes = {
    @Index(name = "idx_requests_tenant_status", columnList = "tenant_id, status")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class OnboardingRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "request_number", nullable = false)
    private String requestNumber;

    @Column(name = "request_sequence", nullable = false)
    private long requestSequence;

    @Column(name = "entity_type", nullable = false)
    private String entityType;

    @Column(name = "entity_id")
    private String entityId;

    @Column(name = "request_type", nullable = false)
    private String requestType;

    @Column(name = "requested_by")
    private String requestedBy;

    @Column(name = "workflow_config_id", nullable = false)
    private UUID workflowConfigId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private RequestStatus status = RequestStatus.PENDING;

    @Column(name = "current_step", nullable = false)
    private int currentStep;

    @Column(name = "assigned_to")
    private String assignedTo;

    @Column(name = "assigned_queue")
    private String assignedQueue;

    @Convert(converter = StringListConverter.class)
    @Column(name = "candidate_assignees", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> candidateAssignees = new ArrayList<>();

    @Column(name = "assignment_error", columnDefinition = "TEXT")
    private String assignmentError;

    @Convert(converter = ContextMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> context = new HashMap<>();

    @Column(name = "reviewed_by")
    private String reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "review_notes", columnDefinition = "TEXT")
    private String reviewNotes;

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "rejected_by")
    private String rejectedBy;

    @Column(name = "rejected_at")
    private Instant rejectedAt;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "cancelled_by")
    private String cancelledBy;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "cancellation_reason", columnDefinition = "TEXT")
    private String cancellationReason;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Clear any previous assignee before the next step is resolved.
     */
    public void clearAssignment() {
        this.assignedTo = null;
        this.assignedQueue = null;
        this.candidateAssignees = new ArrayList<>();
        this.assignmentError = null;
    }
}
