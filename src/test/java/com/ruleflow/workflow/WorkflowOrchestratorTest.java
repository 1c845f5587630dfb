package com.ruleflow.workflow;

import com.ruleflow.exception.AssignmentException;
import com.ruleflow.exception.ConflictException;
import com.ruleflow.exception.InvalidWorkflowException;
import com.ruleflow.expression.ExpressionCompiler;
import com.ruleflow.expression.ExpressionEvaluator;
import com.ruleflow.model.AssignmentRule;
import com.ruleflow.model.AssignmentType;
import com.ruleflow.model.EscalationTarget;
import com.ruleflow.model.EscalationTimer;
import com.ruleflow.model.EscalationType;
import com.ruleflow.model.OnboardingRequest;
import com.ruleflow.model.RequestStatus;
import com.ruleflow.model.StepType;
import com.ruleflow.model.WorkflowConfig;
import com.ruleflow.model.WorkflowConfigStatus;
import com.ruleflow.model.WorkflowStep;
import com.ruleflow.repository.OnboardingRequestRepository;
import com.ruleflow.repository.WorkflowConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * State machine tests. Step conditions run through the real expression
 * evaluator; storage, assignment, escalation and notification are mocked.
 */
@ExtendWith(MockitoExtension.class)
class WorkflowOrchestratorTest {

    private static final String TENANT = "acme";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock private WorkflowConfigRepository configRepository;
    @Mock private OnboardingRequestRepository requestRepository;
    @Mock private WorkflowSelector workflowSelector;
    @Mock private AssignmentResolver assignmentResolver;
    @Mock private EscalationScheduler escalationScheduler;
    @Mock private StageNotifier stageNotifier;

    private WorkflowOrchestrator orchestrator;
    private WorkflowConfig config;

    @BeforeEach
    void setUp() {
        orchestrator = new WorkflowOrchestrator(configRepository, requestRepository, workflowSelector,
                new StepConditionEvaluator(new ExpressionCompiler(), new ExpressionEvaluator()),
                assignmentResolver, escalationScheduler, stageNotifier,
                Clock.fixed(NOW, ZoneOffset.UTC));

        config = WorkflowConfig.builder()
                .id(UUID.randomUUID())
                .tenantId(TENANT)
                .name("Agent Onboarding")
                .status(WorkflowConfigStatus.ACTIVE)
                .steps(new ArrayList<>(List.of(
                        step(1, "Security Review", user("alice")),
                        step(2, "Compliance Review", user("bob")))))
                .build();
    }

    private static AssignmentRule user(String userId) {
        return AssignmentRule.builder().type(AssignmentType.USER).userId(userId).build();
    }

    private static WorkflowStep step(int number, String name, AssignmentRule rule) {
        return WorkflowStep.builder().stepNumber(number).stepName(name).assignmentRule(rule).build();
    }

    private OnboardingRequest requestOnStep(int step, RequestStatus status) {
        return OnboardingRequest.builder()
                .id(UUID.randomUUID())
                .tenantId(TENANT)
                .requestNumber("AI-1")
                .requestSequence(1)
                .entityType("agent")
                .entityId("agent-7")
                .workflowConfigId(config.getId())
                .status(status)
                .currentStep(step)
                .assignedTo("alice")
                .candidateAssignees(new ArrayList<>(List.of("alice")))
                .context(new HashMap<>(Map.of("risk_level", "high")))
                .version(3L)
                .build();
    }

    private void stubLoad(OnboardingRequest request) {
        when(requestRepository.findByIdAndTenantId(request.getId(), TENANT)).thenReturn(Optional.of(request));
    }

    private void stubConfig() {
        when(configRepository.findById(config.getId())).thenReturn(Optional.of(config));
    }

    private void stubSave() {
        when(requestRepository.saveAndFlush(any(OnboardingRequest.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private void stubAssign(String userId) {
        when(assignmentResolver.resolve(eq(TENANT), any())).thenReturn(Assignment.user(userId));
    }

    @Nested
    @DisplayName("Create")
    class Create {

        private WorkflowStart start(UUID configId) {
            return new WorkflowStart(TENANT, "agent", "agent-7", null, "intake",
                    configId, Map.of("risk_level", "high"));
        }

        private void stubPersistence(long maxSequence) {
            when(requestRepository.findMaxRequestSequence(TENANT)).thenReturn(maxSequence);
            when(requestRepository.save(any(OnboardingRequest.class))).thenAnswer(inv -> inv.getArgument(0));
            stubSave();
        }

        @Test
        @DisplayName("Numbers the request and enters step 1 with its assignee and escalation deadline")
        void entersFirstStep() {
            config.getSteps().get(0).getAssignmentRule().setTimeoutHours(24);
            when(configRepository.findByIdAndTenantId(config.getId(), TENANT)).thenReturn(Optional.of(config));
            stubPersistence(6L);
            stubAssign("alice");

            OnboardingRequest request = orchestrator.create(start(config.getId()));

            assertEquals("AI-7", request.getRequestNumber());
            assertEquals(7L, request.getRequestSequence());
            assertEquals(RequestStatus.PENDING, request.getStatus());
            assertEquals(1, request.getCurrentStep());
            assertEquals("alice", request.getAssignedTo());
            assertEquals("onboarding", request.getRequestType());
            verify(escalationScheduler).schedule(eq(request), eq(1), any(AssignmentRule.class), eq(NOW));
        }

        @Test
        @DisplayName("Without an explicit config the selector picks one")
        void selectsWorkflow() {
            when(workflowSelector.select(eq(TENANT), eq("agent"), anyMap())).thenReturn(Optional.of(config));
            stubPersistence(0L);
            stubAssign("alice");

            OnboardingRequest request = orchestrator.create(start(null));

            assertEquals(config.getId(), request.getWorkflowConfigId());
            assertEquals("AI-1", request.getRequestNumber());
        }

        @Test
        @DisplayName("No applicable workflow is rejected")
        void noWorkflow() {
            when(workflowSelector.select(eq(TENANT), eq("agent"), anyMap())).thenReturn(Optional.empty());

            assertThrows(InvalidWorkflowException.class, () -> orchestrator.create(start(null)));
            verify(requestRepository, never()).save(any());
        }

        @Test
        @DisplayName("An explicit config that is not ACTIVE is rejected")
        void inactiveConfig() {
            config.setStatus(WorkflowConfigStatus.DRAFT);
            when(configRepository.findByIdAndTenantId(config.getId(), TENANT)).thenReturn(Optional.of(config));

            assertThrows(InvalidWorkflowException.class, () -> orchestrator.create(start(config.getId())));
        }

        @Test
        @DisplayName("An optional step whose condition is false is skipped")
        void skipsOptionalStep() {
            WorkflowStep first = config.getSteps().get(0);
            first.setRequired(false);
            first.setConditions("risk_level == 'low'");
            when(configRepository.findByIdAndTenantId(config.getId(), TENANT)).thenReturn(Optional.of(config));
            stubPersistence(0L);
            stubAssign("bob");

            OnboardingRequest request = orchestrator.create(start(config.getId()));

            assertEquals(2, request.getCurrentStep());
            assertEquals("bob", request.getAssignedTo());
        }

        @Test
        @DisplayName("A failed assignment leaves the step pending and records the error")
        void assignmentFailure() {
            when(configRepository.findByIdAndTenantId(config.getId(), TENANT)).thenReturn(Optional.of(config));
            stubPersistence(0L);
            when(assignmentResolver.resolve(eq(TENANT), any())).thenThrow(new AssignmentException("Nobody holds role 'x'"));

            OnboardingRequest request = orchestrator.create(start(config.getId()));

            assertEquals(RequestStatus.PENDING, request.getStatus());
            assertEquals(1, request.getCurrentStep());
            assertNull(request.getAssignedTo());
            assertEquals("Nobody holds role 'x'", request.getAssignmentError());
        }

        @Test
        @DisplayName("Notification steps announce themselves and are passed through")
        void notificationStepPassesThrough() {
            config.getSteps().get(0).setStepType(StepType.NOTIFICATION);
            when(configRepository.findByIdAndTenantId(config.getId(), TENANT)).thenReturn(Optional.of(config));
            stubPersistence(0L);
            stubAssign("bob");

            OnboardingRequest request = orchestrator.create(start(config.getId()));

            verify(stageNotifier).stepEntered(any(OnboardingRequest.class), eq(config.getSteps().get(0)));
            assertEquals(2, request.getCurrentStep());
        }
    }

    @Nested
    @DisplayName("Approve")
    class Approve {

        @Test
        @DisplayName("Approving a middle step moves to the next one")
        void middleStep() {
            OnboardingRequest request = requestOnStep(1, RequestStatus.PENDING);
            stubLoad(request);
            stubConfig();
            stubSave();
            stubAssign("bob");

            OnboardingRequest result = orchestrator.approve(TENANT, request.getId(),
                    new StepDecision(1, "alice", "looks fine", null));

            assertEquals(RequestStatus.IN_REVIEW, result.getStatus());
            assertEquals(2, result.getCurrentStep());
            assertEquals("bob", result.getAssignedTo());
            assertEquals("alice", result.getReviewedBy());
            assertEquals("looks fine", result.getReviewNotes());
        }

        @Test
        @DisplayName("Approving the last step completes the request")
        void lastStep() {
            OnboardingRequest request = requestOnStep(2, RequestStatus.IN_REVIEW);
            stubLoad(request);
            stubConfig();
            stubSave();

            OnboardingRequest result = orchestrator.approve(TENANT, request.getId(), new StepDecision(2, "bob", null, 3L));

            assertEquals(RequestStatus.APPROVED, result.getStatus());
            assertEquals("bob", result.getApprovedBy());
            assertEquals(NOW, result.getApprovedAt());
            assertNull(result.getAssignedTo());
        }

        @Test
        @DisplayName("Approving a step the request is not on is a conflict")
        void wrongStep() {
            OnboardingRequest request = requestOnStep(2, RequestStatus.IN_REVIEW);
            stubLoad(request);

            assertThrows(ConflictException.class,
                    () -> orchestrator.approve(TENANT, request.getId(), new StepDecision(1, "alice", null, null)));
            verify(requestRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("A stale expected version is a conflict")
        void staleVersion() {
            OnboardingRequest request = requestOnStep(1, RequestStatus.PENDING);
            stubLoad(request);

            assertThrows(ConflictException.class,
                    () -> orchestrator.approve(TENANT, request.getId(), new StepDecision(1, "alice", null, 2L)));
        }

        @Test
        @DisplayName("Losing an optimistic-lock race surfaces as a conflict")
        void optimisticLockRace() {
            OnboardingRequest request = requestOnStep(1, RequestStatus.PENDING);
            stubLoad(request);
            stubConfig();
            stubAssign("bob");
            when(requestRepository.saveAndFlush(any(OnboardingRequest.class)))
                    .thenThrow(new ObjectOptimisticLockingFailureException(OnboardingRequest.class, request.getId()));

            assertThrows(ConflictException.class,
                    () -> orchestrator.approve(TENANT, request.getId(), new StepDecision(1, "alice", null, null)));
        }
    }

    @Nested
    @DisplayName("Advance, reject and cancel")
    class OtherTransitions {

        @Test
        @DisplayName("Advance skips a skippable step without approving it")
        void advanceSkippable() {
            config.getSteps().get(0).setCanSkip(true);
            OnboardingRequest request = requestOnStep(1, RequestStatus.PENDING);
            stubLoad(request);
            stubConfig();
            stubSave();
            stubAssign("bob");

            OnboardingRequest result = orchestrator.advance(TENANT, request.getId(), new StepDecision(1, "alice", null, null));

            assertEquals(2, result.getCurrentStep());
            assertEquals(RequestStatus.PENDING, result.getStatus());
            assertNull(result.getReviewedBy());
        }

        @Test
        @DisplayName("Advance on a step that cannot be skipped is a conflict")
        void advanceNotSkippable() {
            OnboardingRequest request = requestOnStep(1, RequestStatus.PENDING);
            stubLoad(request);
            stubConfig();

            assertThrows(ConflictException.class,
                    () -> orchestrator.advance(TENANT, request.getId(), new StepDecision(1, "alice", null, null)));
        }

        @Test
        @DisplayName("Reject freezes the request on the rejected step and enters nothing further")
        void reject() {
            OnboardingRequest request = requestOnStep(1, RequestStatus.PENDING);
            stubLoad(request);
            stubSave();

            OnboardingRequest result = orchestrator.reject(TENANT, request.getId(),
                    new StepDecision(1, "alice", "missing documents", null));

            assertEquals(RequestStatus.REJECTED, result.getStatus());
            assertEquals(1, result.getCurrentStep());
            assertEquals("missing documents", result.getRejectionReason());
            assertEquals("alice", result.getRejectedBy());
            verifyNoInteractions(assignmentResolver, escalationScheduler);
        }

        @Test
        @DisplayName("A rejected request accepts no further approvals")
        void noApproveAfterReject() {
            OnboardingRequest request = requestOnStep(1, RequestStatus.REJECTED);
            stubLoad(request);

            assertThrows(ConflictException.class,
                    () -> orchestrator.approve(TENANT, request.getId(), new StepDecision(1, "alice", null, null)));
        }

        @Test
        @DisplayName("Cancel works from any open state")
        void cancel() {
            OnboardingRequest request = requestOnStep(2, RequestStatus.IN_REVIEW);
            stubLoad(request);
            stubSave();

            OnboardingRequest result = orchestrator.cancel(TENANT, request.getId(), "intake", "duplicate", null);

            assertEquals(RequestStatus.CANCELLED, result.getStatus());
            assertEquals("duplicate", result.getCancellationReason());
        }

        @Test
        @DisplayName("Cancelling a finished request is a conflict")
        void cancelTerminal() {
            OnboardingRequest request = requestOnStep(2, RequestStatus.APPROVED);
            stubLoad(request);

            assertThrows(ConflictException.class,
                    () -> orchestrator.cancel(TENANT, request.getId(), "intake", null, null));
        }
    }

    @Nested
    @DisplayName("Escalate")
    class Escalate {

        private EscalationTimer timer(int step) {
            return EscalationTimer.builder().id(UUID.randomUUID()).stepNumber(step).deadline(NOW).build();
        }

        private void escalateTo(EscalationTarget target) {
            config.getSteps().get(0).getAssignmentRule().setTimeoutHours(24);
            config.getSteps().get(0).getAssignmentRule().setEscalateTo(target);
        }

        @Test
        @DisplayName("ADVANCE force-moves the request to the next step")
        void advance() {
            escalateTo(EscalationTarget.builder().type(EscalationType.ADVANCE).build());
            OnboardingRequest request = requestOnStep(1, RequestStatus.PENDING);
            stubConfig();
            stubSave();
            stubAssign("bob");

            String outcome = orchestrator.escalate(request, timer(1));

            assertEquals("advanced to step 2", outcome);
            assertEquals(2, request.getCurrentStep());
            assertEquals("bob", request.getAssignedTo());
            verify(stageNotifier).escalated(request, 1, outcome);
        }

        @Test
        @DisplayName("ADVANCE on the last step completes the request as the escalation actor")
        void advanceCompletes() {
            config.getSteps().get(1).setAssignmentRule(AssignmentRule.builder()
                    .type(AssignmentType.USER).userId("bob").timeoutHours(24)
                    .escalateTo(EscalationTarget.builder().type(EscalationType.ADVANCE).build())
                    .build());
            OnboardingRequest request = requestOnStep(2, RequestStatus.IN_REVIEW);
            stubConfig();
            stubSave();

            String outcome = orchestrator.escalate(request, timer(2));

            assertEquals("advanced: request approved", outcome);
            assertEquals(RequestStatus.APPROVED, request.getStatus());
            assertEquals(WorkflowOrchestrator.ESCALATION_ACTOR, request.getApprovedBy());
        }

        @Test
        @DisplayName("A reassigning target replaces the assignee")
        void reassign() {
            escalateTo(EscalationTarget.builder().type(EscalationType.ROLE).role("tenant_admin").build());
            OnboardingRequest request = requestOnStep(1, RequestStatus.PENDING);
            stubConfig();
            stubSave();
            when(assignmentResolver.resolve(eq(TENANT), argThat(r -> r.getType() == AssignmentType.ROLE)))
                    .thenReturn(Assignment.queue("role:tenant_admin", List.of("carol", "dave")));

            String outcome = orchestrator.escalate(request, timer(1));

            assertEquals("reassigned to role:tenant_admin", outcome);
            assertNull(request.getAssignedTo());
            assertEquals("role:tenant_admin", request.getAssignedQueue());
            assertEquals(List.of("carol", "dave"), request.getCandidateAssignees());
        }

        @Test
        @DisplayName("A failed reassignment keeps the current assignee and records the error")
        void reassignFails() {
            escalateTo(EscalationTarget.builder().type(EscalationType.ROLE).role("nobody").build());
            OnboardingRequest request = requestOnStep(1, RequestStatus.PENDING);
            stubConfig();
            stubSave();
            when(assignmentResolver.resolve(eq(TENANT), any())).thenThrow(new AssignmentException("Nobody holds role 'nobody'"));

            String outcome = orchestrator.escalate(request, timer(1));

            assertTrue(outcome.startsWith("reassignment failed"));
            assertEquals("alice", request.getAssignedTo());
            assertEquals("Nobody holds role 'nobody'", request.getAssignmentError());
        }

        @Test
        @DisplayName("Without a target the escalation only notifies")
        void notifyOnly() {
            OnboardingRequest request = requestOnStep(1, RequestStatus.PENDING);
            stubConfig();
            stubSave();

            assertEquals("notified", orchestrator.escalate(request, timer(1)));
            assertEquals("alice", request.getAssignedTo());
            verifyNoInteractions(assignmentResolver);
        }

        @Test
        @DisplayName("A request that moved on or finished is left alone")
        void movedOn() {
            OnboardingRequest request = requestOnStep(2, RequestStatus.IN_REVIEW);

            String outcome = orchestrator.escalate(request, timer(1));

            assertTrue(outcome.startsWith("skipped"));
            verifyNoInteractions(requestRepository, stageNotifier);
        }
    }
}
