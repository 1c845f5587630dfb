package com.ruleflow.workflow;

import com.ruleflow.collaborator.Notification;
import com.ruleflow.collaborator.NotificationDispatcher;
import com.ruleflow.collaborator.UserDirectory;
import com.ruleflow.exception.DispatchException;
import com.ruleflow.model.OnboardingRequest;
import com.ruleflow.model.StageSettings;
import com.ruleflow.model.StepType;
import com.ruleflow.model.WorkflowStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Publishes workflow notifications: step entry (when the stage asks for it),
 * NOTIFICATION steps and escalations.
 *
 * Recipients configured on a stage may be:
 *   "requester"               → the user who created the request
 *   "assignee"                → the step's assignee, or every queue candidate
 *   an address containing "@" → used as-is
 *   anything else             → a role, expanded through the user directory
 * With no configured recipients the step's assignee (or queue candidates) is notified,
 * or the requester for a NOTIFICATION step.
 *
 * Notification failures never block a transition; they are logged and dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StageNotifier {

    private final NotificationDispatcher dispatcher;
    private final UserDirectory userDirectory;

    public void stepEntered(OnboardingRequest request, WorkflowStep step) {
        String subject = request.getRequestNumber() + ": " + step.getStepName();
        String message = "Request " + request.getRequestNumber() + " for " + request.getEntityType()
                + " " + nullToEmpty(request.getEntityId()) + " entered step " + step.getStepNumber()
                + " (" + step.getStepName() + ")";
        Set<String> recipients = recipients(request, step.getStageSettings());
        if (recipients.isEmpty() && step.getStepType() == StepType.NOTIFICATION && request.getRequestedBy() != null) {
            recipients.add(request.getRequestedBy());
        }
        publish(request, recipients, subject, message, "workflow",
                Map.of("step", step.getStepNumber(), "stepType", step.getStepType().name()));
    }

    public void escalated(OnboardingRequest request, int stepNumber, String outcome) {
        String subject = request.getRequestNumber() + ": step " + stepNumber + " escalated";
        String message = "Step " + stepNumber + " of request " + request.getRequestNumber()
                + " passed its deadline: " + outcome;
        publish(request, recipients(request, null), subject, message, "escalation", Map.of("step", stepNumber));
    }

    Set<String> recipients(OnboardingRequest request, StageSettings settings) {
        Set<String> resolved = new LinkedHashSet<>();
        List<String> configured = settings != null && settings.getEmailNotifications() != null
                ? settings.getEmailNotifications().getRecipients()
                : null;

        if (configured == null || configured.isEmpty()) {
            addAssignee(request, resolved);
            return resolved;
        }
        for (String recipient : configured) {
            if ("requester".equals(recipient) || "user".equals(recipient)) {
                if (request.getRequestedBy() != null) {
                    resolved.add(request.getRequestedBy());
                }
            } else if ("assignee".equals(recipient) || "next_approver".equals(recipient)) {
                addAssignee(request, resolved);
            } else if (recipient.contains("@")) {
                resolved.add(recipient);
            } else {
                resolved.addAll(userDirectory.findUsersByRole(request.getTenantId(), recipient));
            }
        }
        return resolved;
    }

    private void addAssignee(OnboardingRequest request, Set<String> resolved) {
        if (request.getAssignedTo() != null) {
            resolved.add(request.getAssignedTo());
        } else if (request.getCandidateAssignees() != null) {
            resolved.addAll(request.getCandidateAssignees());
        }
    }

    private void publish(OnboardingRequest request, Set<String> recipients, String subject, String message,
                         String source, Map<String, Object> extra) {
        if (recipients.isEmpty()) {
            log.debug("No recipients for {} notification on {}", source, request.getRequestNumber());
            return;
        }
        Map<String, Object> attributes = new LinkedHashMap<>(extra);
        attributes.put("requestId", String.valueOf(request.getId()));
        attributes.put("status", request.getStatus().name());

        for (String recipient : recipients) {
            try {
                dispatcher.dispatch(Notification.builder()
                        .tenantId(request.getTenantId())
                        .recipient(recipient)
                        .subject(subject)
                        .message(message)
                        .source(source)
                        .reference(request.getRequestNumber())
                        .attributes(attributes)
                        .build());
            } catch (DispatchException e) {
                log.warn("Could not notify {} about {}: {}", recipient, request.getRequestNumber(), e.getMessage());
            }
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
