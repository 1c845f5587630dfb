package com.ruleflow.engine.action;

import com.ruleflow.action.TriggerWorkflow;
import com.ruleflow.exception.DispatchException;
import com.ruleflow.model.OnboardingRequest;
import com.ruleflow.workflow.WorkflowOrchestrator;
import com.ruleflow.workflow.WorkflowStart;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Starts an approval workflow for the evaluated entity, bound to the evaluation context.
 */
@Component
@RequiredArgsConstructor
public class WorkflowTriggerHandler implements ActionHandler<TriggerWorkflow> {

    private final WorkflowOrchestrator orchestrator;

    @Override
    public Class<TriggerWorkflow> actionClass() {
        return TriggerWorkflow.class;
    }

    @Override
    public String handle(TriggerWorkflow action, ActionContext context) {
        WorkflowStart start = new WorkflowStart(
                context.tenantId(),
                context.entityType(),
                context.entityId(),
                context.resolveString(action.requestType()),
                context.requestedBy(),
                parseConfigId(context.resolveString(action.workflowConfigId())),
                context.context());

        OnboardingRequest request = orchestrator.create(start);
        return "Started " + request.getRequestNumber() + " (" + request.getStatus() + ")";
    }

    private UUID parseConfigId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new DispatchException("Invalid workflow config id: " + value, e);
        }
    }
}
