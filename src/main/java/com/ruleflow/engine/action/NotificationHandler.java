package com.ruleflow.engine.action;

import com.ruleflow.action.SendNotification;
import com.ruleflow.collaborator.Notification;
import com.ruleflow.collaborator.NotificationDispatcher;
import com.ruleflow.exception.DispatchException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class NotificationHandler implements ActionHandler<SendNotification> {

    private final NotificationDispatcher dispatcher;

    @Override
    public Class<SendNotification> actionClass() {
        return SendNotification.class;
    }

    @Override
    public String handle(SendNotification action, ActionContext context) {
        String recipient = context.resolveString(action.recipient());
        if (recipient == null || recipient.isBlank()) {
            throw new DispatchException("Notification recipient resolved to nothing");
        }
        String subject = action.subject() != null
                ? context.resolveString(action.subject())
                : "Rule '" + context.ruleName() + "' matched";
        String message = action.message() != null
                ? context.resolveString(action.message())
                : "Rule " + context.ruleId() + " matched " + context.entityType()
                        + (context.entityId() != null ? " " + context.entityId() : "");

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("entityType", context.entityType());
        attributes.put("entityId", context.entityId());

        dispatcher.dispatch(Notification.builder()
                .tenantId(context.tenantId())
                .recipient(recipient)
                .subject(subject)
                .message(message)
                .source("rule")
                .reference(context.ruleId())
                .attributes(attributes)
                .build());
        return "Notified " + recipient;
    }
}
