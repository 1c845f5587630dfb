package com.ruleflow.engine.action;

import com.ruleflow.action.FieldMutation;
import com.ruleflow.collaborator.EntityFieldMutator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FieldMutationHandler implements ActionHandler<FieldMutation> {

    private final EntityFieldMutator mutator;

    @Override
    public Class<FieldMutation> actionClass() {
        return FieldMutation.class;
    }

    @Override
    public String handle(FieldMutation action, ActionContext context) {
        Object value = context.resolve(action.value());
        mutator.setField(context.tenantId(), context.entityType(), context.entityId(), action.field(), value);
        return "Set " + action.field() + " = " + value;
    }
}
