package com.ruleflow.action;

import com.ruleflow.expression.Expression;

import java.util.LinkedHashMap;
import java.util.Map;

public record SendNotification(String name, Expression recipient, Expression subject, Expression message)
        implements Action {

    @Override
    public ActionType type() {
        return ActionType.SEND_NOTIFICATION;
    }

    @Override
    public Map<String, Expression> parameters() {
        Map<String, Expression> params = new LinkedHashMap<>();
        params.put("recipient", recipient);
        if (subject != null) {
            params.put("subject", subject);
        }
        if (message != null) {
            params.put("message", message);
        }
        return params;
    }
}
