package com.ruleflow.engine.action;

import com.ruleflow.action.CustomAction;
import com.ruleflow.exception.DispatchException;
import com.ruleflow.expression.Expression;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handles actions outside the built-in capabilities.
 *
 * Without a {@code url} parameter the action is only recorded; the caller
 * reads it from the executed outcomes (e.g. {@code require_additional_approval}).
 * With one, the action is POSTed to that webhook:
 *   {"action": "...", "ruleId": "...", "entityType": "...", "entityId": "...", "parameters": {...}}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustomActionHandler implements ActionHandler<CustomAction> {

    static final String URL_PARAMETER = "url";

    private final RestTemplate restTemplate;

    @Override
    public Class<CustomAction> actionClass() {
        return CustomAction.class;
    }

    @Override
    public String handle(CustomAction action, ActionContext context) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (Map.Entry<String, Expression> entry : action.parameters().entrySet()) {
            parameters.put(entry.getKey(), context.resolve(entry.getValue()));
        }

        Object url = parameters.remove(URL_PARAMETER);
        if (url == null) {
            log.info("Custom action recorded: {} (rule={})", action.name(), context.ruleId());
            return "Recorded " + action.name();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Tenant-Id", context.tenantId());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("action", action.name());
        body.put("ruleId", context.ruleId());
        body.put("entityType", context.entityType());
        body.put("entityId", context.entityId());
        body.put("parameters", parameters);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    url.toString(), new HttpEntity<>(body, headers), String.class);
            log.info("Dispatched WEBHOOK → url={}, action={}, status={}", url, action.name(), response.getStatusCode());
            return "Webhook " + url + " returned " + response.getStatusCode().value();
        } catch (RestClientException e) {
            log.error("WEBHOOK dispatch failed: {}", e.getMessage(), e);
            throw new DispatchException("Webhook dispatch failed", e);
        }
    }
}
