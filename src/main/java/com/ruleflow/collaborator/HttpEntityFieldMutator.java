package com.ruleflow.collaborator;

import com.ruleflow.config.RuleflowProperties;
import com.ruleflow.exception.DispatchException;
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
 * Sends field mutations to the entity service:
 *
 *   POST {entityServiceUrl}/api/entities/{entityType}/{entityId}/fields
 *   X-Tenant-Id: acme
 *   {"field": "status", "value": "approved"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpEntityFieldMutator implements EntityFieldMutator {

    private final RestTemplate restTemplate;
    private final RuleflowProperties properties;

    @Override
    public void setField(String tenantId, String entityType, String entityId, String field, Object value) {
        String baseUrl = properties.getCollaborators().getEntityServiceUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new DispatchException("No entity service configured (ruleflow.collaborators.entity-service-url)");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new DispatchException("Cannot set field '" + field + "' without an entity id");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Tenant-Id", tenantId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("field", field);
        body.put("value", value);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + "/api/entities/{type}/{id}/fields",
                    new HttpEntity<>(body, headers), String.class, entityType, entityId);
            log.info("Field mutation sent → {}/{} {}={}, status={}",
                    entityType, entityId, field, value, response.getStatusCode());
        } catch (RestClientException e) {
            log.error("Field mutation failed for {}/{}: {}", entityType, entityId, e.getMessage(), e);
            throw new DispatchException("Field mutation failed", e);
        }
    }
}
