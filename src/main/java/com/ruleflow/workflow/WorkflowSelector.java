package com.ruleflow.workflow;

import com.ruleflow.model.WorkflowConditions;
import com.ruleflow.model.WorkflowConfig;
import com.ruleflow.model.WorkflowConfigStatus;
import com.ruleflow.repository.WorkflowConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the workflow configuration for a new request when the caller names none.
 *
 * FLOW:
 *   1. Take the tenant's ACTIVE configurations that declare selection criteria
 *      (conditions and/or triggerRules)
 *   2. Keep those whose criteria match the entity data
 *   3. Return the one with the lowest conditions.priority (unset sorts last)
 *   4. Nothing matched → the tenant's ACTIVE default configuration
 *
 * Criteria (each checked only when set):
 *   entityTypes → must contain the entity type (always required)
 *   agentTypes  → data "type" or "agent_type"
 *   riskLevels  → data "risk_level", or numeric "risk_score" mapped to a level
 *   categories  → data "category"
 * With matchAll=true every checked criterion must match, otherwise any one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowSelector {

    private static final Comparator<WorkflowConfig> SELECTION_ORDER = Comparator
            .comparing((WorkflowConfig c) -> priorityOf(c), Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(WorkflowConfig::getCreatedAt);

    private final WorkflowConfigRepository configRepository;

    public Optional<WorkflowConfig> select(String tenantId, String entityType, Map<String, Object> entityData) {
        List<WorkflowConfig> active = configRepository.findByTenantIdAndStatus(tenantId, WorkflowConfigStatus.ACTIVE);

        Optional<WorkflowConfig> matched = active.stream()
                .filter(c -> hasCriteria(c.getConditions()) || hasCriteria(c.getTriggerRules()))
                .filter(c -> matches(c.getConditions(), entityType, entityData)
                        && matches(c.getTriggerRules(), entityType, entityData))
                .min(SELECTION_ORDER);

        if (matched.isPresent()) {
            log.info("Workflow selected by criteria: '{}' (id={}) for {}",
                    matched.get().getName(), matched.get().getId(), entityType);
            return matched;
        }

        Optional<WorkflowConfig> fallback = configRepository
                .findFirstByTenantIdAndStatusAndDefaultConfigTrue(tenantId, WorkflowConfigStatus.ACTIVE);
        fallback.ifPresent(c -> log.info("Workflow selected as tenant default: '{}' (id={})", c.getName(), c.getId()));
        return fallback;
    }

    boolean matches(WorkflowConditions criteria, String entityType, Map<String, Object> data) {
        if (criteria == null) {
            return true;
        }
        if (criteria.getEntityTypes() != null && !criteria.getEntityTypes().isEmpty()
                && !criteria.getEntityTypes().contains(entityType)) {
            return false;
        }

        List<Boolean> checks = new ArrayList<>();
        if (criteria.getAgentTypes() != null) {
            Object type = firstPresent(data, "type", "agent_type");
            checks.add(type != null && criteria.getAgentTypes().contains(type.toString()));
        }
        if (criteria.getRiskLevels() != null) {
            String level = riskLevel(data);
            checks.add(level != null && criteria.getRiskLevels().contains(level));
        }
        if (criteria.getCategories() != null) {
            Object category = data.get("category");
            checks.add(category != null && criteria.getCategories().contains(category.toString()));
        }

        if (checks.isEmpty()) {
            return true;
        }
        return criteria.isMatchAll()
                ? checks.stream().allMatch(Boolean::booleanValue)
                : checks.stream().anyMatch(Boolean::booleanValue);
    }

    static String riskLevel(Map<String, Object> data) {
        Object value = firstPresent(data, "risk_level", "risk_score");
        if (value instanceof Number score) {
            double s = score.doubleValue();
            if (s >= 80) {
                return "critical";
            } else if (s >= 60) {
                return "high";
            } else if (s >= 40) {
                return "medium";
            }
            return "low";
        }
        return value == null ? null : value.toString();
    }

    private static boolean hasCriteria(WorkflowConditions criteria) {
        return criteria != null
                && ((criteria.getEntityTypes() != null && !criteria.getEntityTypes().isEmpty())
                    || criteria.getAgentTypes() != null
                    || criteria.getRiskLevels() != null
                    || criteria.getCategories() != null);
    }

    private static Integer priorityOf(WorkflowConfig config) {
        return config.getConditions() == null ? null : config.getConditions().getPriority();
    }

    private static Object firstPresent(Map<String, Object> data, String... keys) {
        for (String key : keys) {
            Object value = data.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
