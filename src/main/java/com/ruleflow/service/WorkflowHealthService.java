package com.ruleflow.service;

import com.ruleflow.dto.WorkflowHealthResponse;
import com.ruleflow.model.WorkflowConfig;
import com.ruleflow.model.WorkflowConfigStatus;
import com.ruleflow.repository.WorkflowConfigRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only consistency report over a tenant's workflow configurations.
 */
@Service
@RequiredArgsConstructor
public class WorkflowHealthService {

    private final WorkflowConfigRepository configRepository;

    @Transactional(readOnly = true)
    public WorkflowHealthResponse check(String tenantId) {
        List<WorkflowConfig> configs = configRepository.findByTenantIdOrderByCreatedAtAsc(tenantId);
        List<WorkflowConfig> active = configs.stream()
                .filter(c -> c.getStatus() == WorkflowConfigStatus.ACTIVE)
                .toList();
        Optional<WorkflowConfig> defaultConfig = active.stream().filter(WorkflowConfig::isDefaultConfig).findFirst();

        List<String> issues = new ArrayList<>();
        if (active.isEmpty()) {
            issues.add("No active workflow configuration");
        }
        if (defaultConfig.isEmpty()) {
            issues.add("No active default workflow configuration");
        }
        long defaults = configs.stream().filter(WorkflowConfig::isDefaultConfig).count();
        if (defaults > 1) {
            issues.add(defaults + " configurations are marked default");
        }
        for (WorkflowConfig config : configs) {
            if (config.getSteps().isEmpty()) {
                issues.add("Workflow '" + config.getName() + "' has no steps");
            } else if (!config.hasContiguousSteps()) {
                issues.add("Workflow '" + config.getName() + "' has non-contiguous step numbers");
            }
        }

        return WorkflowHealthResponse.builder()
                .hasDefault(defaultConfig.isPresent())
                .hasActive(!active.isEmpty())
                .workflowCount(configs.size())
                .activeCount(active.size())
                .defaultWorkflowId(defaultConfig.map(WorkflowConfig::getId).orElse(null))
                .defaultWorkflowName(defaultConfig.map(WorkflowConfig::getName).orElse(null))
                .defaultStepCount(defaultConfig.map(c -> c.getSteps().size()).orElse(0))
                .stepSequenceConsistent(defaultConfig.map(WorkflowConfig::hasContiguousSteps).orElse(false))
                .issues(issues)
                .build();
    }
}
