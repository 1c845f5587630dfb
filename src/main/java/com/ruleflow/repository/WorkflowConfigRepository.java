package com.ruleflow.repository;

import com.ruleflow.model.WorkflowConfig;
import com.ruleflow.model.WorkflowConfigStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowConfigRepository extends JpaRepository<WorkflowConfig, UUID> {

    List<WorkflowConfig> findByTenantIdOrderByCreatedAtAsc(String tenantId);

    List<WorkflowConfig> findByTenantIdAndStatus(String tenantId, WorkflowConfigStatus status);

    Optional<WorkflowConfig> findByIdAndTenantId(UUID id, String tenantId);

    Optional<WorkflowConfig> findFirstByTenantIdAndStatusAndDefaultConfigTrue(String tenantId, WorkflowConfigStatus status);

    // Used when a config is saved as the default: every other default of the tenant is demoted
    List<WorkflowConfig> findByTenantIdAndDefaultConfigTrueAndIdNot(String tenantId, UUID id);

    List<WorkflowConfig> findByTenantIdAndDefaultConfigTrue(String tenantId);
}
