package com.ruleflow.repository;

import com.ruleflow.model.BusinessRule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Database access for BusinessRule entities.
 *
 * findByTenantIdAndActiveTrue("acme")
 * → SELECT * FROM business_rules WHERE tenant_id = ? AND active = true
 *
 * Ordering and entity/screen filtering happen in {@link com.ruleflow.engine.RuleMatcher},
 * so the matcher sees the same order whatever the database returns.
 */
public interface BusinessRuleRepository extends JpaRepository<BusinessRule, UUID> {

    List<BusinessRule> findByTenantIdAndActiveTrue(String tenantId);

    List<BusinessRule> findByTenantIdOrderByPriorityAscRuleIdAsc(String tenantId);

    Optional<BusinessRule> findByIdAndTenantId(UUID id, String tenantId);

    boolean existsByTenantIdAndRuleId(String tenantId, String ruleId);
}
