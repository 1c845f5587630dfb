package com.ruleflow.repository;

import com.ruleflow.model.OnboardingRequest;
import com.ruleflow.model.RequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface OnboardingRequestRepository extends JpaRepository<OnboardingRequest, UUID> {

    Optional<OnboardingRequest> findByIdAndTenantId(UUID id, String tenantId);

    List<OnboardingRequest> findByTenantIdOrderByCreatedAtDesc(String tenantId);

    List<OnboardingRequest> findByTenantIdAndStatusOrderByCreatedAtDesc(String tenantId, RequestStatus status);

    // Approver view: requests waiting on a given user
    List<OnboardingRequest> findByTenantIdAndStatusInAndAssignedToOrderByCreatedAtAsc(
            String tenantId, List<RequestStatus> statuses, String assignedTo);

    // Approver view: requests nobody has picked up yet
    List<OnboardingRequest> findByTenantIdAndStatusInAndAssignedToIsNullOrderByCreatedAtAsc(
            String tenantId, List<RequestStatus> statuses);

    long countByWorkflowConfigIdAndStatusIn(UUID workflowConfigId, List<RequestStatus> statuses);

    /**
     * Highest request sequence issued for the tenant, 0 if none.
     * Two concurrent creates may read the same value; the unique
     * (tenant_id, request_sequence) constraint rejects the loser.
     */
    @Query("SELECT COALESCE(MAX(r.requestSequence), 0) FROM OnboardingRequest r WHERE r.tenantId = :tenantId")
    long findMaxRequestSequence(@Param("tenantId") String tenantId);
}
