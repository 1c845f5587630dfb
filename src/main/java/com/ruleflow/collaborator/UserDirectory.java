package com.ruleflow.collaborator;

import java.util.List;

/**
 * Resolves role membership for role-based assignment.
 */
public interface UserDirectory {

    /**
     * Users holding {@code role} in {@code tenantId}, in a stable order.
     * Returns an empty list when nobody holds the role.
     */
    List<String> findUsersByRole(String tenantId, String role);
}
