package com.ruleflow.collaborator;

/**
 * Writes a field on an entity owned by another service.
 */
public interface EntityFieldMutator {

    /**
     * @throws com.ruleflow.exception.DispatchException if the owning service rejects or cannot be reached
     */
    void setField(String tenantId, String entityType, String entityId, String field, Object value);
}
