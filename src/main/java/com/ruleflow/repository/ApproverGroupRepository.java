package com.ruleflow.repository;

import com.ruleflow.model.ApproverGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Database access for ApproverGroup entities.
 *
 * The round-robin cursor is never written through the entity. It is read with
 * {@link #findRotationCursor} and moved with the compare-and-swap
 * {@link #advanceCursor}, which updates the row only if nobody advanced it since the read:
 *
 *   UPDATE approver_groups SET rotation_cursor = rotation_cursor + 1
 *   WHERE id = ? AND rotation_cursor = ?
 */
public interface ApproverGroupRepository extends JpaRepository<ApproverGroup, UUID> {

    List<ApproverGroup> findByTenantIdOrderByNameAsc(String tenantId);

    Optional<ApproverGroup> findByIdAndTenantId(UUID id, String tenantId);

    @Query("SELECT g.rotationCursor FROM ApproverGroup g WHERE g.id = :id")
    Optional<Long> findRotationCursor(@Param("id") UUID id);

    /**
     * @return 1 if this caller won the slot at {@code expected}, 0 if another caller got there first
     */
    @Transactional
    @Modifying
    @Query("UPDATE ApproverGroup g SET g.rotationCursor = g.rotationCursor + 1 " +
            "WHERE g.id = :id AND g.rotationCursor = :expected")
    int advanceCursor(@Param("id") UUID id, @Param("expected") long expected);
}
