package com.ruleflow.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A named, ordered set of approvers. {@code rotationCursor} counts round-robin
 * picks; it only ever moves forward, through
 * {@link com.ruleflow.repository.ApproverGroupRepository#advanceCursor}. Entity
 * updates leave the column out, so saving a stale copy cannot rewind it.
 */
@Entity
@Table(name = "approver_groups")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ApproverGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "approver_group_members", joinColumns = @JoinColumn(name = "group_id"))
    @OrderColumn(name = "position")
    @Column(name = "member_id", nullable = false)
    @Builder.Default
    private List<String> memberIds = new ArrayList<>();

    @Column(name = "rotation_cursor", nullable = false, updatable = false)
    @Builder.Default
    private long rotationCursor = 0L;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
