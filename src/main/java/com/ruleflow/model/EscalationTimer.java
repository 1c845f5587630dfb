package com.ruleflow.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted escalation deadline for one step of one request.
 * Created at most once per (request, step) and fired at most once; the
 * {@code fired} flag is only ever set through
 * {@link com.ruleflow.repository.EscalationTimerRepository#markFired}.
 */
@Entity
@Table(name = "escalation_timers", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"request_id", "step_number"})
}, indexes = {
    @Index(name = "idx_timers_due", columnList = "fired, deadline")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EscalationTimer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "request_id", nullable = false)
    private UUID requestId;

    @Column(name = "step_number", nullable = false)
    private int stepNumber;

    @Column(nullable = false)
    private Instant deadline;

    @Column(nullable = false)
    @Builder.Default
    private boolean fired = false;

    @Column(name = "fired_at")
    private Instant firedAt;

    @Column(columnDefinition = "TEXT")
    private String outcome;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();
}
