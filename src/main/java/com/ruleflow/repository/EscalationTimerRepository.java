package com.ruleflow.repository;

import com.ruleflow.model.EscalationTimer;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface EscalationTimerRepository extends JpaRepository<EscalationTimer, UUID> {

    boolean existsByRequestIdAndStepNumber(UUID requestId, int stepNumber);

    Optional<EscalationTimer> findByRequestIdAndStepNumber(UUID requestId, int stepNumber);

    List<EscalationTimer> findByRequestIdOrderByStepNumberAsc(UUID requestId);

    /**
     * Due, unfired timers. Rows locked by another sweeper are skipped
     * (lock timeout -2 = SKIP LOCKED in Hibernate 6). Must run inside a transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("SELECT t FROM EscalationTimer t WHERE t.fired = false AND t.deadline <= :now ORDER BY t.deadline")
    List<EscalationTimer> findDueWithLock(@Param("now") Instant now, Pageable pageable);

    /**
     * Claims a timer. Only the caller that flips {@code fired} gets 1 back
     * and may perform the escalation.
     */
    @Modifying
    @Query("UPDATE EscalationTimer t SET t.fired = true, t.firedAt = :now WHERE t.id = :id AND t.fired = false")
    int markFired(@Param("id") UUID id, @Param("now") Instant now);
}
