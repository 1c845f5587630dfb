package com.ruleflow.repository;

import com.ruleflow.model.EscalationTimer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class EscalationTimerRepositoryTest {

    private static final Instant DEADLINE = Instant.parse("2026-01-05T09:00:00Z");

    @Autowired private TestEntityManager entityManager;
    @Autowired private EscalationTimerRepository repository;

    private EscalationTimer persistTimer(UUID requestId, int stepNumber) {
        return entityManager.persistAndFlush(EscalationTimer.builder()
                .requestId(requestId)
                .stepNumber(stepNumber)
                .deadline(DEADLINE)
                .build());
    }

    @Test
    @DisplayName("markFired claims a timer exactly once")
    void markFired_claimsOnce() {
        EscalationTimer timer = persistTimer(UUID.randomUUID(), 1);
        Instant firedAt = DEADLINE.plusSeconds(60);

        assertEquals(1, repository.markFired(timer.getId(), firedAt));
        assertEquals(0, repository.markFired(timer.getId(), firedAt.plusSeconds(60)));

        entityManager.clear();
        EscalationTimer reloaded = repository.findById(timer.getId()).orElseThrow();
        assertTrue(reloaded.isFired());
        assertEquals(firedAt, reloaded.getFiredAt());
    }

    @Test
    @DisplayName("A second timer for the same request step is rejected")
    void duplicateTimer_isRejected() {
        UUID requestId = UUID.randomUUID();
        persistTimer(requestId, 1);

        assertTrue(repository.existsByRequestIdAndStepNumber(requestId, 1));
        assertFalse(repository.existsByRequestIdAndStepNumber(requestId, 2));
        assertThrows(DataIntegrityViolationException.class, () -> repository.saveAndFlush(EscalationTimer.builder()
                .requestId(requestId)
                .stepNumber(1)
                .deadline(DEADLINE)
                .build()));
    }
}
