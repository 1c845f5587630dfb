package com.ruleflow.workflow;

import com.ruleflow.model.EscalationTimer;
import com.ruleflow.model.OnboardingRequest;
import com.ruleflow.repository.EscalationTimerRepository;
import com.ruleflow.repository.OnboardingRequestRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Fires one escalation timer in its own transaction.
 *
 * The first statement claims the timer:
 *   UPDATE escalation_timers SET fired = true WHERE id = ? AND fired = false
 * Only the caller whose update changed the row goes on to escalate, so two
 * sweepers (or two instances) racing on the same timer fire it once. If the
 * escalation itself fails the transaction rolls back, the claim with it, and
 * the next sweep tries again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscalationService {

    private final EscalationTimerRepository timerRepository;
    private final OnboardingRequestRepository requestRepository;
    private final WorkflowOrchestrator orchestrator;
    private final Clock clock;

    /**
     * @return true if this call fired the timer, false if it was already fired
     */
    @Transactional
    public boolean fire(UUID timerId) {
        Instant now = Instant.now(clock);
        if (timerRepository.markFired(timerId, now) != 1) {
            log.debug("Escalation timer {} already fired elsewhere", timerId);
            return false;
        }

        EscalationTimer timer = timerRepository.findById(timerId)
                .orElseThrow(() -> new EntityNotFoundException("Escalation timer not found: " + timerId));
        Optional<OnboardingRequest> request = requestRepository.findById(timer.getRequestId());

        String outcome = request
                .map(r -> orchestrator.escalate(r, timer))
                .orElse("skipped: request no longer exists");

        timer.setFired(true);
        timer.setFiredAt(now);
        timer.setOutcome(outcome);
        timerRepository.save(timer);
        return true;
    }
}
