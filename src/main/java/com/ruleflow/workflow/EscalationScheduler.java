package com.ruleflow.workflow;

import com.ruleflow.model.AssignmentRule;
import com.ruleflow.model.EscalationTimer;
import com.ruleflow.model.OnboardingRequest;
import com.ruleflow.repository.EscalationTimerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Persists the escalation deadline of a step when its assignment rule declares
 * {@code timeoutHours}. At most one timer exists per (request, step): re-entering
 * a step never reschedules it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EscalationScheduler {

    private final EscalationTimerRepository timerRepository;

    public Optional<EscalationTimer> schedule(OnboardingRequest request, int stepNumber, AssignmentRule rule, Instant now) {
        if (rule == null || rule.getTimeoutHours() == null || rule.getTimeoutHours() <= 0) {
            return Optional.empty();
        }
        if (timerRepository.existsByRequestIdAndStepNumber(request.getId(), stepNumber)) {
            log.debug("Escalation already scheduled: request={}, step={}", request.getRequestNumber(), stepNumber);
            return Optional.empty();
        }

        EscalationTimer timer = timerRepository.save(EscalationTimer.builder()
                .requestId(request.getId())
                .stepNumber(stepNumber)
                .deadline(now.plus(Duration.ofHours(rule.getTimeoutHours())))
                .createdAt(now)
                .build());
        log.info("Escalation scheduled: request={}, step={}, deadline={}",
                request.getRequestNumber(), stepNumber, timer.getDeadline());
        return Optional.of(timer);
    }
}
