package com.ruleflow.workflow;

import com.ruleflow.config.RuleflowProperties;
import com.ruleflow.model.EscalationTimer;
import com.ruleflow.repository.EscalationTimerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Periodically fires due escalation timers.
 *
 * TWO PHASES:
 *   1. short transaction: SELECT due unfired timers FOR UPDATE SKIP LOCKED,
 *      so concurrent sweepers split the batch instead of queueing on it;
 *      the locks are released when this transaction commits
 *   2. per timer: {@link EscalationService#fire} in its own transaction, which
 *      claims the timer with a conditional update before escalating
 *
 * Timers are rows, not in-memory tasks: a restarted instance picks up whatever
 * came due while it was down. One failing timer does not stop the batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        name = "ruleflow.escalation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class EscalationSweeper {

    private final EscalationTimerRepository timerRepository;
    private final EscalationService escalationService;
    private final TransactionTemplate transactionTemplate;
    private final RuleflowProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${ruleflow.escalation.sweep-interval-ms:60000}")
    public void sweep() {
        Instant now = Instant.now(clock);
        List<UUID> due = transactionTemplate.execute(status -> timerRepository
                .findDueWithLock(now, PageRequest.of(0, properties.getEscalation().getBatchSize()))
                .stream()
                .map(EscalationTimer::getId)
                .toList());
        if (due == null || due.isEmpty()) {
            return;
        }

        log.info("Escalation sweep: {} due timer(s)", due.size());
        int fired = 0;
        for (UUID timerId : due) {
            try {
                if (escalationService.fire(timerId)) {
                    fired++;
                }
            } catch (RuntimeException e) {
                log.error("Escalation timer {} failed, will retry on next sweep: {}", timerId, e.getMessage(), e);
            }
        }
        log.info("Escalation sweep done: fired={}, skipped or failed={}", fired, due.size() - fired);
    }
}
