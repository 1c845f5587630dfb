package com.ruleflow.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Keeps an evaluation event from being evaluated twice, using Redis.
 *
 * HOW IT WORKS:
 *   1. When an event arrives, call isDuplicate(tenantId, eventId)
 *   2. This tries to SET "ruleflow:dedup:{tenantId}:{eventId}" with NX
 *      (NX = only set if the key does NOT exist)
 *   3. SET succeeds → first delivery, return false
 *   4. SET fails    → already seen, return true
 *
 * SET NX is atomic across instances, and keys expire after 24 hours.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeduplicationService {

    private final StringRedisTemplate redisTemplate;

    private static final String DEDUP_PREFIX = "ruleflow:dedup:";
    private static final Duration DEDUP_TTL = Duration.ofHours(24);

    /**
     * Returns true if duplicate (already seen), false if new.
     */
    public boolean isDuplicate(String tenantId, String eventId) {
        if (eventId == null || eventId.isBlank()) {
            return false; // No eventId = can't dedup, evaluate anyway
        }

        Boolean wasSet = redisTemplate.opsForValue()
                .setIfAbsent(key(tenantId, eventId), "1", DEDUP_TTL);

        if (Boolean.TRUE.equals(wasSet)) {
            return false;
        }
        log.warn("Duplicate evaluation event detected: tenant={}, eventId={}", tenantId, eventId);
        return true;
    }

    /**
     * Forget an event so a redelivery is evaluated again. Used when evaluation
     * failed after the key was set.
     */
    public void clearDedup(String tenantId, String eventId) {
        if (eventId == null || eventId.isBlank()) {
            return;
        }
        redisTemplate.delete(key(tenantId, eventId));
        log.info("Cleared dedup key: tenant={}, eventId={}", tenantId, eventId);
    }

    private static String key(String tenantId, String eventId) {
        return DEDUP_PREFIX + (tenantId == null ? "" : tenantId) + ":" + eventId;
    }
}
