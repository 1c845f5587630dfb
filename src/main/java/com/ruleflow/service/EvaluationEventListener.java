package com.ruleflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruleflow.dto.EvaluationResponse;
import com.ruleflow.dto.IncomingEvaluationEvent;
import com.ruleflow.engine.BusinessRuleEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for evaluation requests on "ruleflow.evaluations".
 *
 * FLOW:
 *   External service publishes event → Kafka topic "ruleflow.evaluations"
 *                                          ↓
 *                                    Deserialize JSON → IncomingEvaluationEvent
 *                                          ↓
 *                                    Redis dedup on (tenantId, eventId)
 *                                          ↓
 *                                    BusinessRuleEngine.evaluate()
 *
 * Unparseable or invalid events, and events whose evaluation fails, go to the
 * dead-letter topic. A failed event's dedup key is cleared so a redelivery is
 * evaluated again. The consumer group "ruleflow-engine" spreads partitions
 * across instances.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EvaluationEventListener {

    private final BusinessRuleEngine engine;
    private final ObjectMapper objectMapper;
    private final DeduplicationService deduplicationService;
    private final DeadLetterQueueService deadLetterQueueService;

    @KafkaListener(topics = "${ruleflow.topics.evaluations:ruleflow.evaluations}", groupId = "ruleflow-engine")
    public void onEvent(String message) {
        IncomingEvaluationEvent event;
        try {
            event = objectMapper.readValue(message, IncomingEvaluationEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse evaluation event: {}", e.getMessage());
            deadLetterQueueService.sendRawToDlq(message, e.getOriginalMessage());
            return;
        }

        if (isBlank(event.getTenantId()) || isBlank(event.getEntityType())) {
            log.error("Evaluation event {} lacks tenantId or entityType", event.getEventId());
            deadLetterQueueService.sendToDlq(event, "tenantId and entityType are required");
            return;
        }

        if (deduplicationService.isDuplicate(event.getTenantId(), event.getEventId())) {
            log.info("Skipping duplicate evaluation event: {}", event.getEventId());
            return;
        }

        try {
            EvaluationResponse response = engine.evaluate(event.getTenantId(), event.getRequestedBy(), event.toRequest());
            log.info("Evaluation event {} processed: matched={}", event.getEventId(), response.getMatchedRules());
        } catch (RuntimeException e) {
            log.error("Failed to evaluate event {}: {}", event.getEventId(), e.getMessage(), e);
            deduplicationService.clearDedup(event.getTenantId(), event.getEventId());
            deadLetterQueueService.sendToDlq(event, e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
