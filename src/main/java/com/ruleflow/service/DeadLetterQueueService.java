package com.ruleflow.service;

import com.ruleflow.config.RuleflowProperties;
import com.ruleflow.dto.IncomingEvaluationEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Dead-letter handling for evaluation events that could not be processed.
 *
 * The event goes to {@code ruleflow.evaluations.dlq} with:
 *   - the original event (or the raw message if it did not parse)
 *   - the error message
 *   - a timestamp
 *
 * Nothing here throws: a failed DLQ publish is logged as CRITICAL, since the
 * listener has no further place to put the event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueueService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final RuleflowProperties properties;

    public void sendToDlq(IncomingEvaluationEvent event, String errorMessage) {
        try {
            Map<String, Object> dlqMessage = new HashMap<>();
            dlqMessage.put("originalEvent", event);
            dlqMessage.put("error", errorMessage);
            dlqMessage.put("timestamp", System.currentTimeMillis());

            String message = objectMapper.writeValueAsString(dlqMessage);
            kafkaTemplate.send(properties.getTopics().getEvaluationsDlq(), event.getEventId(), message);
            log.info("Evaluation event sent to DLQ: eventId={}, error={}", event.getEventId(), errorMessage);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to send evaluation event to DLQ: {}", e.getMessage(), e);
        }
    }

    public void sendRawToDlq(String rawMessage, String errorMessage) {
        try {
            Map<String, Object> dlqMessage = new HashMap<>();
            dlqMessage.put("rawMessage", rawMessage);
            dlqMessage.put("error", errorMessage);
            dlqMessage.put("timestamp", System.currentTimeMillis());

            String message = objectMapper.writeValueAsString(dlqMessage);
            kafkaTemplate.send(properties.getTopics().getEvaluationsDlq(), message);
            log.info("Unparseable evaluation event sent to DLQ: error={}", errorMessage);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to send raw event to DLQ: {}", e.getMessage(), e);
        }
    }
}
