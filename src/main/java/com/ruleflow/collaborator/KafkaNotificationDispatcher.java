package com.ruleflow.collaborator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruleflow.config.RuleflowProperties;
import com.ruleflow.exception.DispatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes notifications to the {@code ruleflow.notifications} topic, keyed by tenant.
 * Sends are synchronous with a bounded wait so a broker outage surfaces as a
 * failed action instead of a silently dropped message.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KafkaNotificationDispatcher implements NotificationDispatcher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final RuleflowProperties properties;

    @Override
    public void dispatch(Notification notification) {
        String topic = properties.getTopics().getNotifications();
        try {
            String message = objectMapper.writeValueAsString(notification);
            kafkaTemplate.send(topic, notification.getTenantId(), message)
                    .get(properties.getKafka().getSendTimeoutMs(), TimeUnit.MILLISECONDS);
            log.info("Notification published → topic={}, recipient={}, reference={}",
                    topic, notification.getRecipient(), notification.getReference());
        } catch (JsonProcessingException e) {
            throw new DispatchException("Cannot serialize notification", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("Interrupted while publishing notification", e);
        } catch (ExecutionException | TimeoutException e) {
            log.error("Notification publish failed: topic={}, recipient={}: {}",
                    topic, notification.getRecipient(), e.getMessage(), e);
            throw new DispatchException("Notification publish failed", e);
        }
    }
}
