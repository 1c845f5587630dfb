package com.ruleflow.collaborator;

import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * Message published on the notifications topic.
 *
 * Example:
 *   {"tenantId": "acme", "recipient": "role:compliance_officer",
 *    "subject": "AI-42 awaiting Compliance Review", "message": "...",
 *    "source": "workflow", "reference": "AI-42", "attributes": {"step": 2}}
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Notification {

    private String tenantId;
    private String recipient;
    private String subject;
    private String message;
    // "rule", "workflow" or "escalation"
    private String source;
    private String reference;
    private Map<String, Object> attributes;
    @Builder.Default
    private Instant createdAt = Instant.now();
}
