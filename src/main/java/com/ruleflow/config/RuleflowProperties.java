package com.ruleflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralizes topic names, timeouts and engine tuning.
 *
 * Bound from application.yml under "ruleflow" prefix:
 *   ruleflow:
 *     topics:
 *       evaluations: ruleflow.evaluations
 *       notifications: ruleflow.notifications
 *       evaluations-dlq: ruleflow.evaluations.dlq
 *     escalation:
 *       enabled: true
 *       sweep-interval-ms: 60000
 *       batch-size: 100
 *     assignment:
 *       max-rotation-attempts: 5
 *     directory:
 *       roles:
 *         compliance_officer: [alice, bob]
 */
@Component
@ConfigurationProperties(prefix = "ruleflow")
@Getter
@Setter
public class RuleflowProperties {

    private Topics topics = new Topics();
    private Escalation escalation = new Escalation();
    private Assignment assignment = new Assignment();
    private Http http = new Http();
    private Kafka kafka = new Kafka();
    private Collaborators collaborators = new Collaborators();
    private Directory directory = new Directory();
    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Topics {
        private String evaluations = "ruleflow.evaluations";
        private String notifications = "ruleflow.notifications";
        private String evaluationsDlq = "ruleflow.evaluations.dlq";
    }

    @Getter
    @Setter
    public static class Escalation {
        private boolean enabled = true;
        private long sweepIntervalMs = 60000;
        private int batchSize = 100;
    }

    @Getter
    @Setter
    public static class Assignment {
        // compare-and-swap attempts before a round-robin pick gives up
        private int maxRotationAttempts = 5;
    }

    @Getter
    @Setter
    public static class Http {
        private int connectTimeoutMs = 2000;
        private int readTimeoutMs = 5000;
    }

    @Getter
    @Setter
    public static class Kafka {
        private long sendTimeoutMs = 5000;
    }

    @Getter
    @Setter
    public static class Collaborators {
        // base URL of the service that owns the evaluated entities
        private String entityServiceUrl = "";
    }

    @Getter
    @Setter
    public static class Directory {
        private Map<String, List<String>> roles = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Cache {
        private long compiledRulesMaxSize = 10000;
    }
}
