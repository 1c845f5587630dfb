package com.ruleflow.action;

/**
 * The capability an action exercises when it runs.
 * FIELD_MUTATION    → writes a field on the evaluated entity
 * TRIGGER_WORKFLOW  → starts an approval workflow for the entity
 * SEND_NOTIFICATION → publishes a notification
 * CUSTOM            → any other named action, recorded and optionally posted to a webhook
 */
public enum ActionType {
    FIELD_MUTATION,
    TRIGGER_WORKFLOW,
    SEND_NOTIFICATION,
    CUSTOM
}
