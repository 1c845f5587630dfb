package com.ruleflow.workflow;

/**
 * An actor's decision on the step a request is currently on.
 * {@code expectedVersion}, when given, must equal the request's current version.
 */
public record StepDecision(int step, String actor, String notes, Long expectedVersion) {
}
