package com.ruleflow.engine;

import com.ruleflow.action.Action;
import com.ruleflow.expression.Expression;

import java.util.Set;
import java.util.UUID;

/**
 * Immutable snapshot of a business rule with its condition parsed and its
 * action compiled. Safe to share between threads and evaluations.
 */
public record CompiledRule(
        UUID id,
        String ruleId,
        String name,
        int priority,
        String ruleType,
        Set<String> applicableEntities,
        Set<String> applicableScreens,
        boolean active,
        boolean automatic,
        Long version,
        Expression condition,
        Action action) {

    public CompiledRule {
        applicableEntities = applicableEntities == null ? Set.of() : Set.copyOf(applicableEntities);
        applicableScreens = applicableScreens == null ? Set.of() : Set.copyOf(applicableScreens);
    }
}
