package com.ruleflow.engine;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Selects the rules that apply to an evaluation call, in evaluation order.
 *
 * A rule applies when it is active and:
 *   - its ruleType equals the requested rule type (when one is given)
 *   - applicableEntities is empty or contains the entity type
 *   - applicableScreens is empty or contains the screen (when a screen is given)
 *
 * Order: priority ascending, then ruleId lexical. Lower priority runs first.
 */
@Component
public class RuleMatcher {

    static final Comparator<CompiledRule> EVALUATION_ORDER =
            Comparator.comparingInt(CompiledRule::priority).thenComparing(CompiledRule::ruleId);

    public List<CompiledRule> match(Collection<CompiledRule> rules, String entityType, String screen, String ruleType) {
        return rules.stream()
                .filter(CompiledRule::active)
                .filter(rule -> isBlank(ruleType) || ruleType.equals(rule.ruleType()))
                .filter(rule -> rule.applicableEntities().isEmpty()
                        || (entityType != null && rule.applicableEntities().contains(entityType)))
                .filter(rule -> isBlank(screen)
                        || rule.applicableScreens().isEmpty()
                        || rule.applicableScreens().contains(screen))
                .sorted(EVALUATION_ORDER)
                .toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
