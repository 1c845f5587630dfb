package com.ruleflow.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ruleflow.config.RuleflowProperties;
import com.ruleflow.model.BusinessRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Caffeine cache of compiled rules keyed by (rule id, rule version).
 *
 * A rule update bumps its JPA version, so a stale entry can never be served for
 * the new version; {@link #invalidate} just frees the memory early.
 */
@Component
@Slf4j
public class CompiledRuleCache {

    private final Cache<Key, CompiledRule> cache;
    private final RuleCompiler compiler;

    public CompiledRuleCache(RuleCompiler compiler, RuleflowProperties properties) {
        this.compiler = compiler;
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getCache().getCompiledRulesMaxSize())
                .build();
    }

    /**
     * @throws com.ruleflow.exception.CompileException if the rule does not compile
     */
    public CompiledRule get(BusinessRule rule) {
        return cache.get(new Key(rule.getId(), rule.getVersion()), key -> compiler.compile(rule));
    }

    public void invalidate(UUID ruleId) {
        cache.asMap().keySet().removeIf(key -> key.id().equals(ruleId));
        log.debug("Compiled rule evicted: id={}", ruleId);
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record Key(UUID id, Long version) {
    }
}
