package com.ruleflow.collaborator;

import com.ruleflow.config.RuleflowProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Role directory backed by {@code ruleflow.directory.roles}. The same role
 * membership applies to every tenant.
 */
@Component
@RequiredArgsConstructor
public class PropertiesUserDirectory implements UserDirectory {

    private final RuleflowProperties properties;

    @Override
    public List<String> findUsersByRole(String tenantId, String role) {
        List<String> users = properties.getDirectory().getRoles().get(role);
        return users == null ? List.of() : List.copyOf(users);
    }
}
