package com.ruleflow.workflow;

import com.ruleflow.collaborator.UserDirectory;
import com.ruleflow.config.RuleflowProperties;
import com.ruleflow.exception.AssignmentException;
import com.ruleflow.model.ApproverGroup;
import com.ruleflow.model.AssignmentRule;
import com.ruleflow.repository.ApproverGroupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Resolves who acts next on a workflow step.
 *
 *   ROLE        → queue "role:<name>", candidates = role holders from the directory
 *   USER        → that user
 *   GROUP       → queue "group:<id>", candidates = group members
 *   ROUND_ROBIN → members[cursor % size], cursor advanced by compare-and-swap
 *
 * ROUND ROBIN UNDER CONTENTION:
 *   1. read the cursor
 *   2. pick the member at cursor % size
 *   3. UPDATE ... SET cursor = cursor + 1 WHERE id = ? AND cursor = <read value>
 *   4. 1 row updated → the pick is ours; 0 rows → someone else took that slot, retry from 1
 * Every cursor value is handed out exactly once, so M consecutive picks on an
 * M-member group visit every member once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssignmentResolver {

    private final UserDirectory userDirectory;
    private final ApproverGroupRepository groupRepository;
    private final RuleflowProperties properties;

    /**
     * Runs in the caller's transaction and never opens its own, so a failed
     * resolution leaves that transaction committable.
     *
     * @throws AssignmentException if the rule cannot produce anyone to act
     */
    public Assignment resolve(String tenantId, AssignmentRule rule) {
        if (rule == null || rule.getType() == null) {
            return Assignment.none();
        }
        return switch (rule.getType()) {
            case ROLE -> resolveRole(tenantId, rule.getRole());
            case USER -> resolveUser(rule.getUserId());
            case GROUP -> resolveGroup(tenantId, rule.getGroupId());
            case ROUND_ROBIN -> resolveRoundRobin(tenantId, rule.getGroupId());
        };
    }

    private Assignment resolveRole(String tenantId, String role) {
        if (role == null || role.isBlank()) {
            throw new AssignmentException("Role assignment without a role");
        }
        List<String> holders = userDirectory.findUsersByRole(tenantId, role);
        if (holders.isEmpty()) {
            throw new AssignmentException("Nobody holds role '" + role + "'");
        }
        return Assignment.queue("role:" + role, holders);
    }

    private Assignment resolveUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new AssignmentException("User assignment without a user id");
        }
        return Assignment.user(userId);
    }

    private Assignment resolveGroup(String tenantId, String groupId) {
        ApproverGroup group = loadGroup(tenantId, groupId);
        return Assignment.queue("group:" + group.getId(), group.getMemberIds());
    }

    private Assignment resolveRoundRobin(String tenantId, String groupId) {
        ApproverGroup group = loadGroup(tenantId, groupId);
        List<String> members = List.copyOf(group.getMemberIds());
        int maxAttempts = Math.max(1, properties.getAssignment().getMaxRotationAttempts());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long cursor = groupRepository.findRotationCursor(group.getId())
                    .orElseThrow(() -> new AssignmentException("Approver group " + groupId + " disappeared"));
            String member = members.get((int) Math.floorMod(cursor, (long) members.size()));

            if (groupRepository.advanceCursor(group.getId(), cursor) == 1) {
                log.debug("Round-robin pick: group={}, cursor={}, member={}", group.getName(), cursor, member);
                return Assignment.user(member);
            }
            log.debug("Round-robin slot {} of group {} taken, retrying (attempt {})", cursor, group.getName(), attempt);
        }
        throw new AssignmentException("Could not claim a round-robin slot in group '" + group.getName()
                + "' after " + maxAttempts + " attempts");
    }

    private ApproverGroup loadGroup(String tenantId, String groupId) {
        if (groupId == null || groupId.isBlank()) {
            throw new AssignmentException("Group assignment without a group id");
        }
        UUID id;
        try {
            id = UUID.fromString(groupId);
        } catch (IllegalArgumentException e) {
            throw new AssignmentException("Unknown approver group: " + groupId);
        }
        ApproverGroup group = groupRepository.findByIdAndTenantId(id, tenantId)
                .orElseThrow(() -> new AssignmentException("Unknown approver group: " + groupId));
        if (group.getMemberIds().isEmpty()) {
            throw new AssignmentException("Approver group '" + group.getName() + "' has no members");
        }
        return group;
    }
}
