package com.ruleflow.service;

import com.ruleflow.dto.ApproverGroupRequest;
import com.ruleflow.dto.ApproverGroupResponse;
import com.ruleflow.exception.ConflictException;
import com.ruleflow.exception.InvalidWorkflowException;
import com.ruleflow.model.ApproverGroup;
import com.ruleflow.model.AssignmentRule;
import com.ruleflow.model.WorkflowConfig;
import com.ruleflow.model.WorkflowStep;
import com.ruleflow.repository.ApproverGroupRepository;
import com.ruleflow.repository.WorkflowConfigRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Approver group management. A group referenced by a workflow assignment rule
 * can be neither deleted nor emptied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApproverGroupService {

    private final ApproverGroupRepository groupRepository;
    private final WorkflowConfigRepository configRepository;

    @Transactional
    public ApproverGroupResponse create(String tenantId, ApproverGroupRequest request) {
        ApproverGroup group = ApproverGroup.builder()
                .tenantId(tenantId)
                .name(request.getName())
                .description(request.getDescription())
                .memberIds(members(request))
                .build();
        ApproverGroup saved = groupRepository.save(group);
        log.info("Approver group created: '{}' (tenant={}, members={})", saved.getName(), tenantId, saved.getMemberIds().size());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<ApproverGroupResponse> list(String tenantId) {
        return groupRepository.findByTenantIdOrderByNameAsc(tenantId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public ApproverGroupResponse get(String tenantId, UUID id) {
        return toResponse(load(tenantId, id));
    }

    @Transactional
    public ApproverGroupResponse update(String tenantId, UUID id, ApproverGroupRequest request) {
        ApproverGroup group = load(tenantId, id);
        List<String> members = members(request);
        if (members.isEmpty()) {
            List<String> users = referencingWorkflows(tenantId, id);
            if (!users.isEmpty()) {
                throw new InvalidWorkflowException("Group '" + group.getName() + "' cannot be emptied, it is used by " + users);
            }
        }

        group.setName(request.getName());
        group.setDescription(request.getDescription());
        group.getMemberIds().clear();
        group.getMemberIds().addAll(members);

        log.info("Approver group updated: '{}' (members={})", group.getName(), members.size());
        return toResponse(groupRepository.save(group));
    }

    @Transactional
    public void delete(String tenantId, UUID id) {
        ApproverGroup group = load(tenantId, id);
        List<String> users = referencingWorkflows(tenantId, id);
        if (!users.isEmpty()) {
            throw new ConflictException("Group '" + group.getName() + "' is used by " + users);
        }
        groupRepository.delete(group);
        log.info("Approver group deleted: '{}' (tenant={})", group.getName(), tenantId);
    }

    private ApproverGroup load(String tenantId, UUID id) {
        return groupRepository.findByIdAndTenantId(id, tenantId)
                .orElseThrow(() -> new EntityNotFoundException("Approver group not found: " + id));
    }

    private List<String> referencingWorkflows(String tenantId, UUID groupId) {
        String id = groupId.toString();
        List<String> names = new ArrayList<>();
        for (WorkflowConfig config : configRepository.findByTenantIdOrderByCreatedAtAsc(tenantId)) {
            if (references(config.getAssignmentRules(), id)
                    || config.getSteps().stream().map(WorkflowStep::getAssignmentRule).anyMatch(r -> references(r, id))) {
                names.add(config.getName());
            }
        }
        return names;
    }

    private static boolean references(AssignmentRule rule, String groupId) {
        return rule != null && rule.referencesGroup(groupId);
    }

    private static List<String> members(ApproverGroupRequest request) {
        if (request.getMemberIds() == null) {
            return new ArrayList<>();
        }
        return request.getMemberIds().stream()
                .filter(m -> m != null && !m.isBlank())
                .distinct()
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private ApproverGroupResponse toResponse(ApproverGroup g) {
        return ApproverGroupResponse.builder()
                .id(g.getId())
                .name(g.getName())
                .description(g.getDescription())
                .memberIds(List.copyOf(g.getMemberIds()))
                .rotationCursor(g.getRotationCursor())
                .createdAt(g.getCreatedAt())
                .updatedAt(g.getUpdatedAt())
                .build();
    }
}
