package com.ruleflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruleflow.action.ActionFactory;
import com.ruleflow.dto.BusinessRuleRequest;
import com.ruleflow.dto.BusinessRuleResponse;
import com.ruleflow.dto.RuleValidationResponse;
import com.ruleflow.engine.CompiledRuleCache;
import com.ruleflow.engine.RuleCompiler;
import com.ruleflow.exception.CompileException;
import com.ruleflow.exception.ConflictException;
import com.ruleflow.expression.ExpressionCompiler;
import com.ruleflow.model.BusinessRule;
import com.ruleflow.repository.BusinessRuleRepository;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BusinessRuleServiceTest {

    private static final String TENANT = "acme";

    @Mock private BusinessRuleRepository ruleRepository;
    @Mock private CompiledRuleCache compiledRuleCache;

    private BusinessRuleService service;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        RuleCompiler ruleCompiler = new RuleCompiler(new ExpressionCompiler(), new ActionFactory(), objectMapper);
        service = new BusinessRuleService(ruleRepository, ruleCompiler, compiledRuleCache, objectMapper);
    }

    private static BusinessRuleRequest request(String condition, String action) {
        return BusinessRuleRequest.builder()
                .ruleId("high-risk-approval")
                .name("High risk approval")
                .conditionExpression(condition)
                .actionExpression(action)
                .ruleType("validation")
                .applicableEntities(Set.of("agent"))
                .priority(1)
                .automatic(true)
                .build();
    }

    private static BusinessRule stored(UUID id) {
        return BusinessRule.builder()
                .id(id)
                .tenantId(TENANT)
                .ruleId("high-risk-approval")
                .name("High risk approval")
                .conditionExpression("risk_level == 'high'")
                .actionExpression("require_additional_approval")
                .ruleType("validation")
                .priority(1)
                .version(3L)
                .build();
    }

    @Test
    @DisplayName("Create compiles and saves a valid rule")
    void create_validRule_isSaved() {
        when(ruleRepository.existsByTenantIdAndRuleId(TENANT, "high-risk-approval")).thenReturn(false);
        when(ruleRepository.save(any(BusinessRule.class))).thenAnswer(inv -> inv.getArgument(0));

        BusinessRuleResponse response = service.create(TENANT, request("risk_level == 'high'", "require_additional_approval"));

        ArgumentCaptor<BusinessRule> captor = ArgumentCaptor.forClass(BusinessRule.class);
        verify(ruleRepository).save(captor.capture());
        BusinessRule saved = captor.getValue();
        assertEquals(TENANT, saved.getTenantId());
        assertEquals(Set.of("agent"), saved.getApplicableEntities());
        assertTrue(saved.isActive());
        assertTrue(saved.isAutomatic());
        assertEquals("high-risk-approval", response.getRuleId());
    }

    @Test
    @DisplayName("Create rejects a rule whose condition does not compile, nothing is saved")
    void create_invalidCondition_isRejected() {
        when(ruleRepository.existsByTenantIdAndRuleId(TENANT, "high-risk-approval")).thenReturn(false);

        CompileException e = assertThrows(CompileException.class,
                () -> service.create(TENANT, request("risk_level == ", "require_additional_approval")));

        assertEquals("high-risk-approval", e.getRuleId());
        assertTrue(e.getPosition() >= 0);
        verify(ruleRepository, never()).save(any());
    }

    @Test
    @DisplayName("Create rejects a duplicate rule id")
    void create_duplicateRuleId_conflicts() {
        when(ruleRepository.existsByTenantIdAndRuleId(TENANT, "high-risk-approval")).thenReturn(true);

        assertThrows(ConflictException.class,
                () -> service.create(TENANT, request("risk_level == 'high'", "require_additional_approval")));
        verify(ruleRepository, never()).save(any());
    }

    @Test
    @DisplayName("Create stores a structured action config as JSON")
    void create_structuredAction_storesConfigJson() {
        BusinessRuleRequest req = request("amount > 1000", null);
        req.setActionType("set_field");
        req.setActionConfig(Map.of("field", "status", "value", "review"));
        when(ruleRepository.existsByTenantIdAndRuleId(TENANT, "high-risk-approval")).thenReturn(false);
        when(ruleRepository.save(any(BusinessRule.class))).thenAnswer(inv -> inv.getArgument(0));

        BusinessRuleResponse response = service.create(TENANT, req);

        assertEquals(Map.of("field", "status", "value", "review"), response.getActionConfig());
    }

    @Test
    @DisplayName("Create rejects a structured action missing a required parameter")
    void create_structuredActionMissingParameter_isRejected() {
        BusinessRuleRequest req = request("amount > 1000", null);
        req.setActionType("set_field");
        req.setActionConfig(Map.of("field", "status"));
        when(ruleRepository.existsByTenantIdAndRuleId(TENANT, "high-risk-approval")).thenReturn(false);

        assertThrows(CompileException.class, () -> service.create(TENANT, req));
        verify(ruleRepository, never()).save(any());
    }

    @Test
    @DisplayName("Update invalidates the compiled rule in the cache")
    void update_invalidatesCache() {
        UUID id = UUID.randomUUID();
        BusinessRule existing = stored(id);
        when(ruleRepository.findByIdAndTenantId(id, TENANT)).thenReturn(Optional.of(existing));
        when(ruleRepository.saveAndFlush(existing)).thenReturn(existing);

        service.update(TENANT, id, request("risk_level == 'critical'", "require_additional_approval"));

        assertEquals("risk_level == 'critical'", existing.getConditionExpression());
        verify(compiledRuleCache).invalidate(id);
    }

    @Test
    @DisplayName("Update of an unknown rule is not found")
    void update_unknownRule_notFound() {
        UUID id = UUID.randomUUID();
        when(ruleRepository.findByIdAndTenantId(id, TENANT)).thenReturn(Optional.empty());

        assertThrows(EntityNotFoundException.class,
                () -> service.update(TENANT, id, request("risk_level == 'high'", "require_additional_approval")));
        verifyNoInteractions(compiledRuleCache);
    }

    @Test
    @DisplayName("Toggle flips the active flag and invalidates the cache")
    void toggle_flipsActive() {
        UUID id = UUID.randomUUID();
        BusinessRule existing = stored(id);
        when(ruleRepository.findByIdAndTenantId(id, TENANT)).thenReturn(Optional.of(existing));
        when(ruleRepository.saveAndFlush(existing)).thenReturn(existing);

        BusinessRuleResponse response = service.toggle(TENANT, id);

        assertFalse(response.isActive());
        verify(compiledRuleCache).invalidate(id);
    }

    @Test
    @DisplayName("Delete removes the rule and its compiled form")
    void delete_removesRule() {
        UUID id = UUID.randomUUID();
        BusinessRule existing = stored(id);
        when(ruleRepository.findByIdAndTenantId(id, TENANT)).thenReturn(Optional.of(existing));

        service.delete(TENANT, id);

        verify(ruleRepository).delete(existing);
        verify(compiledRuleCache).invalidate(id);
    }

    @Test
    @DisplayName("Validate reports the compiled action for a valid rule")
    void validate_validRule() {
        RuleValidationResponse response = service.validate(request("risk_level == 'high'", "require_additional_approval"));

        assertTrue(response.isValid());
        assertEquals("CUSTOM", response.getActionType());
        assertEquals("require_additional_approval", response.getActionName());
        assertEquals(-1, response.getPosition());
        verifyNoInteractions(ruleRepository);
    }

    @Test
    @DisplayName("Validate reports the error position for an invalid condition")
    void validate_invalidRule() {
        RuleValidationResponse response = service.validate(request("risk_level == ", "require_additional_approval"));

        assertFalse(response.isValid());
        assertNotNull(response.getError());
        assertTrue(response.getPosition() >= 0);
    }
}
