package com.ruleflow.action;

import com.ruleflow.exception.CompileException;
import com.ruleflow.expression.Expression.FieldRef;
import com.ruleflow.expression.Expression.Literal;
import com.ruleflow.expression.ExpressionCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionFactoryTest {

    private final ExpressionCompiler compiler = new ExpressionCompiler();
    private final ActionFactory factory = new ActionFactory();

    private Action fromExpression(String expression) {
        return factory.fromCall("r1", compiler.compileAction("r1", expression));
    }

    @Nested
    @DisplayName("From action expressions")
    class FromExpressions {

        @Test
        @DisplayName("set_field with positional arguments becomes a FieldMutation")
        void setField() {
            FieldMutation mutation = assertInstanceOf(FieldMutation.class,
                    fromExpression("set_field('status', 'blocked')"));

            assertEquals("status", mutation.field());
            assertEquals("blocked", ((Literal) mutation.value()).value());
            assertEquals(ActionType.FIELD_MUTATION, mutation.type());
        }

        @Test
        @DisplayName("assign_to writes the assigned_to field")
        void assignTo() {
            FieldMutation mutation = assertInstanceOf(FieldMutation.class,
                    fromExpression("assign_to:compliance_team"));

            assertEquals("assigned_to", mutation.field());
            assertEquals("compliance_team", ((FieldRef) mutation.value()).path());
        }

        @Test
        @DisplayName("Prefixed set_field carries its value as a generic action")
        void prefixedSetField() {
            CustomAction custom = assertInstanceOf(CustomAction.class, fromExpression("set_field:status"));

            assertEquals("set_field", custom.name());
            assertEquals(ActionType.CUSTOM, custom.type());
            assertEquals(Map.of("value", FieldRef.of("status")), custom.parameters());
        }

        @Test
        @DisplayName("Prefixed update_field accepts a literal value")
        void prefixedUpdateFieldLiteral() {
            CustomAction custom = assertInstanceOf(CustomAction.class, fromExpression("update_field:'blocked'"));

            assertEquals("blocked", ((Literal) custom.parameters().get("value")).value());
        }

        @Test
        @DisplayName("trigger_workflow defaults the request type to onboarding")
        void triggerWorkflowDefaults() {
            TriggerWorkflow trigger = assertInstanceOf(TriggerWorkflow.class, fromExpression("trigger_workflow"));

            assertNull(trigger.workflowConfigId());
            assertEquals("onboarding", ((Literal) trigger.requestType()).value());
        }

        @Test
        @DisplayName("notify accepts named subject and requires a recipient")
        void notifyAction() {
            SendNotification notification = assertInstanceOf(SendNotification.class,
                    fromExpression("notify(owner.email, subject = 'Review needed')"));

            assertEquals("owner.email", ((FieldRef) notification.recipient()).path());
            assertEquals("Review needed", ((Literal) notification.subject()).value());
            assertNull(notification.message());

            assertThrows(CompileException.class, () -> fromExpression("notify(subject = 'x')"));
        }

        @Test
        @DisplayName("Unknown names become CustomActions with arg-indexed positional parameters")
        void customAction() {
            CustomAction custom = assertInstanceOf(CustomAction.class,
                    fromExpression("require_additional_approval(2, reason = 'risk')"));

            assertEquals("require_additional_approval", custom.name());
            assertEquals(2L, ((Literal) custom.parameters().get("arg0")).value());
            assertEquals("risk", ((Literal) custom.parameters().get("reason")).value());
        }
    }

    @Nested
    @DisplayName("Schema validation")
    class SchemaValidation {

        @Test
        @DisplayName("Unknown parameter for a built-in action is rejected")
        void unknownParameter() {
            CompileException e = assertThrows(CompileException.class,
                    () -> fromExpression("set_field('status', 'x', colour = 'red')"));
            assertTrue(e.getMessage().contains("colour"));
        }

        @Test
        @DisplayName("Too many positional arguments is rejected")
        void tooManyPositional() {
            assertThrows(CompileException.class, () -> fromExpression("set_field('a', 'b', 'c')"));
        }

        @Test
        @DisplayName("set_field without a value is rejected")
        void missingValue() {
            assertThrows(CompileException.class, () -> fromExpression("set_field('status')"));
        }

        @Test
        @DisplayName("A numeric field name is rejected")
        void nonStringField() {
            assertThrows(CompileException.class, () -> fromExpression("set_field(5, 'x')"));
        }
    }

    @Nested
    @DisplayName("From structured configs")
    class FromStructured {

        @Test
        @DisplayName("Structured config goes through the same schema as expressions")
        void structuredFieldMutation() {
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("field", "status");
            config.put("value", "${review.outcome}");

            FieldMutation mutation = assertInstanceOf(FieldMutation.class,
                    factory.fromStructured("r1", "field_mutation", config));

            assertEquals("status", mutation.field());
            assertEquals("review.outcome", ((FieldRef) mutation.value()).path());
        }

        @Test
        @DisplayName("Structured config rejects parameters the variant does not know")
        void structuredUnknownParameter() {
            assertThrows(CompileException.class,
                    () -> factory.fromStructured("r1", "send_notification", Map.of("recipient", "a@b.c", "cc", "x")));
        }

        @Test
        @DisplayName("Missing actionType is a compile error")
        void missingActionType() {
            assertThrows(CompileException.class, () -> factory.fromStructured("r1", " ", Map.of()));
        }
    }
}
