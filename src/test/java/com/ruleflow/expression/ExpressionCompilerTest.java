package com.ruleflow.expression;

import com.ruleflow.exception.CompileException;
import com.ruleflow.expression.Expression.BinaryOp;
import com.ruleflow.expression.Expression.ComparisonOperator;
import com.ruleflow.expression.Expression.FieldRef;
import com.ruleflow.expression.Expression.Literal;
import com.ruleflow.expression.Expression.LogicalOp;
import com.ruleflow.expression.Expression.LogicalOperator;
import com.ruleflow.expression.Expression.UnaryOp;
import com.ruleflow.expression.Expression.UnaryOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionCompilerTest {

    private final ExpressionCompiler compiler = new ExpressionCompiler();

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        @DisplayName("Blank condition compiles to true")
        void blankCondition_isTrue() {
            assertSame(Expression.TRUE, compiler.compileCondition("r1", null));
            assertSame(Expression.TRUE, compiler.compileCondition("r1", "   "));
        }

        @Test
        @DisplayName("Simple comparison becomes a BinaryOp over a field and a literal")
        void simpleComparison() {
            Expression expr = compiler.compileCondition("r1", "risk_level == 'high'");

            BinaryOp op = assertInstanceOf(BinaryOp.class, expr);
            assertEquals(ComparisonOperator.EQ, op.operator());
            assertEquals("risk_level", assertInstanceOf(FieldRef.class, op.left()).path());
            assertEquals("high", assertInstanceOf(Literal.class, op.right()).value());
        }

        @Test
        @DisplayName("Dotted identifiers are a single field reference split into segments")
        void dottedPath() {
            BinaryOp op = (BinaryOp) compiler.compileCondition("r1", "owner.address.country != 'US'");

            FieldRef ref = assertInstanceOf(FieldRef.class, op.left());
            assertEquals(List.of("owner", "address", "country"), ref.segments());
            assertEquals(ComparisonOperator.NE, op.operator());
        }

        @Test
        @DisplayName("AND binds tighter than OR")
        void andBindsTighterThanOr() {
            Expression expr = compiler.compileCondition("r1", "a == 1 or b == 2 and c == 3");

            LogicalOp or = assertInstanceOf(LogicalOp.class, expr);
            assertEquals(LogicalOperator.OR, or.operator());
            assertEquals(2, or.operands().size());
            LogicalOp and = assertInstanceOf(LogicalOp.class, or.operands().get(1));
            assertEquals(LogicalOperator.AND, and.operator());
        }

        @Test
        @DisplayName("Parentheses override precedence")
        void parentheses() {
            Expression expr = compiler.compileCondition("r1", "(a == 1 or b == 2) and c == 3");

            LogicalOp and = assertInstanceOf(LogicalOp.class, expr);
            assertEquals(LogicalOperator.AND, and.operator());
            assertInstanceOf(LogicalOp.class, and.operands().get(0));
        }

        @Test
        @DisplayName("Keywords are case-insensitive and 'not in' / 'is not null' parse")
        void keywordForms() {
            LogicalOp and = (LogicalOp) compiler.compileCondition("r1",
                    "country NOT IN ['US', 'CA'] AND email is not null");

            BinaryOp notIn = assertInstanceOf(BinaryOp.class, and.operands().get(0));
            assertEquals(ComparisonOperator.NOT_IN, notIn.operator());
            UnaryOp isNotNull = assertInstanceOf(UnaryOp.class, and.operands().get(1));
            assertEquals(UnaryOperator.IS_NOT_NULL, isNotNull.operator());
        }

        @Test
        @DisplayName("Integer literals are Long, decimals are Double, negatives allowed")
        void numberLiterals() {
            BinaryOp whole = (BinaryOp) compiler.compileCondition("r1", "score >= 80");
            BinaryOp fraction = (BinaryOp) compiler.compileCondition("r1", "ratio < -0.5");

            assertEquals(80L, ((Literal) whole.right()).value());
            assertEquals(-0.5, ((Literal) fraction.right()).value());
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class SyntaxErrors {

        @Test
        @DisplayName("Missing operand reports the end-of-input position")
        void missingOperand() {
            CompileException e = assertThrows(CompileException.class,
                    () -> compiler.compileCondition("r1", "amount >"));

            assertEquals(8, e.getPosition());
            assertEquals("r1", e.getRuleId());
            assertTrue(e.getMessage().contains("Unexpected end of expression"));
        }

        @Test
        @DisplayName("Positions count the leading whitespace of the stored expression")
        void positionIncludesLeadingWhitespace() {
            CompileException condition = assertThrows(CompileException.class,
                    () -> compiler.compileCondition("r1", "   amount > 'x"));
            CompileException action = assertThrows(CompileException.class,
                    () -> compiler.compileAction("r1", "  set_field('status',"));

            assertEquals(12, condition.getPosition());
            assertEquals(21, action.getPosition());
        }

        @Test
        @DisplayName("Unclosed parenthesis is rejected")
        void unclosedParenthesis() {
            CompileException e = assertThrows(CompileException.class,
                    () -> compiler.compileCondition("r1", "(a == 1"));

            assertEquals(7, e.getPosition());
        }

        @Test
        @DisplayName("Unterminated string points at the opening quote")
        void unterminatedString() {
            CompileException e = assertThrows(CompileException.class,
                    () -> compiler.compileCondition("r1", "a == 'x"));

            assertEquals(5, e.getPosition());
        }

        @Test
        @DisplayName("Stray characters and trailing tokens are rejected")
        void strayInput() {
            assertThrows(CompileException.class, () -> compiler.compileCondition("r1", "a == 1 #"));
            assertThrows(CompileException.class, () -> compiler.compileCondition("r1", "a == 1 b"));
            assertThrows(CompileException.class, () -> compiler.compileCondition("r1", "a. == 1"));
        }
    }

    @Nested
    @DisplayName("Actions")
    class Actions {

        @Test
        @DisplayName("Bare action name has no arguments")
        void bareName() {
            ActionCall call = compiler.compileAction("r1", "require_additional_approval");

            assertEquals("require_additional_approval", call.name());
            assertTrue(call.positional().isEmpty());
            assertTrue(call.named().isEmpty());
        }

        @Test
        @DisplayName("Positional and named arguments are kept apart")
        void arguments() {
            ActionCall call = compiler.compileAction("r1",
                    "notify('ops@acme.io', subject = 'Review', priority = 2)");

            assertEquals("notify", call.name());
            assertEquals(1, call.positional().size());
            assertEquals(List.of("subject", "priority"), List.copyOf(call.named().keySet()));
        }

        @Test
        @DisplayName("Prefixed form puts its value in the first positional slot")
        void prefixedForm() {
            ActionCall call = compiler.compileAction("r1", "notify:owner.email");

            assertEquals("notify", call.name());
            assertEquals("owner.email", ((FieldRef) call.positional().get(0)).path());
        }

        @Test
        @DisplayName("Empty action and positional-after-named are compile errors")
        void invalidActions() {
            assertThrows(CompileException.class, () -> compiler.compileAction("r1", " "));
            assertThrows(CompileException.class, () -> compiler.compileAction("r1", "notify(subject = 'x', 'y')"));
            assertThrows(CompileException.class, () -> compiler.compileAction("r1", "notify(a = 1, a = 2)"));
        }
    }
}
