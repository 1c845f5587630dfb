package com.ruleflow.expression;

import com.ruleflow.exception.EvaluationException;
import com.ruleflow.expression.Expression.ArrayExpr;
import com.ruleflow.expression.Expression.BinaryOp;
import com.ruleflow.expression.Expression.ComparisonOperator;
import com.ruleflow.expression.Expression.FieldRef;
import com.ruleflow.expression.Expression.Literal;
import com.ruleflow.expression.Expression.LogicalOp;
import com.ruleflow.expression.Expression.UnaryOp;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tree-walking evaluator for compiled expressions.
 * <p>
 * Semantics:
 * <ul>
 *   <li>A field reference to a missing path yields null.</li>
 *   <li>Any comparison with a null operand is false, {@code !=} included;
 *       use {@code is null} / {@code is not null} to test for absence.</li>
 *   <li>Ordering operators accept numbers only; other operand types are a type mismatch.</li>
 *   <li>{@code in} requires an array on the right.</li>
 *   <li>Logical operators treat null as false and reject other non-boolean values.</li>
 * </ul>
 * The evaluator holds no state and is safe to call from any number of threads.
 */
@Component
public class ExpressionEvaluator {

    /**
     * Evaluate a condition to a boolean.
     *
     * @throws EvaluationException on type mismatch or a non-boolean result
     */
    public boolean evaluateCondition(Expression condition, Map<String, Object> context) {
        Object result = evaluate(condition, context);
        if (result == null) {
            return false;
        }
        if (result instanceof Boolean b) {
            return b;
        }
        throw new EvaluationException("Condition evaluated to " + typeName(result) + ", expected boolean");
    }

    /**
     * Evaluate an action argument. Unlike conditions, a field reference that
     * does not resolve falls back to its own path text, so {@code step:approval_required}
     * passes the symbol {@code approval_required} through.
     */
    public Object resolveParameter(Expression parameter, Map<String, Object> context) {
        if (parameter == null) {
            return null;
        }
        if (parameter instanceof FieldRef ref) {
            Object value = resolvePath(ref, context);
            return value != null ? value : ref.path();
        }
        return evaluate(parameter, context);
    }

    public Object evaluate(Expression expression, Map<String, Object> context) {
        if (expression instanceof Literal literal) {
            return literal.value();
        }
        if (expression instanceof FieldRef ref) {
            return resolvePath(ref, context);
        }
        if (expression instanceof ArrayExpr array) {
            List<Object> values = new ArrayList<>(array.elements().size());
            for (Expression element : array.elements()) {
                values.add(evaluate(element, context));
            }
            return values;
        }
        if (expression instanceof BinaryOp op) {
            return compare(op.operator(), evaluate(op.left(), context), evaluate(op.right(), context));
        }
        if (expression instanceof UnaryOp op) {
            Object operand = evaluate(op.operand(), context);
            return switch (op.operator()) {
                case NOT -> !asBoolean(operand, "not");
                case IS_NULL -> operand == null;
                case IS_NOT_NULL -> operand != null;
            };
        }
        LogicalOp op = (LogicalOp) expression;
        String keyword = op.operator().name().toLowerCase();
        for (Expression operand : op.operands()) {
            boolean value = asBoolean(evaluate(operand, context), keyword);
            if (op.operator() == Expression.LogicalOperator.AND && !value) {
                return false;
            }
            if (op.operator() == Expression.LogicalOperator.OR && value) {
                return true;
            }
        }
        return op.operator() == Expression.LogicalOperator.AND;
    }

    private Object resolvePath(FieldRef ref, Map<String, Object> context) {
        Object current = context;
        for (String segment : ref.segments()) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list && isIndex(segment)) {
                int i = Integer.parseInt(segment);
                current = i < list.size() ? list.get(i) : null;
            } else {
                return null;
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private boolean compare(ComparisonOperator operator, Object left, Object right) {
        if (left == null || right == null) {
            return false;
        }
        if (operator.isOrdering()) {
            if (!(left instanceof Number l) || !(right instanceof Number r)) {
                throw new EvaluationException("Type mismatch: cannot apply '" + operator.symbol() + "' to "
                        + typeName(left) + " and " + typeName(right));
            }
            int cmp = toDecimal(l).compareTo(toDecimal(r));
            return switch (operator) {
                case LT -> cmp < 0;
                case LTE -> cmp <= 0;
                case GT -> cmp > 0;
                default -> cmp >= 0;
            };
        }
        return switch (operator) {
            case EQ -> valuesEqual(left, right);
            case NE -> !valuesEqual(left, right);
            case IN -> contains(right, left, operator);
            default -> !contains(right, left, operator);
        };
    }

    private boolean contains(Object container, Object candidate, ComparisonOperator operator) {
        if (!(container instanceof Collection<?> values)) {
            throw new EvaluationException("Type mismatch: '" + operator.symbol()
                    + "' requires an array, got " + typeName(container));
        }
        for (Object value : values) {
            if (value != null && valuesEqual(candidate, value)) {
                return true;
            }
        }
        return false;
    }

    private boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return toDecimal(l).compareTo(toDecimal(r)) == 0;
        }
        return Objects.equals(left, right);
    }

    private boolean asBoolean(Object value, String keyword) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new EvaluationException("Type mismatch: '" + keyword + "' requires boolean operands, got "
                + typeName(value));
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(number.toString());
    }

    private static boolean isIndex(String segment) {
        return !segment.isEmpty() && segment.chars().allMatch(Character::isDigit);
    }

    private static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Collection) {
            return "array";
        }
        if (value instanceof Map) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }
}
