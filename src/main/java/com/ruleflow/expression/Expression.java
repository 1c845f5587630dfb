package com.ruleflow.expression;

import java.util.List;

/**
 * Compiled expression tree. Produced once by {@link ExpressionCompiler} and
 * walked by {@link ExpressionEvaluator}; nodes are immutable and safe to share
 * between threads.
 */
public sealed interface Expression
        permits Expression.Literal, Expression.FieldRef, Expression.ArrayExpr,
                Expression.BinaryOp, Expression.UnaryOp, Expression.LogicalOp {

    Literal TRUE = new Literal(Boolean.TRUE);

    /** String, Long, Double, Boolean or null. */
    record Literal(Object value) implements Expression {
    }

    /** Dotted path into the context, e.g. {@code risk.level}. */
    record FieldRef(String path, List<String> segments) implements Expression {

        public static FieldRef of(String path) {
            return new FieldRef(path, List.of(path.split("\\.")));
        }
    }

    record ArrayExpr(List<Expression> elements) implements Expression {
    }

    record BinaryOp(ComparisonOperator operator, Expression left, Expression right) implements Expression {
    }

    record UnaryOp(UnaryOperator operator, Expression operand) implements Expression {
    }

    record LogicalOp(LogicalOperator operator, List<Expression> operands) implements Expression {
    }

    enum ComparisonOperator {
        EQ("=="), NE("!="), LT("<"), LTE("<="), GT(">"), GTE(">="), IN("in"), NOT_IN("not in");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isOrdering() {
            return this == LT || this == LTE || this == GT || this == GTE;
        }
    }

    enum UnaryOperator {
        NOT, IS_NULL, IS_NOT_NULL
    }

    enum LogicalOperator {
        AND, OR
    }
}
