package com.ruleflow.expression;

import com.ruleflow.exception.CompileException;
import com.ruleflow.expression.Expression.ArrayExpr;
import com.ruleflow.expression.Expression.BinaryOp;
import com.ruleflow.expression.Expression.ComparisonOperator;
import com.ruleflow.expression.Expression.FieldRef;
import com.ruleflow.expression.Expression.Literal;
import com.ruleflow.expression.Expression.LogicalOp;
import com.ruleflow.expression.Expression.LogicalOperator;
import com.ruleflow.expression.Expression.UnaryOp;
import com.ruleflow.expression.Expression.UnaryOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for condition expressions.
 * <p>
 * Grammar (precedence: NOT > AND > OR):
 * <pre>
 * expression := or
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' not | comparison
 * comparison := operand (compOp operand | 'not'? 'in' operand | 'is' 'not'? 'null')?
 * operand    := literal | fieldRef | array | '(' expression ')'
 * </pre>
 */
public final class ExpressionParser {

    private final String ruleId;
    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String ruleId, String input, List<Token> tokens) {
        this.ruleId = ruleId;
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse a complete condition; trailing tokens are a syntax error.
     */
    public Expression parse() {
        Expression result = parseOr();
        expect(TokenType.EOF, "Unexpected trailing input");
        return result;
    }

    /**
     * Parse a single operand (literal, field reference, array or grouped
     * expression). Used by the action parser for argument values.
     */
    Expression parseOperand() {
        if (match(TokenType.LPAREN)) {
            Expression inner = parseOr();
            expect(TokenType.RPAREN, "Expected ')'");
            return inner;
        }
        if (match(TokenType.LBRACKET)) {
            return parseArray();
        }
        if (match(TokenType.STRING) || match(TokenType.NUMBER) || match(TokenType.BOOLEAN)) {
            return new Literal(previous().literal());
        }
        if (match(TokenType.NULL)) {
            return new Literal(null);
        }
        if (match(TokenType.IDENT)) {
            return FieldRef.of(previous().text());
        }
        Token token = peek();
        throw error(token.type() == TokenType.EOF
                ? "Unexpected end of expression"
                : "Unexpected token '" + token.text() + "'", token);
    }

    /**
     * Parse an expression without requiring end of input.
     */
    Expression parseExpression() {
        return parseOr();
    }

    boolean check(TokenType type) {
        return peek().type() == type;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            index++;
            return true;
        }
        return false;
    }

    Token expect(TokenType type, String message) {
        if (check(type)) {
            return tokens.get(index++);
        }
        throw error(message + " but found '" + peek().text() + "'", peek());
    }

    Token peek() {
        return tokens.get(index);
    }

    Token peekAhead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    Token previous() {
        return tokens.get(index - 1);
    }

    CompileException error(String message, Token token) {
        return new CompileException(ruleId, token.position(), message + " in '" + input + "'");
    }

    private Expression parseOr() {
        List<Expression> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (match(TokenType.OR)) {
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new LogicalOp(LogicalOperator.OR, List.copyOf(operands));
    }

    private Expression parseAnd() {
        List<Expression> operands = new ArrayList<>();
        operands.add(parseNot());
        while (match(TokenType.AND)) {
            operands.add(parseNot());
        }
        return operands.size() == 1 ? operands.get(0) : new LogicalOp(LogicalOperator.AND, List.copyOf(operands));
    }

    private Expression parseNot() {
        if (match(TokenType.NOT)) {
            return new UnaryOp(UnaryOperator.NOT, parseNot());
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parseOperand();

        if (match(TokenType.IS)) {
            boolean negated = match(TokenType.NOT);
            expect(TokenType.NULL, "Expected 'null' after 'is'");
            return new UnaryOp(negated ? UnaryOperator.IS_NOT_NULL : UnaryOperator.IS_NULL, left);
        }

        if (check(TokenType.NOT)) {
            index++;
            expect(TokenType.IN, "Expected 'in' after 'not'");
            return new BinaryOp(ComparisonOperator.NOT_IN, left, parseOperand());
        }

        ComparisonOperator operator = comparisonOperator(peek().type());
        if (operator == null) {
            return left;
        }
        index++;
        return new BinaryOp(operator, left, parseOperand());
    }

    private Expression parseArray() {
        List<Expression> elements = new ArrayList<>();
        if (!check(TokenType.RBRACKET)) {
            do {
                elements.add(parseOperand());
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RBRACKET, "Expected ']'");
        return new ArrayExpr(List.copyOf(elements));
    }

    private static ComparisonOperator comparisonOperator(TokenType type) {
        return switch (type) {
            case EQ -> ComparisonOperator.EQ;
            case NE -> ComparisonOperator.NE;
            case LT -> ComparisonOperator.LT;
            case LTE -> ComparisonOperator.LTE;
            case GT -> ComparisonOperator.GT;
            case GTE -> ComparisonOperator.GTE;
            case IN -> ComparisonOperator.IN;
            default -> null;
        };
    }
}
