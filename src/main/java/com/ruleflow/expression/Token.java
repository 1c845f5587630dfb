package com.ruleflow.expression;

/**
 * A token in a condition or action expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param literal  Parsed literal value (strings, numbers, booleans)
 * @param position Offset in the input string
 */
public record Token(TokenType type, String text, Object literal, int position) {

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
