package com.ruleflow.expression;

/**
 * Token types produced by {@link ExpressionTokenizer}.
 */
public enum TokenType {
    // Literals and references
    IDENT,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,

    // Comparison
    EQ,
    NE,
    LT,
    LTE,
    GT,
    GTE,

    // Keywords
    AND,
    OR,
    NOT,
    IN,
    IS,

    // Punctuation
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    COLON,

    EOF
}
