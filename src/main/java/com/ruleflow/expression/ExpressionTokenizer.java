package com.ruleflow.expression;

import com.ruleflow.exception.CompileException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts an expression string into a sequence of tokens.
 * Identifiers may contain dots, so {@code risk.level} is a single IDENT token.
 */
public final class ExpressionTokenizer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "AND", TokenType.AND,
            "OR", TokenType.OR,
            "NOT", TokenType.NOT,
            "IN", TokenType.IN,
            "IS", TokenType.IS,
            "NULL", TokenType.NULL,
            "TRUE", TokenType.BOOLEAN,
            "FALSE", TokenType.BOOLEAN);

    private final String ruleId;
    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String ruleId, String input) {
        this.ruleId = ruleId;
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case '(' -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", null, start));
                }
                case ')' -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", null, start));
                }
                case '[' -> {
                    advance();
                    tokens.add(new Token(TokenType.LBRACKET, "[", null, start));
                }
                case ']' -> {
                    advance();
                    tokens.add(new Token(TokenType.RBRACKET, "]", null, start));
                }
                case ',' -> {
                    advance();
                    tokens.add(new Token(TokenType.COMMA, ",", null, start));
                }
                case ':' -> {
                    advance();
                    tokens.add(new Token(TokenType.COLON, ":", null, start));
                }
                case '=' -> {
                    advance();
                    String text = match('=') ? "==" : "=";
                    tokens.add(new Token(TokenType.EQ, text, null, start));
                }
                case '!' -> {
                    advance();
                    if (!match('=')) {
                        throw error("Unexpected '!'", start);
                    }
                    tokens.add(new Token(TokenType.NE, "!=", null, start));
                }
                case '>' -> {
                    advance();
                    tokens.add(match('=')
                            ? new Token(TokenType.GTE, ">=", null, start)
                            : new Token(TokenType.GT, ">", null, start));
                }
                case '<' -> {
                    advance();
                    tokens.add(match('=')
                            ? new Token(TokenType.LTE, "<=", null, start)
                            : new Token(TokenType.LT, "<", null, start));
                }
                case '"', '\'' -> tokens.add(readString());
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else if (isNumberStart(c)) {
                        tokens.add(readNumber());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        if (text.endsWith(".") || text.contains("..")) {
            throw error("Malformed field reference '" + text + "'", start);
        }

        TokenType keyword = KEYWORDS.get(text.toUpperCase());
        if (keyword == TokenType.BOOLEAN) {
            return new Token(keyword, text, Boolean.parseBoolean(text.toLowerCase()), start);
        }
        if (keyword != null) {
            return new Token(keyword, text, null, start);
        }
        return new Token(TokenType.IDENT, text, text, start);
    }

    private Token readNumber() {
        int start = pos;
        if (peek() == '-') {
            advance();
        }
        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }
        if (!isAtEnd() && peek() == '.') {
            advance();
            while (!isAtEnd() && Character.isDigit(peek())) {
                advance();
            }
        }

        String text = input.substring(start, pos);
        try {
            Object number = text.contains(".") ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
            return new Token(TokenType.NUMBER, text, number, start);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
    }

    private Token readString() {
        int start = pos;
        char quote = advance();
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string", start);
        }
        advance();
        return new Token(TokenType.STRING, sb.toString(), sb.toString(), start);
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$';
    }

    private boolean isNumberStart(char c) {
        if (Character.isDigit(c)) {
            return true;
        }
        return c == '-' && pos + 1 < length && Character.isDigit(input.charAt(pos + 1));
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private CompileException error(String message, int position) {
        return new CompileException(ruleId, position, message + " in '" + input + "'");
    }
}
