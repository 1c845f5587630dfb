package com.ruleflow.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses action expressions. Three forms are accepted:
 * <pre>
 * require_additional_approval                 bare action name
 * set_field('status', 'blocked')              call with positional arguments
 * notify(recipient = owner.email, subject = 'Review')
 * notify:user.email                           prefixed value
 * </pre>
 */
final class ActionParser {

    private final String input;
    private final ExpressionParser parser;

    ActionParser(String ruleId, String input) {
        this.input = input;
        this.parser = new ExpressionParser(ruleId, input,
                new ExpressionTokenizer(ruleId, input).tokenize());
    }

    ActionCall parse() {
        Token name = parser.expect(TokenType.IDENT, "Expected action name");
        List<Expression> positional = new ArrayList<>();
        Map<String, Expression> named = new LinkedHashMap<>();

        boolean prefixed = parser.match(TokenType.COLON);
        if (prefixed) {
            positional.add(parser.parseExpression());
        } else if (parser.match(TokenType.LPAREN)) {
            if (!parser.check(TokenType.RPAREN)) {
                do {
                    parseArgument(positional, named);
                } while (parser.match(TokenType.COMMA));
            }
            parser.expect(TokenType.RPAREN, "Expected ')' after action arguments");
        }

        parser.expect(TokenType.EOF, "Unexpected trailing input");
        return new ActionCall(name.text(), List.copyOf(positional), named, prefixed, input.trim());
    }

    private void parseArgument(List<Expression> positional, Map<String, Expression> named) {
        Token current = parser.peek();
        Token next = parser.peekAhead(1);
        boolean isNamed = current.type() == TokenType.IDENT
                && next.type() == TokenType.EQ
                && "=".equals(next.text());

        if (!isNamed) {
            if (!named.isEmpty()) {
                throw parser.error("Positional argument after named argument", current);
            }
            positional.add(parser.parseOperand());
            return;
        }

        parser.match(TokenType.IDENT);
        parser.match(TokenType.EQ);
        if (named.containsKey(current.text())) {
            throw parser.error("Duplicate argument '" + current.text() + "'", current);
        }
        named.put(current.text(), parser.parseOperand());
    }
}
