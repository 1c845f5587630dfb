package com.ruleflow.expression;

import java.util.List;
import java.util.Map;

/**
 * Parsed form of an action expression: a target action name plus its
 * positional and named arguments. Argument values are literals, field
 * references or nested conditions. {@code prefixed} marks the {@code name:value}
 * form, whose single value is the only positional argument.
 */
public record ActionCall(String name,
                         List<Expression> positional,
                         Map<String, Expression> named,
                         boolean prefixed,
                         String source) {
}
