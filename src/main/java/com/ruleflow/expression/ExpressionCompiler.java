package com.ruleflow.expression;

import com.ruleflow.exception.CompileException;
import org.springframework.stereotype.Component;

/**
 * Compiles condition and action expression strings into their parsed forms.
 * Stateless; compiled results are immutable and may be cached freely.
 */
@Component
public class ExpressionCompiler {

    /**
     * Compile a condition. A null or blank condition compiles to {@code true}
     * (catch-all rule). Error positions index into {@code condition} as stored,
     * surrounding whitespace included.
     *
     * @throws CompileException on syntax error
     */
    public Expression compileCondition(String ruleId, String condition) {
        if (condition == null || condition.isBlank()) {
            return Expression.TRUE;
        }
        return new ExpressionParser(ruleId, condition,
                new ExpressionTokenizer(ruleId, condition).tokenize()).parse();
    }

    /**
     * Compile an action expression into a name plus arguments.
     *
     * @throws CompileException on syntax error
     */
    public ActionCall compileAction(String ruleId, String action) {
        if (action == null || action.isBlank()) {
            throw new CompileException(ruleId, -1, "Action expression is empty");
        }
        return new ActionParser(ruleId, action).parse();
    }
}
