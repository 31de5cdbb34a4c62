package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Guard condition: a bare expression string, or {@code {"not": expression}} when negated.
 */
public sealed interface IrGuard permits IrGuard.Expression, IrGuard.Not {

    record Expression(String expression) implements IrGuard {
        @Override
        @JsonValue
        public String expression() {
            return expression;
        }
    }

    record Not(String not) implements IrGuard {
    }
}
