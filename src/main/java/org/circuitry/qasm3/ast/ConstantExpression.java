package org.circuitry.qasm3.ast;

import java.util.Objects;

/**
 * A pre-rendered numeric expression such as {@code 0.3}, {@code pi/2} or {@code -5*pi}.
 *
 * @param text The rendered value.
 */
public record ConstantExpression(String text) implements Expression {

    public ConstantExpression {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String qasm() {
        return text;
    }
}
