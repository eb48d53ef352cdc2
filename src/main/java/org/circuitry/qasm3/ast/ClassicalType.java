package org.circuitry.qasm3.ast;

/**
 * A sized classical type such as {@code float[32]}.
 *
 * @param keyword The type keyword.
 * @param designator The bit width.
 */
public record ClassicalType(String keyword, Designator designator) implements Expression {

    public static ClassicalType float32() {
        return new ClassicalType("float", Designator.of(32));
    }

    @Override
    public String qasm() {
        return keyword + designator.qasm();
    }
}
