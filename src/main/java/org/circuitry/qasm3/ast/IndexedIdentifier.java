package org.circuitry.qasm3.ast;

import java.util.List;

/**
 * An identifier with an optional index list, e.g. {@code qr[1]} or just {@code q_0}.
 *
 * @param identifier The base name.
 * @param indices The indices; empty renders the bare name.
 */
public record IndexedIdentifier(Identifier identifier, List<Expression> indices) implements Expression {

    public IndexedIdentifier {
        indices = List.copyOf(indices);
    }

    public static IndexedIdentifier of(String name) {
        return new IndexedIdentifier(new Identifier(name), List.of());
    }

    public static IndexedIdentifier of(String name, long index) {
        return new IndexedIdentifier(new Identifier(name), List.of(new IntegerLiteral(index)));
    }

    @Override
    public String qasm() {
        if (indices.isEmpty()) {
            return identifier.qasm();
        }
        return identifier.qasm() + "[" + Expressions.join(indices) + "]";
    }
}
