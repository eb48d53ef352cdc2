package org.circuitry.qasm3.ast;

import java.util.List;
import java.util.stream.Collectors;

final class Expressions {

    private Expressions() {}

    static String join(List<? extends Expression> expressions) {
        return expressions.stream().map(Expression::qasm).collect(Collectors.joining(", "));
    }

    /**
     * Renders {@code name(params) operands;} with the parameter list omitted when empty.
     */
    static String call(Identifier name, List<? extends Expression> params, List<IndexedIdentifier> operands) {
        StringBuilder sb = new StringBuilder(name.qasm());
        if (!params.isEmpty()) {
            sb.append('(').append(join(params)).append(')');
        }
        if (!operands.isEmpty()) {
            sb.append(' ').append(join(operands));
        }
        return sb.append(";\n").toString();
    }
}
