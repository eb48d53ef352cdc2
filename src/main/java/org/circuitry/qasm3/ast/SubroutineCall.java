package org.circuitry.qasm3.ast;

import java.util.List;

/**
 * A call of a {@code def} subroutine. Uses the same calling convention as a gate call.
 */
public record SubroutineCall(Identifier name, List<Expression> params, List<IndexedIdentifier> operands) implements Statement {

    public SubroutineCall {
        params = List.copyOf(params);
        operands = List.copyOf(operands);
    }

    @Override
    public String prefix() {
        return Expressions.call(name, params, operands);
    }
}
