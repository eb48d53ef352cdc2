package org.circuitry.qasm3.ast;

import java.util.List;

/**
 * {@code <gate>(<params>) <operands>;}
 */
public record GateCall(Identifier name, List<Expression> params, List<IndexedIdentifier> operands) implements Statement {

    public GateCall {
        params = List.copyOf(params);
        operands = List.copyOf(operands);
    }

    @Override
    public String prefix() {
        return Expressions.call(name, params, operands);
    }
}
