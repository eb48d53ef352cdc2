package org.circuitry.qasm3.ast;

import java.util.List;

/**
 * {@code gate <name>(<params>) <qubits> { ... }}. The parameter list is omitted when empty.
 */
public record GateDefinition(Identifier name, List<Identifier> params, List<Identifier> qubits, QuantumBlock body)
        implements Statement {

    public GateDefinition {
        params = List.copyOf(params);
        qubits = List.copyOf(qubits);
    }

    @Override
    public String prefix() {
        StringBuilder sb = new StringBuilder("gate ").append(name.qasm());
        if (!params.isEmpty()) {
            sb.append('(').append(Expressions.join(params)).append(')');
        }
        return sb.append(' ').append(Expressions.join(qubits)).append(' ').toString();
    }

    @Override
    public List<QuantumBlock> getChildren() {
        return List.of(body);
    }
}
