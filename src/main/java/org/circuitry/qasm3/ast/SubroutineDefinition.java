package org.circuitry.qasm3.ast;

import java.util.List;

/**
 * {@code def <name>(<classical args>) <quantum args> { ... return; }}. The classical argument list
 * is omitted when empty.
 */
public record SubroutineDefinition(
        Identifier name,
        List<ClassicalArgument> classicalArguments,
        List<QuantumArgument> quantumArguments,
        SubroutineBlock body
) implements Statement {

    public SubroutineDefinition {
        classicalArguments = List.copyOf(classicalArguments);
        quantumArguments = List.copyOf(quantumArguments);
    }

    @Override
    public String prefix() {
        StringBuilder sb = new StringBuilder("def ").append(name.qasm());
        if (!classicalArguments.isEmpty()) {
            sb.append('(').append(Expressions.join(classicalArguments)).append(')');
        }
        return sb.append(' ').append(Expressions.join(quantumArguments)).append(' ').toString();
    }

    @Override
    public List<SubroutineBlock> getChildren() {
        return List.of(body);
    }
}
