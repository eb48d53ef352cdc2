package org.circuitry.qasm3.ast;

import java.util.List;

/**
 * {@code if (<condition>){ ... }}. Conditions are single-branch; there is no {@code else}.
 *
 * @param condition The branch condition.
 * @param ifTrue The statements run when the condition holds.
 */
public record BranchingStatement(ComparisonExpression condition, ProgramBlock ifTrue) implements Statement {

    @Override
    public String prefix() {
        return "if (" + condition.qasm() + ")";
    }

    @Override
    public List<ProgramBlock> getChildren() {
        return List.of(ifTrue);
    }
}
