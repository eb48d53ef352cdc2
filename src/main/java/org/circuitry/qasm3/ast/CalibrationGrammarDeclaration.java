package org.circuitry.qasm3.ast;

/**
 * {@code defcalgrammar "<name>";}, emitted for opaque operations whose implementation is left to
 * the backend.
 */
public record CalibrationGrammarDeclaration(Identifier name) implements Statement {

    @Override
    public String prefix() {
        return "defcalgrammar \"" + name.qasm() + "\";\n";
    }
}
