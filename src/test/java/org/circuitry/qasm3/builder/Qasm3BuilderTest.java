package org.circuitry.qasm3.builder;

import org.circuitry.circuit.Circuit;
import org.circuitry.circuit.CircuitInstruction;
import org.circuitry.circuit.Definition;
import org.circuitry.circuit.Gate;
import org.circuitry.circuit.Parameter;
import org.circuitry.circuit.QuantumRegister;
import org.circuitry.circuit.Qubit;
import org.circuitry.circuit.StandardGates;
import org.circuitry.qasm3.ExportErrorCode;
import org.circuitry.qasm3.ExportException;
import org.circuitry.qasm3.ExporterOptions;
import org.circuitry.qasm3.ast.BitDeclaration;
import org.circuitry.qasm3.ast.BranchingStatement;
import org.circuitry.qasm3.ast.GateCall;
import org.circuitry.qasm3.ast.GateDefinition;
import org.circuitry.qasm3.ast.InputDeclaration;
import org.circuitry.qasm3.ast.Program;
import org.circuitry.qasm3.ast.QubitDeclaration;
import org.circuitry.qasm3.ast.Statement;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@Tag("unit")
class Qasm3BuilderTest {

    private final ExporterOptions options = ExporterOptions.builder()
            .includes(List.of("stdgates.inc"))
            .includeVocabulary("stdgates.inc", List.of("h", "x", "cx", "rz"))
            .build();

    @Test
    void buildProgram_statementsFollowTheProgramLayout() throws ExportException {
        Circuit body = Circuit.withSize("g", 1, 0);
        body.h(body.qubit(0));
        Circuit circuit = Circuit.withSize("circuit", 1, 1);
        circuit.append(body.toGate(), circuit.qubit(0));
        circuit.rz(new Parameter("t"), circuit.qubit(0));
        circuit.x(circuit.qubit(0)).cIf(circuit.cregs().get(0), 1);

        Program program = new Qasm3Builder(circuit, options).buildProgram();

        assertThat(program.header().includes()).hasSize(1);
        assertThat(program.statements()).extracting(s -> s.getClass().getSimpleName()).containsExactly(
                GateDefinition.class.getSimpleName(),
                InputDeclaration.class.getSimpleName(),
                BitDeclaration.class.getSimpleName(),
                QubitDeclaration.class.getSimpleName(),
                GateCall.class.getSimpleName(),
                GateCall.class.getSimpleName(),
                BranchingStatement.class.getSimpleName());
    }

    @Test
    void buildProgram_definitionBodiesUseFlatNames() throws ExportException {
        Circuit body = new Circuit("g").addRegister(new QuantumRegister(2, "anc"));
        body.cx(body.qubit(0), body.qubit(1));
        Circuit circuit = Circuit.withSize("circuit", 2, 0);
        circuit.append(body.toGate(), circuit.qubit(1), circuit.qubit(0));

        Program program = new Qasm3Builder(circuit, options).buildProgram();

        GateDefinition definition = (GateDefinition) program.statements().get(0);
        assertThat(definition.prefix()).isEqualTo("gate g anc_0, anc_1 ");
        assertThat(definition.body().statements()).singleElement()
                .extracting(Statement::prefix).isEqualTo("cx anc_0, anc_1;\n");
        assertThat(program.statements().get(2).prefix()).isEqualTo("g q[1], q[0];\n");
    }

    @Test
    void buildProgram_registerlessQubitInDefinition_isMalformed() {
        QuantumRegister formals = new QuantumRegister(1, "q");
        Definition definition = new Definition("bad", List.of(formals), List.of(),
                List.of(new CircuitInstruction(StandardGates.h(), List.of(Qubit.physical(0)), List.of())));
        Circuit circuit = Circuit.withSize("circuit", 1, 0);
        circuit.append(new Gate("bad", 1, List.of(), definition), circuit.qubit(0));

        ExportException e = catchThrowableOfType(() -> new Qasm3Builder(circuit, options).buildProgram(), ExportException.class);

        assertThat(e.code()).isEqualTo(ExportErrorCode.MALFORMED_INPUT);
    }

    @Test
    void buildProgram_canOnlyRunOnce() throws ExportException {
        Qasm3Builder builder = new Qasm3Builder(Circuit.withSize("circuit", 1, 0), options);
        builder.buildProgram();

        assertThatThrownBy(builder::buildProgram).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void buildHeader_listsIncludesInOrder() {
        ExporterOptions twoIncludes = options.toBuilder().includes(List.of("stdgates.inc", "extra.inc")).build();

        assertThat(new Qasm3Builder(Circuit.withSize("circuit", 0, 0), twoIncludes).buildHeader().includes())
                .extracting(include -> include.filename())
                .containsExactly("stdgates.inc", "extra.inc");
    }
}
