package org.circuitry.circuit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CircuitTest {

    @Test
    void withSize_createsDefaultRegisters() {
        Circuit circuit = Circuit.withSize("c", 3, 2);

        assertThat(circuit.qregs()).singleElement().satisfies(r -> {
            assertThat(r.name()).isEqualTo("q");
            assertThat(r.size()).isEqualTo(3);
        });
        assertThat(circuit.cregs()).singleElement().extracting(ClassicalRegister::name).isEqualTo("c");
        assertThat(circuit.qubits()).hasSize(3);
        assertThat(circuit.clbit(1)).isSameAs(circuit.cregs().get(0).get(1));
    }

    @Test
    void withSize_zeroSizedRegistersAreOmitted() {
        Circuit circuit = Circuit.withSize("c", 1, 0);

        assertThat(circuit.cregs()).isEmpty();
    }

    @Test
    void addRegister_rejectsDuplicateNames() {
        Circuit circuit = new Circuit("c").addRegister(new QuantumRegister(1, "r"));

        assertThatThrownBy(() -> circuit.addRegister(new ClassicalRegister(1, "r")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'r'");
    }

    @Test
    void bitsBelongToTheirRegister() {
        QuantumRegister qr = new QuantumRegister(2, "qr");

        assertThat(qr.get(1).register()).containsSame(qr);
        assertThat(qr.get(1).index()).isEqualTo(1);
        assertThat(qr.get(1)).hasToString("qr[1]");
        assertThat(Qubit.physical(4).register()).isEmpty();
        assertThat(Qubit.physical(4)).hasToString("$4");
    }

    @Test
    void append_checksArity() {
        Circuit circuit = Circuit.withSize("c", 2, 0);

        assertThatThrownBy(() -> circuit.append(StandardGates.cx(), circuit.qubit(0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'cx'");
    }

    @Test
    void cIf_conditionsTheLastInstruction() {
        Circuit circuit = Circuit.withSize("c", 1, 1);
        ClassicalRegister cr = circuit.cregs().get(0);

        circuit.h(circuit.qubit(0)).x(circuit.qubit(0)).cIf(cr, 1);

        assertThat(circuit.instructions().get(0).isConditioned()).isFalse();
        CircuitInstruction last = circuit.instructions().get(1);
        assertThat(last.condition()).isEqualTo(new Condition(cr, Comparison.EQUAL, 1));
        assertThat(last.withoutCondition().operation()).isSameAs(last.operation());
        assertThat(last.withoutCondition().isConditioned()).isFalse();
    }

    @Test
    void cIf_withoutInstructions_throws() {
        Circuit circuit = Circuit.withSize("c", 1, 1);

        assertThatThrownBy(() -> circuit.cIf(circuit.clbit(0), 1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void barrier_withoutArguments_coversEveryQubit() {
        Circuit circuit = new Circuit("c")
                .addRegister(new QuantumRegister(1, "a"))
                .addRegister(new QuantumRegister(2, "b"));

        circuit.barrier();

        CircuitInstruction barrier = circuit.instructions().get(0);
        assertThat(barrier.operation().numQubits()).isEqualTo(3);
        assertThat(barrier.qubits()).containsExactlyElementsOf(circuit.qubits());
    }

    @Test
    void parameters_areTopLevelFreeSymbolsSortedByName() {
        Circuit circuit = Circuit.withSize("c", 1, 0);
        circuit.rz(new Parameter("z"), circuit.qubit(0));
        circuit.rx(new Parameter("a"), circuit.qubit(0));
        circuit.rz(new Parameter("z"), circuit.qubit(0));
        circuit.p(0.5, circuit.qubit(0));

        assertThat(circuit.parameters()).extracting(Parameter::name).containsExactly("a", "z");
    }

    @Test
    void toGate_snapshotsTheBody() {
        Circuit body = Circuit.withSize("g", 1, 0);
        body.rz(new Parameter("t"), body.qubit(0));

        Gate gate = body.toGate();
        body.h(body.qubit(0));

        assertThat(gate.name()).isEqualTo("g");
        assertThat(gate.params()).containsExactly(new Parameter("t"));
        assertThat(gate.definition()).hasValueSatisfying(d -> {
            assertThat(d.body()).hasSize(1);
            assertThat(d.parameters()).containsExactly(new Parameter("t"));
        });
    }

    @Test
    void withParams_mustMatchTheFormalParameters() {
        Circuit body = Circuit.withSize("g", 1, 0);
        body.rz(new Parameter("a"), body.qubit(0));
        body.rx(new Parameter("b"), body.qubit(0));
        Gate gate = body.toGate();

        assertThat(gate.withParams(List.of(ParameterValue.of(1.0), ParameterValue.of(2.0))).params()).hasSize(2);
        assertThatThrownBy(() -> gate.withParams(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'g' expects 2 parameters, got 0");
    }

    @Test
    void compositeConstructors_checkParameterArity() {
        Circuit body = Circuit.withSize("s", 1, 0);
        body.rz(new Parameter("a"), body.qubit(0));
        Definition definition = body.toSubroutine().definition().orElseThrow();

        assertThatThrownBy(() -> new Subroutine("s", 1, 0, List.of(), definition))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Gate("s", 1, List.of(ParameterValue.of(1.0), ParameterValue.of(2.0)), definition))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new Gate("opaque", 1, List.of(ParameterValue.of(1.0))).definition()).isEmpty();
    }

    @Test
    void toGate_rejectsClassicalBits() {
        Circuit body = Circuit.withSize("g", 1, 1);

        assertThatThrownBy(body::toGate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void toGate_rejectsMeasurement() {
        Circuit body = Circuit.withSize("g", 1, 0);
        body.append(new Measure(), List.of(body.qubit(0)), List.of(Clbit.loose(0)));

        assertThatThrownBy(body::toGate).isInstanceOf(IllegalStateException.class).hasMessageContaining("measure");
    }

    @Test
    void toSubroutine_keepsClassicalBits() {
        Circuit body = Circuit.withSize("s", 2, 1);
        body.measure(body.qubit(0), body.clbit(0));

        Subroutine subroutine = body.toSubroutine();

        assertThat(subroutine.numQubits()).isEqualTo(2);
        assertThat(subroutine.numClbits()).isEqualTo(1);
        assertThat(subroutine.definition()).isPresent();
    }
}
