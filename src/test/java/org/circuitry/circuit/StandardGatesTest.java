package org.circuitry.circuit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class StandardGatesTest {

    @Test
    void primitivesHaveNoDefinition() {
        assertThat(StandardGates.ccx().numQubits()).isEqualTo(3);
        assertThat(StandardGates.ccx().definition()).isEmpty();
        assertThat(StandardGates.rz(ParameterValue.of(0.5)).params()).containsExactly(new Constant(0.5));
        assertThat(StandardGates.cu(ParameterValue.of(1), ParameterValue.of(2), ParameterValue.of(3), ParameterValue.of(4))
                .params()).hasSize(4);
    }

    @Test
    void universalGateIsRecognised() {
        assertThat(StandardGates.u(0.1, 0.2, 0.3).isUniversal()).isTrue();
        assertThat(StandardGates.u3(ParameterValue.of(0.1), ParameterValue.of(0.2), ParameterValue.of(0.3)).isUniversal()).isFalse();
        assertThat(new Gate("u", 1, List.of()).isUniversal()).isFalse();
    }

    @Test
    void withCtrlState_closedControlReturnsTheGateItself() {
        Gate ch = StandardGates.ch();

        assertThat(StandardGates.withCtrlState(ch, 1, 1)).isSameAs(ch);
    }

    @Test
    void withCtrlState_openControlWrapsTheGateInFlips() {
        Gate open = StandardGates.withCtrlState(StandardGates.ch(), 1, 0);

        assertThat(open.name()).isEqualTo("ch_o0");
        assertThat(open.numQubits()).isEqualTo(2);
        assertThat(open.definition()).hasValueSatisfying(d -> assertThat(d.body())
                .extracting(i -> i.operation().name())
                .containsExactly("x", "ch", "x"));
    }

    @Test
    void withCtrlState_controlledParametersBecomeFormals() {
        Parameter theta = new Parameter("theta");

        Gate open = StandardGates.withCtrlState(StandardGates.crx(theta), 1, 0);

        Definition definition = open.definition().orElseThrow();
        assertThat(open.params()).containsExactly(theta);
        assertThat(definition.parameters()).containsExactly(new Parameter("p0"));
        assertThat(definition.body().get(1).operation().params()).containsExactly(new Parameter("p0"));
    }

    @Test
    void withCtrlState_flipsOnlyOpenControls() {
        Gate open = StandardGates.withCtrlState(StandardGates.ccx(), 2, 0b01);

        Definition definition = open.definition().orElseThrow();
        Qubit secondControl = definition.qubits().get(1);
        assertThat(open.name()).isEqualTo("ccx_o1");
        assertThat(definition.body()).hasSize(3);
        assertThat(definition.body().get(0).qubits()).containsExactly(secondControl);
    }

    @Test
    void withCtrlState_rejectsInvalidArguments() {
        assertThatThrownBy(() -> StandardGates.withCtrlState(StandardGates.ch(), 2, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StandardGates.withCtrlState(StandardGates.ch(), 1, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
