package org.circuitry.circuit;

import java.util.ArrayList;
import java.util.List;

/**
 * Factories for the primitive gates of the standard library. Every call returns a new body-less
 * {@link Gate}; exporters recognise these by name.
 */
public final class StandardGates {

    private StandardGates() {}

    public static Gate u(double theta, double phi, double lambda) {
        return u(ParameterValue.of(theta), ParameterValue.of(phi), ParameterValue.of(lambda));
    }

    /**
     * The universal one-qubit gate {@code U(θ, φ, λ)}.
     */
    public static Gate u(ParameterValue theta, ParameterValue phi, ParameterValue lambda) {
        return new Gate(Gate.UNIVERSAL_NAME, 1, List.of(theta, phi, lambda));
    }

    public static Gate id() { return fixed("id", 1); }
    public static Gate x() { return fixed("x", 1); }
    public static Gate y() { return fixed("y", 1); }
    public static Gate z() { return fixed("z", 1); }
    public static Gate h() { return fixed("h", 1); }
    public static Gate s() { return fixed("s", 1); }
    public static Gate sdg() { return fixed("sdg", 1); }
    public static Gate t() { return fixed("t", 1); }
    public static Gate tdg() { return fixed("tdg", 1); }
    public static Gate sx() { return fixed("sx", 1); }
    public static Gate cx() { return fixed("cx", 2); }
    public static Gate cy() { return fixed("cy", 2); }
    public static Gate cz() { return fixed("cz", 2); }
    public static Gate ch() { return fixed("ch", 2); }
    public static Gate swap() { return fixed("swap", 2); }
    public static Gate ccx() { return fixed("ccx", 3); }
    public static Gate cswap() { return fixed("cswap", 3); }

    public static Gate p(ParameterValue lambda) { return rotation("p", 1, lambda); }
    public static Gate rx(ParameterValue theta) { return rotation("rx", 1, theta); }
    public static Gate ry(ParameterValue theta) { return rotation("ry", 1, theta); }
    public static Gate rz(ParameterValue phi) { return rotation("rz", 1, phi); }
    public static Gate u1(ParameterValue lambda) { return rotation("u1", 1, lambda); }
    public static Gate cp(ParameterValue lambda) { return rotation("cp", 2, lambda); }
    public static Gate crx(ParameterValue theta) { return rotation("crx", 2, theta); }
    public static Gate cry(ParameterValue theta) { return rotation("cry", 2, theta); }
    public static Gate crz(ParameterValue theta) { return rotation("crz", 2, theta); }

    public static Gate u2(ParameterValue phi, ParameterValue lambda) {
        return new Gate("u2", 1, List.of(phi, lambda));
    }

    public static Gate u3(ParameterValue theta, ParameterValue phi, ParameterValue lambda) {
        return new Gate("u3", 1, List.of(theta, phi, lambda));
    }

    public static Gate cu(ParameterValue theta, ParameterValue phi, ParameterValue lambda, ParameterValue gamma) {
        return new Gate("cu", 2, List.of(theta, phi, lambda, gamma));
    }

    /**
     * Builds an open-controlled variant of a controlled primitive. Control qubit {@code i} is
     * open when bit {@code i} of {@code ctrlState} is zero; open controls are wrapped in {@code x}
     * gates. The result is a composite gate named {@code <base>_o<ctrlState>}. Its definition takes
     * the parameters of {@code controlled} as formals {@code p0, p1, ...}; the returned gate is
     * called with the original values.
     *
     * @param controlled A controlled primitive, e.g. {@link #ch()}.
     * @param numCtrlQubits How many leading qubits of {@code controlled} are controls.
     * @param ctrlState The control state, little-endian over the control qubits.
     * @return {@code controlled} itself when every control is closed, otherwise the composite.
     */
    public static Gate withCtrlState(Gate controlled, int numCtrlQubits, int ctrlState) {
        if (numCtrlQubits < 1 || numCtrlQubits >= controlled.numQubits()) {
            throw new IllegalArgumentException("Gate '" + controlled.name() + "' cannot have "
                    + numCtrlQubits + " control qubits");
        }
        int allClosed = (1 << numCtrlQubits) - 1;
        if (ctrlState < 0 || ctrlState > allClosed) {
            throw new IllegalArgumentException("Control state " + ctrlState + " out of range for "
                    + numCtrlQubits + " control qubits");
        }
        if (ctrlState == allClosed) {
            return controlled;
        }

        QuantumRegister q = new QuantumRegister(controlled.numQubits(), "q");
        List<Parameter> formals = new ArrayList<>();
        for (int i = 0; i < controlled.params().size(); i++) {
            formals.add(new Parameter("p" + i));
        }
        List<CircuitInstruction> flips = new ArrayList<>();
        for (int i = 0; i < numCtrlQubits; i++) {
            if ((ctrlState & (1 << i)) == 0) {
                flips.add(new CircuitInstruction(x(), List.of(q.get(i)), List.of()));
            }
        }
        List<CircuitInstruction> body = new ArrayList<>(flips);
        body.add(new CircuitInstruction(controlled.withParams(new ArrayList<ParameterValue>(formals)), q.bits(), List.of()));
        body.addAll(flips);

        String name = controlled.name() + "_o" + ctrlState;
        Definition definition = new Definition(name, List.of(q), formals, body);
        return new Gate(name, controlled.numQubits(), controlled.params(), definition);
    }

    private static Gate fixed(String name, int numQubits) {
        return new Gate(name, numQubits, List.of());
    }

    private static Gate rotation(String name, int numQubits, ParameterValue angle) {
        return new Gate(name, numQubits, List.of(angle));
    }
}
