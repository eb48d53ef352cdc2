package org.circuitry.qasm3.builder;

import org.circuitry.circuit.Barrier;
import org.circuitry.circuit.Circuit;
import org.circuitry.circuit.CircuitInstruction;
import org.circuitry.circuit.ClassicalRegister;
import org.circuitry.circuit.Clbit;
import org.circuitry.circuit.Comparison;
import org.circuitry.circuit.Condition;
import org.circuitry.circuit.Definition;
import org.circuitry.circuit.Gate;
import org.circuitry.circuit.Measure;
import org.circuitry.circuit.Operation;
import org.circuitry.circuit.OperationVisitor;
import org.circuitry.circuit.Parameter;
import org.circuitry.circuit.ParameterValue;
import org.circuitry.circuit.QuantumRegister;
import org.circuitry.circuit.Qubit;
import org.circuitry.circuit.Subroutine;
import org.circuitry.qasm3.ExportErrorCode;
import org.circuitry.qasm3.ExportException;
import org.circuitry.qasm3.ExporterOptions;
import org.circuitry.qasm3.ast.BitDeclaration;
import org.circuitry.qasm3.ast.BranchingStatement;
import org.circuitry.qasm3.ast.CalibrationGrammarDeclaration;
import org.circuitry.qasm3.ast.ClassicalArgument;
import org.circuitry.qasm3.ast.ClassicalType;
import org.circuitry.qasm3.ast.ComparisonExpression;
import org.circuitry.qasm3.ast.Designator;
import org.circuitry.qasm3.ast.Expression;
import org.circuitry.qasm3.ast.GateCall;
import org.circuitry.qasm3.ast.GateDefinition;
import org.circuitry.qasm3.ast.Header;
import org.circuitry.qasm3.ast.Identifier;
import org.circuitry.qasm3.ast.Include;
import org.circuitry.qasm3.ast.IndexedIdentifier;
import org.circuitry.qasm3.ast.InputDeclaration;
import org.circuitry.qasm3.ast.IntegerLiteral;
import org.circuitry.qasm3.ast.MeasurementAssignment;
import org.circuitry.qasm3.ast.Program;
import org.circuitry.qasm3.ast.ProgramBlock;
import org.circuitry.qasm3.ast.QuantumArgument;
import org.circuitry.qasm3.ast.QuantumBarrier;
import org.circuitry.qasm3.ast.QuantumBlock;
import org.circuitry.qasm3.ast.QuantumMeasurement;
import org.circuitry.qasm3.ast.QubitDeclaration;
import org.circuitry.qasm3.ast.RelationalOperator;
import org.circuitry.qasm3.ast.ReturnStatement;
import org.circuitry.qasm3.ast.Statement;
import org.circuitry.qasm3.ast.SubroutineBlock;
import org.circuitry.qasm3.ast.SubroutineCall;
import org.circuitry.qasm3.ast.SubroutineDefinition;
import org.circuitry.qasm3.ast.Version;
import org.circuitry.qasm3.hoist.DeclarationHoister;
import org.circuitry.qasm3.hoist.HoistedDeclaration;
import org.circuitry.qasm3.namespace.GlobalNamespace;
import org.circuitry.qasm3.namespace.OperationArena;
import org.circuitry.qasm3.namespace.StandardGateVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts one circuit into an OpenQASM 3 tree.
 * <p>
 * The program is laid out as: header, definition blocks in dependency order, input declarations
 * for free parameters, bit declarations, qubit declarations, then the lowered instructions. A
 * builder owns the namespace of its export and can build only once; it is not thread-safe.
 */
public final class Qasm3Builder {

    private static final Logger LOGGER = LoggerFactory.getLogger(Qasm3Builder.class);

    private static final String VERSION = "3";

    private final Circuit circuit;
    private final ExporterOptions options;
    private final GlobalNamespace namespace;
    private final ParameterFormatter formatter;
    private boolean built = false;

    public Qasm3Builder(Circuit circuit, ExporterOptions options) {
        this.circuit = circuit;
        this.options = options;
        this.namespace = new GlobalNamespace(StandardGateVocabulary.resolve(options), new OperationArena());
        this.formatter = new ParameterFormatter(options.foldConstants());
    }

    /**
     * Builds the program tree.
     *
     * @return The complete program.
     * @throws ExportException if an instruction cannot be lowered or the circuit is malformed.
     * @throws IllegalStateException if called a second time.
     */
    public Program buildProgram() throws ExportException {
        if (built) {
            throw new IllegalStateException("Qasm3Builder for circuit '" + circuit.name() + "' was already used");
        }
        built = true;

        List<HoistedDeclaration> declarations = new DeclarationHoister(namespace).hoist(circuit.instructions());

        List<Statement> statements = new ArrayList<>();
        statements.addAll(buildDefinitions(declarations));
        statements.addAll(buildInputDeclarations());
        statements.addAll(buildBitDeclarations());
        statements.addAll(buildQubitDeclarations());
        statements.addAll(buildQuantumInstructions(circuit.instructions(), RenderMode.INDEXED));

        LOGGER.debug("Built program for '{}': {} definitions, {} statements",
                circuit.name(), declarations.size(), statements.size());
        return new Program(buildHeader(), statements);
    }

    Header buildHeader() {
        List<Include> includes = new ArrayList<>();
        for (String file : options.includes()) {
            includes.add(new Include(file));
        }
        return new Header(new Version(VERSION), includes);
    }

    private List<Statement> buildDefinitions(List<HoistedDeclaration> declarations) throws ExportException {
        List<Statement> definitions = new ArrayList<>();
        for (HoistedDeclaration declaration : declarations) {
            definitions.add(buildDefinition(declaration));
        }
        return definitions;
    }

    private Statement buildDefinition(HoistedDeclaration declaration) throws ExportException {
        return switch (declaration.kind()) {
            case OPAQUE -> new CalibrationGrammarDeclaration(new Identifier(declaration.name()));
            case GATE -> buildGateDefinition(declaration.name(), definitionOf(declaration.operation()));
            case SUBROUTINE -> buildSubroutineDefinition(declaration.name(), definitionOf(declaration.operation()));
        };
    }

    private static Definition definitionOf(Operation operation) throws ExportException {
        Optional<Definition> definition = operation.definition();
        if (definition.isEmpty()) {
            throw new ExportException(ExportErrorCode.MALFORMED_INPUT,
                    "Composite operation '" + operation.name() + "' lost its definition");
        }
        return definition.get();
    }

    private GateDefinition buildGateDefinition(String name, Definition definition) throws ExportException {
        List<Identifier> params = new ArrayList<>();
        for (Parameter parameter : definition.parameters()) {
            params.add(new Identifier(parameter.name()));
        }
        List<Identifier> qubits = new ArrayList<>();
        for (Qubit qubit : definition.qubits()) {
            qubits.add(buildQubitIdentifier(qubit, RenderMode.FLAT).identifier());
        }
        QuantumBlock body = new QuantumBlock(buildQuantumInstructions(definition.body(), RenderMode.FLAT));
        return new GateDefinition(new Identifier(name), params, qubits, body);
    }

    /**
     * Builds a {@code def} block. Its signature carries float parameters and qubits only, so a body
     * that measures or branches on classical bits is rejected while it is lowered.
     */
    private SubroutineDefinition buildSubroutineDefinition(String name, Definition definition) throws ExportException {
        List<ClassicalArgument> classicalArguments = new ArrayList<>();
        for (Parameter parameter : definition.parameters()) {
            classicalArguments.add(new ClassicalArgument(ClassicalType.float32(), new Identifier(parameter.name())));
        }
        List<QuantumArgument> quantumArguments = new ArrayList<>();
        for (Qubit qubit : definition.qubits()) {
            quantumArguments.add(new QuantumArgument(buildQubitIdentifier(qubit, RenderMode.FLAT).identifier()));
        }
        SubroutineBlock body = new SubroutineBlock(
                buildQuantumInstructions(definition.body(), RenderMode.FLAT), new ReturnStatement());
        return new SubroutineDefinition(new Identifier(name), classicalArguments, quantumArguments, body);
    }

    private List<Statement> buildInputDeclarations() {
        List<Statement> inputs = new ArrayList<>();
        for (Parameter parameter : circuit.parameters()) {
            inputs.add(new InputDeclaration(ClassicalType.float32(), new Identifier(parameter.name())));
        }
        return inputs;
    }

    private List<Statement> buildBitDeclarations() {
        List<Statement> declarations = new ArrayList<>();
        for (ClassicalRegister creg : circuit.cregs()) {
            declarations.add(new BitDeclaration(new Identifier(creg.name()), Designator.of(creg.size())));
        }
        return declarations;
    }

    private List<Statement> buildQubitDeclarations() {
        List<Statement> declarations = new ArrayList<>();
        for (QuantumRegister qreg : circuit.qregs()) {
            declarations.add(new QubitDeclaration(new Identifier(qreg.name()), Designator.of(qreg.size())));
        }
        return declarations;
    }

    List<Statement> buildQuantumInstructions(List<CircuitInstruction> instructions, RenderMode mode) throws ExportException {
        List<Statement> statements = new ArrayList<>(instructions.size());
        for (CircuitInstruction instruction : instructions) {
            statements.add(buildQuantumInstruction(instruction, mode));
        }
        return statements;
    }

    private Statement buildQuantumInstruction(CircuitInstruction instruction, RenderMode mode) throws ExportException {
        if (instruction.isConditioned()) {
            if (mode == RenderMode.FLAT) {
                throw new ExportException(ExportErrorCode.UNSUPPORTED_CONSTRUCT,
                        "Conditioned '" + instruction.operation().name()
                                + "' inside a definition body cannot be exported: definitions take no classical arguments");
            }
            ComparisonExpression condition = buildEqCondition(instruction, mode);
            ProgramBlock ifTrue = new ProgramBlock(List.of(buildQuantumInstruction(instruction.withoutCondition(), mode)));
            return new BranchingStatement(condition, ifTrue);
        }
        return instruction.operation().accept(new InstructionLowering(instruction, mode));
    }

    private ComparisonExpression buildEqCondition(CircuitInstruction instruction, RenderMode mode) throws ExportException {
        Condition condition = instruction.condition();
        if (condition.target() == null) {
            throw new ExportException(ExportErrorCode.MALFORMED_INPUT,
                    "Condition of '" + instruction.operation().name() + "' has no target: " + instruction);
        }
        if (condition.comparison() != Comparison.EQUAL) {
            throw new ExportException(ExportErrorCode.UNSUPPORTED_CONSTRUCT,
                    "Only equality conditions can be exported, got " + condition.comparison() + " on '"
                            + instruction.operation().name() + "': " + instruction);
        }

        Expression left;
        if (condition.target() instanceof ClassicalRegister register) {
            left = new Identifier(register.name());
        } else {
            left = buildClbitIdentifier((Clbit) condition.target(), mode);
        }
        return new ComparisonExpression(left, RelationalOperator.EQUALS, new IntegerLiteral(condition.value()));
    }

    private IndexedIdentifier buildQubitIdentifier(Qubit qubit, RenderMode mode) throws ExportException {
        Optional<QuantumRegister> register = qubit.register();
        if (register.isPresent()) {
            return mode.bit(register.get().name(), qubit.index());
        }
        if (mode == RenderMode.FLAT) {
            throw new ExportException(ExportErrorCode.MALFORMED_INPUT,
                    "Formal qubit " + qubit + " of a definition belongs to no register");
        }
        return IndexedIdentifier.of("$" + qubit.index());
    }

    private IndexedIdentifier buildClbitIdentifier(Clbit clbit, RenderMode mode) throws ExportException {
        Optional<ClassicalRegister> register = clbit.register();
        if (register.isEmpty()) {
            throw new ExportException(ExportErrorCode.MALFORMED_INPUT,
                    "Clbit " + clbit.index() + " belongs to no classical register");
        }
        return mode.bit(register.get().name(), clbit.index());
    }

    private List<IndexedIdentifier> buildQubitIdentifiers(List<Qubit> qubits, RenderMode mode) throws ExportException {
        List<IndexedIdentifier> identifiers = new ArrayList<>(qubits.size());
        for (Qubit qubit : qubits) {
            identifiers.add(buildQubitIdentifier(qubit, mode));
        }
        return identifiers;
    }

    private List<Expression> buildParameters(List<ParameterValue> params) {
        List<Expression> expressions = new ArrayList<>(params.size());
        for (ParameterValue param : params) {
            expressions.add(formatter.toExpression(param));
        }
        return expressions;
    }

    /**
     * Lowers one unconditioned instruction. The visitor makes every operation kind a required case.
     */
    private final class InstructionLowering implements OperationVisitor<Statement, ExportException> {

        private final CircuitInstruction instruction;
        private final RenderMode mode;

        InstructionLowering(CircuitInstruction instruction, RenderMode mode) {
            this.instruction = instruction;
            this.mode = mode;
        }

        @Override
        public Statement visitGate(Gate gate) throws ExportException {
            return new GateCall(
                    new Identifier(namespace.nameOf(gate)),
                    buildParameters(gate.params()),
                    buildQubitIdentifiers(instruction.qubits(), mode));
        }

        @Override
        public Statement visitBarrier(Barrier barrier) throws ExportException {
            return new QuantumBarrier(buildQubitIdentifiers(instruction.qubits(), mode));
        }

        @Override
        public Statement visitMeasure(Measure measure) throws ExportException {
            if (mode == RenderMode.FLAT) {
                throw new ExportException(ExportErrorCode.UNSUPPORTED_CONSTRUCT,
                        "Measurement inside a definition body cannot be exported: definitions take no classical arguments: "
                                + instruction);
            }
            if (instruction.qubits().size() != 1 || instruction.clbits().size() != 1) {
                throw new ExportException(ExportErrorCode.UNSUPPORTED_CONSTRUCT,
                        "A measurement assignment needs exactly one qubit and one clbit, got "
                                + instruction.qubits().size() + " and " + instruction.clbits().size() + ": " + instruction);
            }
            QuantumMeasurement measurement = new QuantumMeasurement(buildQubitIdentifiers(instruction.qubits(), mode));
            return new MeasurementAssignment(buildClbitIdentifier(instruction.clbits().get(0), mode), measurement);
        }

        @Override
        public Statement visitSubroutine(Subroutine subroutine) throws ExportException {
            return new SubroutineCall(
                    new Identifier(namespace.nameOf(subroutine)),
                    buildParameters(subroutine.params()),
                    buildQubitIdentifiers(instruction.qubits(), mode));
        }
    }
}
