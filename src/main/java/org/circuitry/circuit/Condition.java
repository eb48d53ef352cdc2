package org.circuitry.circuit;

/**
 * A classical condition guarding an instruction: the instruction runs only when
 * {@code target <comparison> value} holds.
 *
 * @param target The register or bit that is compared. Producers may leave it {@code null};
 *               exporters reject such conditions.
 * @param comparison The relational operator.
 * @param value The integer the target is compared with.
 */
public record Condition(ConditionTarget target, Comparison comparison, long value) {

    /**
     * @param target The register or bit.
     * @param value The expected value.
     * @return The condition {@code target == value}.
     */
    public static Condition equalTo(ConditionTarget target, long value) {
        return new Condition(target, Comparison.EQUAL, value);
    }
}
