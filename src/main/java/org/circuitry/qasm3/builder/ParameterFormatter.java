package org.circuitry.qasm3.builder;

import org.circuitry.circuit.Constant;
import org.circuitry.circuit.Parameter;
import org.circuitry.circuit.ParameterValue;
import org.circuitry.qasm3.ast.ConstantExpression;
import org.circuitry.qasm3.ast.Expression;
import org.circuitry.qasm3.ast.Identifier;

/**
 * Renders parameter values. Free parameters render as their name. Constants that are a rational
 * multiple {@code n*pi/d} of pi render symbolically ({@code pi}, {@code -pi/2}, {@code 3*pi/4})
 * when folding is enabled; every other constant renders as a decimal literal.
 */
public final class ParameterFormatter {

    private static final double EPSILON = 1e-9;
    private static final int MAX_DENOMINATOR = 16;
    private static final int MAX_NUMERATOR_PER_DENOMINATOR = 64;

    private final boolean foldConstants;

    /**
     * @param foldConstants {@code false} forces decimal rendering of every constant.
     */
    public ParameterFormatter(boolean foldConstants) {
        this.foldConstants = foldConstants;
    }

    public Expression toExpression(ParameterValue value) {
        if (value instanceof Parameter parameter) {
            return new Identifier(parameter.name());
        }
        return new ConstantExpression(formatConstant(((Constant) value).value()));
    }

    /**
     * @param value A real number.
     * @return Its rendering.
     */
    public String formatConstant(double value) {
        if (!foldConstants || Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (Math.abs(value) < EPSILON) {
            return "0";
        }
        double ratio = value / Math.PI;
        // the first matching denominator is the smallest, so n/d is already reduced
        for (int denominator = 1; denominator <= MAX_DENOMINATOR; denominator++) {
            double scaled = ratio * denominator;
            long numerator = Math.round(scaled);
            if (numerator != 0
                    && Math.abs(scaled - numerator) < EPSILON
                    && Math.abs(numerator) <= (long) MAX_NUMERATOR_PER_DENOMINATOR * denominator) {
                return piMultiple(numerator, denominator);
            }
        }
        return Double.toString(value);
    }

    private static String piMultiple(long numerator, int denominator) {
        String text;
        if (numerator == 1) {
            text = "pi";
        } else if (numerator == -1) {
            text = "-pi";
        } else {
            text = numerator + "*pi";
        }
        return denominator == 1 ? text : text + "/" + denominator;
    }
}
