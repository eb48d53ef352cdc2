package org.circuitry.qasm3.builder;

import org.circuitry.circuit.Parameter;
import org.circuitry.circuit.ParameterValue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ParameterFormatterTest {

    private final ParameterFormatter folding = new ParameterFormatter(true);

    @ParameterizedTest
    @CsvSource({
            "1, 1, pi",
            "-1, 1, -pi",
            "1, 2, pi/2",
            "-1, 2, -pi/2",
            "3, 4, 3*pi/4",
            "2, 1, 2*pi",
            "-5, 1, -5*pi",
            "1, 3, pi/3",
            "2, 6, pi/3",
            "7, 16, 7*pi/16"
    })
    void formatConstant_rationalMultiplesOfPi(long numerator, int denominator, String expected) {
        assertThat(folding.formatConstant(numerator * Math.PI / denominator)).isEqualTo(expected);
    }

    @Test
    void formatConstant_zero() {
        assertThat(folding.formatConstant(0.0)).isEqualTo("0");
        assertThat(folding.formatConstant(-0.0)).isEqualTo("0");
    }

    @Test
    void formatConstant_plainNumbersStayDecimal() {
        assertThat(folding.formatConstant(0.3)).isEqualTo("0.3");
        assertThat(folding.formatConstant(1.0)).isEqualTo("1.0");
        assertThat(folding.formatConstant(Math.PI / 17)).doesNotContain("pi");
        assertThat(folding.formatConstant(100 * Math.PI)).doesNotContain("pi");
    }

    @Test
    void formatConstant_nonFiniteValues() {
        assertThat(folding.formatConstant(Double.NaN)).isEqualTo("NaN");
        assertThat(folding.formatConstant(Double.POSITIVE_INFINITY)).isEqualTo("Infinity");
    }

    @Test
    void formatConstant_foldingDisabled() {
        ParameterFormatter decimal = new ParameterFormatter(false);

        assertThat(decimal.formatConstant(Math.PI)).isEqualTo("3.141592653589793");
        assertThat(decimal.formatConstant(2 * Math.PI)).isEqualTo("6.283185307179586");
        assertThat(decimal.formatConstant(0.0)).isEqualTo("0.0");
    }

    @Test
    void toExpression_parameterRendersItsName() {
        assertThat(folding.toExpression(new Parameter("θ")).qasm()).isEqualTo("θ");
        assertThat(folding.toExpression(ParameterValue.of(Math.PI / 2)).qasm()).isEqualTo("pi/2");
    }
}
