package org.kidoni.calc.cli;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Renders results for the console. Values within {@code 10^-precision} of an integer print as that integer,
 * everything else with {@code precision} significant digits.
 */
public final class ResultFormatter {
    private ResultFormatter() {
    }

    public static String format(double value, int precision) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }

        BigDecimal exact = new BigDecimal(value);
        BigDecimal fraction = exact.subtract(exact.setScale(0, RoundingMode.DOWN)).abs();
        if (fraction.compareTo(BigDecimal.ONE.scaleByPowerOfTen(-precision)) < 0) {
            return exact.setScale(0, RoundingMode.HALF_EVEN).toBigInteger().toString();
        }
        return general(exact, precision);
    }

    /**
     * Significant-digit notation: positional for decimal exponents in {@code [-4, precision)}, otherwise
     * scientific with a signed exponent of at least two digits. Trailing zeros are dropped.
     */
    static String general(BigDecimal value, int precision) {
        BigDecimal rounded = value.round(new MathContext(precision, RoundingMode.HALF_EVEN));
        if (rounded.signum() == 0) {
            return "0";
        }

        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent >= -4 && exponent < precision) {
            return rounded.stripTrailingZeros().toPlainString();
        }

        String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
        return String.format("%se%s%02d", mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
    }
}
