package org.kidoni.calc;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Assembles the constants and functions an expression may use.
 */
public final class EnvironmentBuilder {
    static final double FACTORIAL_TOLERANCE = 1e-12;
    // 171! is beyond Double.MAX_VALUE
    private static final int MAX_FINITE_FACTORIAL = 170;

    private EnvironmentBuilder() {
    }

    public static Environment build(TrigMode mode, double ans, double mem) {
        TrigModeAdapter trig = new TrigModeAdapter(mode);

        Map<String, Double> names = new LinkedHashMap<>();
        names.put("pi", Math.PI);
        names.put("e", Math.E);
        names.put("tau", 2 * Math.PI);
        names.put("inf", Double.POSITIVE_INFINITY);
        names.put("nan", Double.NaN);
        names.put("ans", ans);
        names.put("mem", mem);

        Map<String, MathFunction> functions = new LinkedHashMap<>();
        functions.put("abs", unary("abs", Math::abs));
        functions.put("round", EnvironmentBuilder::round);
        functions.put("floor", unary("floor", x -> integral("floor", x, Math.floor(x))));
        functions.put("ceil", unary("ceil", x -> integral("ceil", x, Math.ceil(x))));
        functions.put("sqrt", unary("sqrt", EnvironmentBuilder::sqrt));
        functions.put("exp", unary("exp", EnvironmentBuilder::exp));
        functions.put("log", EnvironmentBuilder::log);
        functions.put("log10", unary("log10", x -> Math.log10(requirePositive("log10", x))));

        functions.put("sin", unary("sin", trig.wrapForward(finiteAngle("sin", Math::sin))));
        functions.put("cos", unary("cos", trig.wrapForward(finiteAngle("cos", Math::cos))));
        functions.put("tan", unary("tan", trig.wrapForward(finiteAngle("tan", Math::tan))));
        functions.put("asin", unary("asin", trig.wrapInverse(x -> Math.asin(requireUnitRange("asin", x)))));
        functions.put("acos", unary("acos", trig.wrapInverse(x -> Math.acos(requireUnitRange("acos", x)))));
        functions.put("atan", unary("atan", trig.wrapInverse(Math::atan)));

        functions.put(Parser.FACTORIAL, unary(Parser.FACTORIAL, EnvironmentBuilder::factorial));

        return new Environment(names, functions);
    }

    /**
     * Factorial of a value within {@value #FACTORIAL_TOLERANCE} of a non-negative integer, computed exactly and
     * then converted; results past {@code 170!} are {@link Double#POSITIVE_INFINITY}.
     */
    public static double factorial(double x) {
        double n = Math.rint(x);
        if (!Double.isFinite(x) || Math.abs(x - n) > FACTORIAL_TOLERANCE || n < 0) {
            throw new CalcException(ErrorKind.DOMAIN, "factorial() only defined for non-negative integers.");
        }
        if (n > MAX_FINITE_FACTORIAL) {
            return Double.POSITIVE_INFINITY;
        }

        BigInteger result = BigInteger.ONE;
        for (int i = 2; i <= (int) n; i++) {
            result = result.multiply(BigInteger.valueOf(i));
        }
        return result.doubleValue();
    }

    private static MathFunction unary(String name, DoubleUnaryOperator f) {
        return args -> {
            requireArity(name, args, 1, 1);
            return f.applyAsDouble(args.get(0));
        };
    }

    private static double round(List<Double> args) {
        requireArity("round", args, 1, 2);
        double x = args.get(0);
        if (args.size() == 1) {
            return integral("round", x, Math.rint(x));
        }

        double ndigits = args.get(1);
        if (ndigits != Math.rint(ndigits)) {
            throw new CalcException(ErrorKind.DOMAIN, "round() digits must be an integer.");
        }
        if (!Double.isFinite(x) || ndigits > 323) {
            return x;
        }
        if (ndigits < -308) {
            return 0.0 * x;
        }
        double rounded = new BigDecimal(x).setScale((int) ndigits, RoundingMode.HALF_EVEN).doubleValue();
        return rounded == 0.0 ? Math.copySign(0.0, x) : rounded;
    }

    private static double log(List<Double> args) {
        requireArity("log", args, 1, 2);
        double value = Math.log(requirePositive("log", args.get(0)));
        if (args.size() == 1) {
            return value;
        }

        double base = Math.log(requirePositive("log", args.get(1)));
        if (base == 0.0) {
            throw new CalcException(ErrorKind.DIVISION_BY_ZERO, "log() base must not be 1.");
        }
        return value / base;
    }

    private static double sqrt(double x) {
        if (x < 0) {
            throw new CalcException(ErrorKind.DOMAIN, "sqrt() of a negative number.");
        }
        return Math.sqrt(x);
    }

    private static double exp(double x) {
        double result = Math.exp(x);
        if (Double.isInfinite(result) && Double.isFinite(x)) {
            throw new CalcException(ErrorKind.OVERFLOW, "exp() result too large.");
        }
        return result;
    }

    private static double integral(String name, double x, double result) {
        if (Double.isNaN(x)) {
            throw new CalcException(ErrorKind.DOMAIN, name + "() of nan.");
        }
        if (Double.isInfinite(x)) {
            throw new CalcException(ErrorKind.OVERFLOW, name + "() of an infinite value.");
        }
        return result;
    }

    private static DoubleUnaryOperator finiteAngle(String name, DoubleUnaryOperator f) {
        return x -> {
            if (Double.isInfinite(x)) {
                throw new CalcException(ErrorKind.DOMAIN, name + "() of an infinite angle.");
            }
            return f.applyAsDouble(x);
        };
    }

    private static double requirePositive(String name, double x) {
        if (x <= 0) {
            throw new CalcException(ErrorKind.DOMAIN, name + "() requires a positive argument.");
        }
        return x;
    }

    private static double requireUnitRange(String name, double x) {
        if (x < -1 || x > 1) {
            throw new CalcException(ErrorKind.DOMAIN, name + "() requires an argument between -1 and 1.");
        }
        return x;
    }

    private static void requireArity(String name, List<Double> args, int min, int max) {
        int count = args.size();
        if (count < min || count > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw new CalcException(ErrorKind.ARITY,
                    name + "() takes " + expected + " argument" + (max == 1 ? "" : "s") + " but " + count
                            + (count == 1 ? " was" : " were") + " given.");
        }
    }
}
