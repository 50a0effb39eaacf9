package org.kidoni.calc;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks an {@link Expr} against an {@link Environment}.
 * <p>
 * Only the node kinds of {@link Expr} are evaluated and every name or call must resolve in the environment; there
 * is no other way for an expression to reach code.
 */
public class Evaluator {
    public static final int DEFAULT_MAX_DEPTH = 1000;
    public static final int MAX_DEPTH_LIMIT = 1000;

    private final Environment environment;
    private final int maxDepth;
    private int depth;

    public Evaluator(final Environment environment) {
        this(environment, DEFAULT_MAX_DEPTH);
    }

    public Evaluator(final Environment environment, final int maxDepth) {
        assert environment != null;
        if (maxDepth < 1 || maxDepth > MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException("maxDepth must be between 1 and " + MAX_DEPTH_LIMIT);
        }
        this.environment = environment;
        this.maxDepth = maxDepth;
    }

    public double evaluate(Expr expr) {
        if (++depth > maxDepth) {
            throw new CalcException(ErrorKind.RESOURCE_LIMIT, "expression too deeply nested (limit " + maxDepth + ")");
        }
        try {
            return dispatch(expr);
        }
        finally {
            depth--;
        }
    }

    private double dispatch(Expr expr) {
        if (expr instanceof Expr.Num num) {
            return num.value();
        }
        if (expr instanceof Expr.Ident ident) {
            return lookup(ident.name());
        }
        if (expr instanceof Expr.Unary unary) {
            return apply(unary.op(), evaluate(unary.operand()));
        }
        if (expr instanceof Expr.Binary binary) {
            double left = evaluate(binary.left());
            double right = evaluate(binary.right());
            return apply(binary.op(), left, right);
        }
        if (expr instanceof Expr.Call call) {
            return call(call);
        }
        throw new CalcException(ErrorKind.UNSUPPORTED_NODE,
                "Disallowed expression: " + (expr == null ? "null" : expr.getClass().getSimpleName()));
    }

    private double lookup(String name) {
        Double value = environment.names().get(name);
        if (value == null) {
            throw new CalcException(ErrorKind.UNKNOWN_NAME, "Unknown name: " + name);
        }
        return value;
    }

    private double call(Expr.Call call) {
        List<Double> args = new ArrayList<>(call.args().size());
        for (Expr arg : call.args()) {
            args.add(evaluate(arg));
        }

        MathFunction function = environment.functions().get(call.name());
        if (function == null) {
            throw new CalcException(ErrorKind.UNKNOWN_FUNCTION, "Unknown function: " + call.name());
        }
        return function.apply(List.copyOf(args));
    }

    static double apply(UnaryOp op, double operand) {
        return switch (op) {
            case PLUS -> +operand;
            case MINUS -> -operand;
        };
    }

    static double apply(Op op, double left, double right) {
        return switch (op) {
            case ADD -> left + right;
            case SUB -> left - right;
            case MUL -> left * right;
            case DIV -> divide(left, right);
            case FLOOR_DIV -> floorDivide(left, right);
            case MOD -> modulo(left, right);
            case POW -> power(left, right);
        };
    }

    private static double divide(double left, double right) {
        requireNonZeroDivisor(right);
        return left / right;
    }

    /**
     * Floored modulo: a non-zero result has the sign of the divisor.
     */
    static double modulo(double left, double right) {
        requireNonZeroDivisor(right);
        double mod = left % right;
        if (mod != 0) {
            if ((right < 0) != (mod < 0)) {
                mod += right;
            }
        }
        else {
            mod = Math.copySign(0.0, right);
        }
        return mod;
    }

    static double floorDivide(double left, double right) {
        requireNonZeroDivisor(right);
        double mod = left % right;
        double div = (left - mod) / right;
        if (mod != 0 && (right < 0) != (mod < 0)) {
            div -= 1.0;
        }
        if (div == 0) {
            return Math.copySign(0.0, left / right);
        }
        double floor = Math.floor(div);
        if (div - floor > 0.5) {
            floor += 1.0;
        }
        return floor;
    }

    static double power(double base, double exponent) {
        if (exponent == 0 || base == 1) {
            return 1.0;
        }
        if (Double.isNaN(base) || Double.isNaN(exponent)) {
            return Double.NaN;
        }
        if (base == 0 && exponent < 0 && Double.isFinite(exponent)) {
            throw new CalcException(ErrorKind.DIVISION_BY_ZERO, "0 cannot be raised to a negative power.");
        }
        if (base == -1 && Double.isInfinite(exponent)) {
            return 1.0;
        }
        if (base < 0 && Double.isFinite(base) && Double.isFinite(exponent) && exponent != Math.rint(exponent)) {
            throw new CalcException(ErrorKind.DOMAIN, "negative number cannot be raised to a fractional power.");
        }

        double result = Math.pow(base, exponent);
        if (Double.isInfinite(result) && Double.isFinite(base) && Double.isFinite(exponent)) {
            throw new CalcException(ErrorKind.OVERFLOW, "numeric overflow.");
        }
        return result;
    }

    private static void requireNonZeroDivisor(double divisor) {
        if (divisor == 0) {
            throw new CalcException(ErrorKind.DIVISION_BY_ZERO, "division by zero.");
        }
    }
}
