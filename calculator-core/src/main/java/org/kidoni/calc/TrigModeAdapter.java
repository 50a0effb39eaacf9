package org.kidoni.calc;

import java.util.function.DoubleUnaryOperator;

/**
 * Makes the radian-based trigonometric primitives follow the current angle unit.
 * <p>
 * Wrapped functions capture the mode in effect when they were wrapped; changing the mode afterwards only
 * affects functions wrapped later.
 */
public class TrigModeAdapter {
    private TrigMode mode;

    public TrigModeAdapter() {
        this(TrigMode.RADIANS);
    }

    public TrigModeAdapter(final TrigMode mode) {
        assert mode != null;
        this.mode = mode;
    }

    public TrigMode getMode() {
        return mode;
    }

    /**
     * Changes the mode. An invalid value is reported as a {@link ErrorKind#VALIDATION} error and the mode stays as
     * it was.
     */
    public Result<TrigMode> set(String value) {
        try {
            mode = TrigMode.parse(value);
            return Result.ok(mode);
        }
        catch (CalcException e) {
            return Result.err(e.toError());
        }
    }

    /**
     * Wraps a function taking an angle, e.g. {@link Math#sin}.
     */
    public DoubleUnaryOperator wrapForward(DoubleUnaryOperator f) {
        if (mode == TrigMode.RADIANS) {
            return f;
        }
        return x -> f.applyAsDouble(Math.toRadians(x));
    }

    /**
     * Wraps a function returning an angle, e.g. {@link Math#asin}.
     */
    public DoubleUnaryOperator wrapInverse(DoubleUnaryOperator g) {
        if (mode == TrigMode.RADIANS) {
            return g;
        }
        return x -> Math.toDegrees(g.applyAsDouble(x));
    }
}
