package org.kidoni.calc;

import java.util.List;

/**
 * A function callable from an expression. Implementations report bad input by throwing {@link CalcException}.
 */
@FunctionalInterface
public interface MathFunction {
    double apply(List<Double> args);
}
