package org.kidoni.calc;

import java.util.Map;

/**
 * Names and functions visible to one evaluation. Built fresh for every call and never shared.
 */
public record Environment(Map<String, Double> names, Map<String, MathFunction> functions) {
    public Environment {
        names = Map.copyOf(names);
        functions = Map.copyOf(functions);
    }
}
