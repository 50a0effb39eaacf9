package org.kidoni.calc;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvironmentBuilderTest {
    private static final Environment RADIANS = EnvironmentBuilder.build(TrigMode.RADIANS, 0, 0);
    private static final Environment DEGREES = EnvironmentBuilder.build(TrigMode.DEGREES, 0, 0);

    private static double call(Environment environment, String name, Double... args) {
        return environment.functions().get(name).apply(List.of(args));
    }

    private static double call(String name, Double... args) {
        return call(RADIANS, name, args);
    }

    private static ErrorKind failure(String name, Double... args) {
        return assertThrows(CalcException.class, () -> call(name, args)).getKind();
    }

    @Test
    void constantsAndSessionValues() {
        var environment = EnvironmentBuilder.build(TrigMode.RADIANS, 42, -1.5);
        assertEquals(Set.of("pi", "e", "tau", "inf", "nan", "ans", "mem"), environment.names().keySet());
        assertEquals(Math.PI, environment.names().get("pi"));
        assertEquals(Math.E, environment.names().get("e"));
        assertEquals(2 * Math.PI, environment.names().get("tau"));
        assertEquals(Double.POSITIVE_INFINITY, environment.names().get("inf"));
        assertTrue(environment.names().get("nan").isNaN());
        assertEquals(42, environment.names().get("ans"));
        assertEquals(-1.5, environment.names().get("mem"));
    }

    @Test
    void functionTable() {
        assertEquals(Set.of("abs", "round", "floor", "ceil", "sqrt", "exp", "log", "log10",
                        "sin", "cos", "tan", "asin", "acos", "atan", "factorial"),
                RADIANS.functions().keySet());
    }

    @Test
    void environmentIsImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> RADIANS.names().put("pi", 3.0));
        assertThrows(UnsupportedOperationException.class, () -> RADIANS.functions().remove("sqrt"));
    }

    @Test
    void basicFunctions() {
        assertEquals(3, call("abs", -3.0));
        assertEquals(2, call("floor", 2.7));
        assertEquals(-3, call("floor", -2.1));
        assertEquals(3, call("ceil", 2.1));
        assertEquals(Math.sqrt(2), call("sqrt", 2.0));
        assertEquals(Math.E, call("exp", 1.0), 1e-15);
        assertEquals(1.6094379124341003, call("log", 5.0));
        assertEquals(3, call("log", 8.0, 2.0), 1e-15);
        assertEquals(3, call("log10", 1000.0));
    }

    @Test
    void roundIsHalfEven() {
        assertEquals(2, call("round", 2.5));
        assertEquals(4, call("round", 3.5));
        assertEquals(-2, call("round", -2.5));
        assertEquals(3.14, call("round", Math.PI, 2.0));
        assertEquals(2.67, call("round", 2.675, 2.0));
        assertEquals(1200, call("round", 1234.5, -2.0));
        assertEquals(ErrorKind.DOMAIN, failure("round", 1.0, 0.5));
        assertEquals(ErrorKind.OVERFLOW, failure("round", Double.POSITIVE_INFINITY));
        assertEquals(ErrorKind.DOMAIN, failure("round", Double.NaN));
    }

    @Test
    void domainErrors() {
        assertEquals(ErrorKind.DOMAIN, failure("sqrt", -1.0));
        assertEquals(ErrorKind.DOMAIN, failure("log", 0.0));
        assertEquals(ErrorKind.DOMAIN, failure("log", -1.0));
        assertEquals(ErrorKind.DOMAIN, failure("log", 8.0, -2.0));
        assertEquals(ErrorKind.DIVISION_BY_ZERO, failure("log", 8.0, 1.0));
        assertEquals(ErrorKind.DOMAIN, failure("log10", 0.0));
        assertEquals(ErrorKind.DOMAIN, failure("asin", 1.5));
        assertEquals(ErrorKind.DOMAIN, failure("acos", -1.01));
        assertEquals(ErrorKind.DOMAIN, failure("sin", Double.POSITIVE_INFINITY));
        assertEquals(ErrorKind.OVERFLOW, failure("floor", Double.NEGATIVE_INFINITY));
        assertEquals(ErrorKind.OVERFLOW, failure("exp", 1000.0));
        assertEquals(Double.POSITIVE_INFINITY, call("exp", Double.POSITIVE_INFINITY));
    }

    @Test
    void arity() {
        assertEquals(ErrorKind.ARITY, failure("sqrt"));
        assertEquals(ErrorKind.ARITY, failure("sin", 1.0, 2.0));
        assertEquals(ErrorKind.ARITY, failure("log", 1.0, 2.0, 3.0));
        assertEquals(ErrorKind.ARITY, failure("round"));
        var e = assertThrows(CalcException.class, () -> call("abs", 1.0, 2.0));
        assertEquals("abs() takes 1 argument but 2 were given.", e.getMessage());
    }

    @Test
    void trigonometryFollowsTheMode() {
        assertEquals(0.5, call(DEGREES, "sin", 30.0), 1e-12);
        assertEquals(-0.98803162409, call(RADIANS, "sin", 30.0), 1e-11);
        assertEquals(0.5, call(DEGREES, "cos", 60.0), 1e-12);
        assertEquals(1, call(DEGREES, "tan", 45.0), 1e-12);
        assertEquals(30, call(DEGREES, "asin", 0.5), 1e-12);
        assertEquals(60, call(DEGREES, "acos", 0.5), 1e-12);
        assertEquals(45, call(DEGREES, "atan", 1.0), 1e-12);
        assertEquals(Math.PI / 4, call(RADIANS, "atan", 1.0));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15})
    void factorialIsExactForSmallIntegers(int n) {
        long expected = 1;
        for (int i = 2; i <= n; i++) {
            expected *= i;
        }
        assertEquals((double) expected, EnvironmentBuilder.factorial(n));
    }

    @Test
    void factorialAcceptsNearIntegers() {
        assertEquals(120, EnvironmentBuilder.factorial(5 + 1e-13));
        assertEquals(120, EnvironmentBuilder.factorial(5 - 1e-13));
        assertEquals(7.257415615307999E306, EnvironmentBuilder.factorial(170), 1e292);
        assertEquals(Double.POSITIVE_INFINITY, EnvironmentBuilder.factorial(171));
        assertEquals(Double.POSITIVE_INFINITY, EnvironmentBuilder.factorial(1e9));
    }

    @Test
    void factorialRejectsNegativeAndFractionalValues() {
        for (double x : new double[]{-1, 2.3, 5 + 1e-9, Double.NaN, Double.POSITIVE_INFINITY}) {
            var e = assertThrows(CalcException.class, () -> EnvironmentBuilder.factorial(x), String.valueOf(x));
            assertEquals(ErrorKind.DOMAIN, e.getKind());
        }
    }
}
