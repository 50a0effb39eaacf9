package org.kidoni.calc;

import java.util.function.DoubleUnaryOperator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrigModeAdapterTest {
    @Test
    void radiansIsAPassthrough() {
        var adapter = new TrigModeAdapter();
        assertEquals(TrigMode.RADIANS, adapter.getMode());

        DoubleUnaryOperator sin = Math::sin;
        assertSame(sin, adapter.wrapForward(sin));
        assertSame(sin, adapter.wrapInverse(sin));
    }

    @Test
    void degreesConvertInputsAndOutputs() {
        var adapter = new TrigModeAdapter(TrigMode.DEGREES);
        assertEquals(1, adapter.wrapForward(Math::sin).applyAsDouble(90), 1e-15);
        assertEquals(180, adapter.wrapInverse(Math::acos).applyAsDouble(-1), 1e-12);
    }

    @Test
    void setAcceptsEitherCase() {
        var adapter = new TrigModeAdapter();
        var result = adapter.set("DEG");
        assertTrue(result.isOk());
        assertEquals(TrigMode.DEGREES, adapter.getMode());

        adapter.set("Rad");
        assertEquals(TrigMode.RADIANS, adapter.getMode());
    }

    @Test
    void setRejectsUnknownModesAndKeepsTheCurrentOne() {
        var adapter = new TrigModeAdapter(TrigMode.DEGREES);
        for (String value : new String[]{"grad", "", "radians", " deg ", null}) {
            var result = adapter.set(value);
            assertFalse(result.isOk());
            var err = assertInstanceOf(Result.Err.class, result);
            assertEquals(ErrorKind.VALIDATION, err.error().kind());
            assertEquals(TrigMode.DEGREES, adapter.getMode());
        }
    }

    @Test
    void wrappersKeepTheModeTheyWereCreatedWith() {
        var adapter = new TrigModeAdapter(TrigMode.DEGREES);
        var sin = adapter.wrapForward(Math::sin);
        adapter.set("rad");
        assertEquals(0.5, sin.applyAsDouble(30), 1e-12);
    }
}
