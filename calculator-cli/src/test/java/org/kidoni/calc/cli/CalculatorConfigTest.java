package org.kidoni.calc.cli;

import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.kidoni.calc.TrigMode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalculatorConfigTest {
    @Test
    void defaultsWhenNothingIsSet() {
        assertEquals(CalculatorConfig.DEFAULTS, CalculatorConfig.load(new Properties(), Map.of()));
    }

    @Test
    void loadsBundledResource() {
        var config = CalculatorConfig.load();
        assertEquals(TrigMode.RADIANS, config.mode());
        assertEquals(12, config.precision());
    }

    @Test
    void readsProperties() {
        var properties = new Properties();
        properties.setProperty(CalculatorConfig.PRECISION, "8");
        properties.setProperty(CalculatorConfig.MODE, "DEG");
        properties.setProperty(CalculatorConfig.HISTORY_SIZE, "5");
        properties.setProperty(CalculatorConfig.MAX_PARSE_DEPTH, "64");

        assertEquals(new CalculatorConfig(8, TrigMode.DEGREES, 5, 64), CalculatorConfig.load(properties, Map.of()));
    }

    @Test
    void environmentOverridesProperties() {
        var properties = new Properties();
        properties.setProperty(CalculatorConfig.PRECISION, "8");
        properties.setProperty(CalculatorConfig.MODE, "deg");

        var config = CalculatorConfig.load(properties, Map.of("CALCULATOR_PRECISION", " 6 ", "CALCULATOR_MODE", "rad"));
        assertEquals(6, config.precision());
        assertEquals(TrigMode.RADIANS, config.mode());
        assertEquals("CALCULATOR_PARSER_MAX_DEPTH", CalculatorConfig.environmentName(CalculatorConfig.MAX_PARSE_DEPTH));
    }

    @Test
    void precisionIsClamped() {
        assertEquals(50, new CalculatorConfig(500, TrigMode.RADIANS, 20, 200).precision());
        assertEquals(1, new CalculatorConfig(-3, TrigMode.RADIANS, 20, 200).precision());
    }

    @Test
    void invalidValuesNameTheKey() {
        var properties = new Properties();
        properties.setProperty(CalculatorConfig.PRECISION, "twelve");
        var e = assertThrows(IllegalArgumentException.class, () -> CalculatorConfig.load(properties, Map.of()));
        assertTrue(e.getMessage().contains(CalculatorConfig.PRECISION));

        e = assertThrows(IllegalArgumentException.class,
                () -> CalculatorConfig.load(new Properties(), Map.of("CALCULATOR_MODE", "grad")));
        assertTrue(e.getMessage().contains(CalculatorConfig.MODE));

        e = assertThrows(IllegalArgumentException.class,
                () -> CalculatorConfig.load(new Properties(), Map.of("CALCULATOR_HISTORY_SIZE", "0")));
        assertTrue(e.getMessage().contains(CalculatorConfig.HISTORY_SIZE));

        e = assertThrows(IllegalArgumentException.class,
                () -> CalculatorConfig.load(new Properties(), Map.of("CALCULATOR_PARSER_MAX_DEPTH", "100000")));
        assertTrue(e.getMessage().contains(CalculatorConfig.MAX_PARSE_DEPTH));
    }
}
