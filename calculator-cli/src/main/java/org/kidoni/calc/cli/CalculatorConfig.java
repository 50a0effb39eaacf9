package org.kidoni.calc.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.kidoni.calc.CalcException;
import org.kidoni.calc.Parser;
import org.kidoni.calc.TrigMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Start-up settings, read from {@value #RESOURCE} on the classpath. Every key can be overridden by an environment
 * variable named after it, e.g. {@code CALCULATOR_PRECISION} for {@code calculator.precision}.
 */
public record CalculatorConfig(int precision, TrigMode mode, int historySize, int maxParseDepth) {
    private static final Logger log = LoggerFactory.getLogger(CalculatorConfig.class);

    public static final String RESOURCE = "calculator.properties";
    public static final String PRECISION = "calculator.precision";
    public static final String MODE = "calculator.mode";
    public static final String HISTORY_SIZE = "calculator.history.size";
    public static final String MAX_PARSE_DEPTH = "calculator.parser.max-depth";

    public static final int MIN_PRECISION = 1;
    public static final int MAX_PRECISION = 50;

    public static final CalculatorConfig DEFAULTS = new CalculatorConfig(12, TrigMode.RADIANS, 20, Parser.DEFAULT_MAX_DEPTH);

    public CalculatorConfig {
        precision = clampPrecision(precision);
        if (mode == null) {
            throw new IllegalArgumentException(MODE + " must be set");
        }
        if (historySize < 1) {
            throw new IllegalArgumentException(HISTORY_SIZE + " must be greater than 0");
        }
        if (maxParseDepth < 1 || maxParseDepth > Parser.MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException(MAX_PARSE_DEPTH + " must be between 1 and " + Parser.MAX_DEPTH_LIMIT);
        }
    }

    public static int clampPrecision(int precision) {
        return Math.max(MIN_PRECISION, Math.min(MAX_PRECISION, precision));
    }

    public static CalculatorConfig load() {
        CalculatorConfig config = load(loadResource(), System.getenv());
        log.info("loaded configuration {}", config);
        return config;
    }

    static CalculatorConfig load(Properties properties, Map<String, String> env) {
        return new CalculatorConfig(
                intValue(PRECISION, lookup(PRECISION, properties, env), DEFAULTS.precision()),
                modeValue(lookup(MODE, properties, env), DEFAULTS.mode()),
                intValue(HISTORY_SIZE, lookup(HISTORY_SIZE, properties, env), DEFAULTS.historySize()),
                intValue(MAX_PARSE_DEPTH, lookup(MAX_PARSE_DEPTH, properties, env), DEFAULTS.maxParseDepth()));
    }

    static String environmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static String lookup(String key, Properties properties, Map<String, String> env) {
        String override = env.get(environmentName(key));
        if (override != null && !override.isBlank()) {
            log.debug("{} overridden by environment: {}", key, override);
            return override.strip();
        }
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static int intValue(String key, String value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer but was '" + value + "'", e);
        }
    }

    private static TrigMode modeValue(String value, TrigMode defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return TrigMode.parse(value);
        }
        catch (CalcException e) {
            throw new IllegalArgumentException(MODE + " must be 'rad' or 'deg' but was '" + value + "'", e);
        }
    }

    private static Properties loadResource() {
        Properties properties = new Properties();
        try (InputStream in = CalculatorConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on the classpath, using defaults", RESOURCE);
            }
            else {
                properties.load(in);
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("unable to read " + RESOURCE, e);
        }
        return properties;
    }
}
