package org.kidoni.calc.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;

import org.kidoni.calc.Evaluator;
import org.kidoni.calc.SafeCalculator;

public class CalculatorApp {
    public static void main(String[] args) throws IOException {
        CalculatorConfig config = CalculatorConfig.load();
        SafeCalculator calculator = new SafeCalculator(config.maxParseDepth(), Evaluator.DEFAULT_MAX_DEPTH);

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset()));
        new Repl(in, System.out, new Session(config), calculator).run();
    }
}
