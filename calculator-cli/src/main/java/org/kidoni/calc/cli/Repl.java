package org.kidoni.calc.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.kidoni.calc.CalcError;
import org.kidoni.calc.Result;
import org.kidoni.calc.SafeCalculator;
import org.kidoni.calc.TrigMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-evaluate-print loop: one command or expression per line.
 */
public class Repl {
    private static final Logger log = LoggerFactory.getLogger(Repl.class);

    static final String BANNER = "Advanced Calculator. Type 'help' for commands. Ctrl+C to exit.";
    static final String PROMPT = "> ";
    static final String HELP = """
            Commands:
              help             Show this help
              history          Show recent results
              clear            Clear the screen (prints blank lines)
              mode deg|rad     Set trig mode (default: rad)
              precision N      Set decimal precision for printing (default: 12)
              m+ [x]           Add x (or ans if omitted) to memory
              m- [x]           Subtract x (or ans if omitted) from memory
              mr               Print memory value
              mc               Clear memory (set to 0)
              reset            Reset ans, mem, mode, precision, history
              quit / exit      Leave the calculator

            Usage:
              - Enter math expressions directly:
                  2+2, 2*(3+4)^2, 5!, sqrt(2), log(8,2), ln(5)
                  sin(30) with mode deg OR sin(pi/6) with mode rad
              - Variables:
                  ans (last answer), mem (memory register)""";
    private static final int CLEAR_LINES = 60;
    private static final Set<String> COMMANDS_WITH_ARGUMENTS = Set.of("mode", "precision", "clear");

    private final BufferedReader in;
    private final PrintStream out;
    private final Session session;
    private final SafeCalculator calculator;

    public Repl(final BufferedReader in, final PrintStream out, final Session session, final SafeCalculator calculator) {
        this.in = in;
        this.out = out;
        this.session = session;
        this.calculator = calculator;
    }

    public void run() throws IOException {
        out.println(BANNER);
        out.println();

        while (true) {
            out.print(PROMPT);
            out.flush();

            String line = in.readLine();
            if (line == null) {
                out.println();
                out.println("Bye.");
                return;
            }
            if (!handle(line)) {
                return;
            }
        }
    }

    /**
     * @return false once the user asked to leave
     */
    boolean handle(String input) {
        String line = input.strip();
        if (line.isEmpty()) {
            return true;
        }

        String lower = line.toLowerCase(Locale.ROOT);
        String[] parts = line.split("\\s+");
        String command = parts[0].toLowerCase(Locale.ROOT);

        if (lower.startsWith("m+") || lower.startsWith("m-")) {
            memoryOperation(lower.charAt(1) == '+', line.substring(2).strip());
            return true;
        }

        if (parts.length > 1 && !COMMANDS_WITH_ARGUMENTS.contains(command)) {
            evaluate(line);
            return true;
        }

        switch (command) {
            case "quit", "exit" -> {
                out.println("Bye.");
                return false;
            }
            case "help" -> out.println(HELP);
            case "history" -> printHistory();
            case "clear" -> out.print("\n".repeat(CLEAR_LINES));
            case "mode" -> setMode(parts);
            case "precision" -> setPrecision(parts);
            case "mr" -> out.println(format(session.mem()));
            case "mc" -> {
                session.setMem(0.0);
                out.println("Memory cleared.");
            }
            case "reset" -> {
                session.reset();
                out.println("State reset.");
            }
            default -> evaluate(line);
        }
        return true;
    }

    private void evaluate(String line) {
        Result<Double> result = calculator.evaluate(line, session.environment());
        if (result instanceof Result.Ok<Double> ok) {
            double value = ok.value();
            log.debug("evaluated '{}' = {}", line, value);
            session.recordResult(line, value);
            out.println(format(value));
        }
        else if (result instanceof Result.Err<Double> err) {
            log.debug("evaluation of '{}' failed with {}", line, err.error().kind());
            out.println("Error: " + describe(err.error()));
        }
    }

    private void memoryOperation(boolean add, String argument) {
        double delta = session.ans();
        if (!argument.isEmpty()) {
            Result<Double> result = calculator.evaluate(argument, session.environment());
            if (result instanceof Result.Err<Double> err) {
                log.debug("memory operand '{}' failed with {}", argument, err.error().kind());
                out.println("Memory op error: " + err.error().message());
                return;
            }
            delta = result.orElseThrow();
        }

        session.setMem(add ? session.mem() + delta : session.mem() - delta);
        out.println("Memory = " + format(session.mem()));
    }

    private void printHistory() {
        List<HistoryEntry> entries = session.recentHistory();
        if (entries.isEmpty()) {
            out.println("(no history)");
            return;
        }
        int i = 1;
        for (HistoryEntry entry : entries) {
            out.printf("%2d: %s  =  %s%n", i++, entry.expression(), format(entry.result()));
        }
    }

    private void setMode(String[] parts) {
        if (parts.length != 2) {
            out.println("Usage: mode deg|rad");
            return;
        }
        Result<TrigMode> result = session.trig().set(parts[1]);
        if (result instanceof Result.Ok<TrigMode> ok) {
            out.println("Trig mode set to " + ok.value() + ".");
        }
        else {
            out.println("Usage: mode deg|rad");
        }
    }

    private void setPrecision(String[] parts) {
        if (parts.length != 2 || !parts[1].matches("\\d+")) {
            out.println("Usage: precision N");
            return;
        }
        BigInteger requested = new BigInteger(parts[1]);
        session.setPrecision(requested.min(BigInteger.valueOf(CalculatorConfig.MAX_PRECISION)).intValue());
        out.println("Precision set to " + session.precision() + ".");
    }

    private String format(double value) {
        return ResultFormatter.format(value, session.precision());
    }

    private static String describe(CalcError error) {
        return switch (error.kind()) {
            case DIVISION_BY_ZERO -> "division by zero.";
            case OVERFLOW -> "numeric overflow.";
            default -> error.message();
        };
    }
}
