package org.kidoni.calc;

/**
 * Entry point for evaluating untrusted arithmetic text.
 * <p>
 * Failures never escape as exceptions; each operation returns a {@link Result} carrying either the value or a
 * {@link CalcError}. Instances hold only their nesting limits and may be shared between threads.
 */
public class SafeCalculator {
    private final int maxParseDepth;
    private final int maxEvalDepth;

    public SafeCalculator() {
        this(Parser.DEFAULT_MAX_DEPTH, Evaluator.DEFAULT_MAX_DEPTH);
    }

    public SafeCalculator(final int maxParseDepth, final int maxEvalDepth) {
        if (maxParseDepth < 1 || maxParseDepth > Parser.MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException("maxParseDepth must be between 1 and " + Parser.MAX_DEPTH_LIMIT);
        }
        if (maxEvalDepth < 1 || maxEvalDepth > Evaluator.MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException("maxEvalDepth must be between 1 and " + Evaluator.MAX_DEPTH_LIMIT);
        }
        this.maxParseDepth = maxParseDepth;
        this.maxEvalDepth = maxEvalDepth;
    }

    public Result<Expr> preprocessAndParse(String text) {
        try {
            return Result.ok(new Parser(Preprocessor.preprocess(text), maxParseDepth).parse());
        }
        catch (CalcException e) {
            return Result.err(e.toError());
        }
        catch (StackOverflowError e) {
            return stackExhausted();
        }
    }

    public Result<Double> evaluate(Expr expr, Environment environment) {
        try {
            return Result.ok(new Evaluator(environment, maxEvalDepth).evaluate(expr));
        }
        catch (CalcException e) {
            return Result.err(e.toError());
        }
        catch (StackOverflowError e) {
            return stackExhausted();
        }
    }

    public Result<Double> evaluate(String text, Environment environment) {
        return preprocessAndParse(text).flatMap(expr -> evaluate(expr, environment));
    }

    // only reachable through caller-supplied functions; the depth limits bound the pipeline itself
    private static <T> Result<T> stackExhausted() {
        return Result.err(new CalcError(ErrorKind.RESOURCE_LIMIT, "expression exhausted the call stack"));
    }

    public Environment buildEnvironment(TrigMode mode, double ans, double mem) {
        return EnvironmentBuilder.build(mode, ans, mem);
    }
}
