package org.kidoni.calc;

/**
 * Raised inside the pipeline and turned into a {@link Result.Err} by {@link SafeCalculator}.
 */
public class CalcException extends RuntimeException {
    private final ErrorKind kind;

    public CalcException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public CalcException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public CalcError toError() {
        return new CalcError(kind, getMessage());
    }
}
