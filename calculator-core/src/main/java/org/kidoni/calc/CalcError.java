package org.kidoni.calc;

import java.util.Objects;

/**
 * A failure reported at the calculator boundary: what went wrong and a message fit for the user.
 */
public record CalcError(ErrorKind kind, String message) {
    public CalcError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
