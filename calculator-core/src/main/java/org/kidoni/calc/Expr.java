package org.kidoni.calc;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Restricted expression tree. Only these five shapes exist; anything else the input might spell
 * (attribute access, subscripts, literals other than numbers, ...) has no node to be parsed into.
 */
public sealed interface Expr {
    Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    record Num(double value) implements Expr {
        @Override
        public String toString() {
            if (value == Math.rint(value) && Math.abs(value) < 1e15) {
                return String.valueOf((long) value);
            }
            return String.valueOf(value);
        }
    }

    record Ident(String name) implements Expr {
        public Ident {
            requireIdentifier(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Unary(UnaryOp op, Expr operand) implements Expr {
        public Unary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public String toString() {
            return "(" + op.symbol() + operand + ")";
        }
    }

    record Binary(Op op, Expr left, Expr right) implements Expr {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "(" + left + " " + op.symbol() + " " + right + ")";
        }
    }

    /**
     * Call of a function by plain name. Arguments are positional and evaluated left to right.
     */
    record Call(String name, List<Expr> args) implements Expr {
        public Call {
            requireIdentifier(name);
            args = List.copyOf(args);
        }

        @Override
        public String toString() {
            return args.stream()
                    .map(Expr::toString)
                    .collect(Collectors.joining(", ", name + "(", ")"));
        }
    }

    private static void requireIdentifier(String name) {
        Objects.requireNonNull(name, "name");
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("not an identifier: " + name);
        }
    }
}
