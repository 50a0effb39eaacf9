package org.kidoni.calc;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for arithmetic over numbers, names and function calls.
 * <p>
 * Grammar:
 * <pre>
 *  expression: term (('+' | '-') term)*
 *  term:       unary (('*' | '/' | '//' | '%') unary)*
 *  unary:      ('+' | '-') unary | power
 *  power:      postfix ('**' unary)?
 *  postfix:    primary '!'*
 *  primary:    NUMBER | IDENTIFIER | IDENTIFIER '(' arguments? ')' | '(' expression ')'
 *  arguments:  expression (',' expression)*
 * </pre>
 * {@code **} is right-associative and binds tighter than a unary sign on its left, so {@code -2**2} is
 * {@code -(2**2)}. Postfix {@code !} binds tightest and becomes a call of {@code factorial}.
 */
public class Parser {
    public static final int DEFAULT_MAX_DEPTH = 200;
    public static final int MAX_DEPTH_LIMIT = 500;
    static final String FACTORIAL = "factorial";

    private final List<Token> tokens;
    private final int maxDepth;
    private int current;
    private int depth;

    public Parser(final String text) {
        this(text, DEFAULT_MAX_DEPTH);
    }

    public Parser(final String text, final int maxDepth) {
        assert text != null;
        if (maxDepth < 1 || maxDepth > MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException("maxDepth must be between 1 and " + MAX_DEPTH_LIMIT);
        }
        this.tokens = new Lexer(text).tokenize();
        this.maxDepth = maxDepth;
    }

    /**
     * @throws CalcException of kind {@link ErrorKind#SYNTAX} if the text is not a single complete expression
     */
    public Expr parse() {
        if (peek().is(Token.Type.EOF)) {
            throw new CalcException(ErrorKind.SYNTAX, "empty expression");
        }

        Expr expr = expression();

        Token trailing = peek();
        if (!trailing.is(Token.Type.EOF)) {
            throw unexpected(trailing);
        }
        return expr;
    }

    private Expr expression() {
        enter();
        try {
            Expr expr = term();
            while (true) {
                if (match(Token.Type.PLUS)) {
                    expr = new Expr.Binary(Op.ADD, expr, term());
                }
                else if (match(Token.Type.MINUS)) {
                    expr = new Expr.Binary(Op.SUB, expr, term());
                }
                else {
                    return expr;
                }
            }
        }
        finally {
            depth--;
        }
    }

    private Expr term() {
        Expr expr = unary();
        while (true) {
            Op op = switch (peek().type()) {
                case STAR -> Op.MUL;
                case SLASH -> Op.DIV;
                case DOUBLE_SLASH -> Op.FLOOR_DIV;
                case PERCENT -> Op.MOD;
                default -> null;
            };
            if (op == null) {
                return expr;
            }
            advance();
            expr = new Expr.Binary(op, expr, unary());
        }
    }

    private Expr unary() {
        enter();
        try {
            if (match(Token.Type.PLUS)) {
                return new Expr.Unary(UnaryOp.PLUS, unary());
            }
            if (match(Token.Type.MINUS)) {
                return new Expr.Unary(UnaryOp.MINUS, unary());
            }
            return power();
        }
        finally {
            depth--;
        }
    }

    private Expr power() {
        Expr base = postfix();
        if (match(Token.Type.DOUBLE_STAR)) {
            return new Expr.Binary(Op.POW, base, unary());
        }
        return base;
    }

    private Expr postfix() {
        Expr expr = primary();
        while (match(Token.Type.BANG)) {
            expr = new Expr.Call(FACTORIAL, List.of(expr));
        }
        return expr;
    }

    private Expr primary() {
        Token token = advance();
        return switch (token.type()) {
            case NUMBER -> new Expr.Num(parseNumber(token));
            case IDENTIFIER -> match(Token.Type.LEFT_PAREN)
                    ? new Expr.Call(token.text(), arguments())
                    : new Expr.Ident(token.text());
            case LEFT_PAREN -> {
                Expr inner = expression();
                expect(Token.Type.RIGHT_PAREN, "')'");
                yield inner;
            }
            default -> throw unexpected(token);
        };
    }

    private List<Expr> arguments() {
        List<Expr> args = new ArrayList<>();
        if (match(Token.Type.RIGHT_PAREN)) {
            return args;
        }
        do {
            args.add(expression());
        }
        while (match(Token.Type.COMMA));
        expect(Token.Type.RIGHT_PAREN, "',' or ')'");
        return args;
    }

    private static double parseNumber(Token token) {
        try {
            return Double.parseDouble(token.text());
        }
        catch (NumberFormatException e) {
            throw new CalcException(ErrorKind.SYNTAX, "invalid number " + token, e);
        }
    }

    private void enter() {
        if (++depth > maxDepth) {
            throw new CalcException(ErrorKind.SYNTAX, "expression nested too deeply (limit " + maxDepth + ")");
        }
    }

    private void expect(Token.Type type, String description) {
        Token token = peek();
        if (!token.is(type)) {
            throw new CalcException(ErrorKind.SYNTAX,
                    "expected " + description + " but found " + token + " at position " + token.position());
        }
        advance();
    }

    private boolean match(Token.Type type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token advance() {
        Token token = peek();
        if (!token.is(Token.Type.EOF)) {
            current++;
        }
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private static CalcException unexpected(Token token) {
        if (token.is(Token.Type.EOF)) {
            return new CalcException(ErrorKind.SYNTAX, "unexpected end of input");
        }
        return new CalcException(ErrorKind.SYNTAX, "unexpected token " + token + " at position " + token.position());
    }
}
