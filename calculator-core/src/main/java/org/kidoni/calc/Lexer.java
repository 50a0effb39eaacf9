package org.kidoni.calc;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static java.lang.Character.isWhitespace;

/**
 * Splits canonical text into {@link Token}s.
 * <p>
 * Lexical grammar:
 * <pre>
 *  NUMBER:     [0-9]+ ('.' [0-9]*)? EXPONENT? | '.' [0-9]+ EXPONENT?
 *  EXPONENT:   [eE] [+-]? [0-9]+
 *  IDENTIFIER: [A-Za-z_] [A-Za-z0-9_]*
 *  OPERATOR:   '+' | '-' | '*' | '**' | '/' | '//' | '%' | '!' | '(' | ')' | ','
 * </pre>
 * Every other character is rejected, which keeps strings, attribute access, subscripts, collection literals and
 * assignment out before parsing starts.
 */
public class Lexer {
    // words that introduce non-arithmetic constructs in common expression languages
    private static final Set<String> RESERVED_WORDS = Set.of(
            "True", "False", "None", "true", "false", "null",
            "lambda", "if", "else", "for", "while", "in", "is", "not", "and", "or",
            "import", "from", "def", "class", "return", "yield", "await", "async", "with", "as",
            "del", "global", "nonlocal", "assert", "pass", "raise", "try", "except", "finally",
            "break", "continue", "new", "function", "var", "let");

    private final String text;
    private int position;

    public Lexer(final String text) {
        assert text != null;
        this.text = text;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        }
        while (!token.is(Token.Type.EOF));
        return tokens;
    }

    private Token next() {
        skipWhitespace();

        if (position >= text.length()) {
            return new Token(Token.Type.EOF, "", position);
        }

        int start = position;
        char c = text.charAt(position);

        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            return readNumber();
        }
        if (isIdentifierStart(c)) {
            return readIdentifier();
        }

        position++;
        return switch (c) {
            case '+' -> new Token(Token.Type.PLUS, "+", start);
            case '-' -> new Token(Token.Type.MINUS, "-", start);
            case '%' -> new Token(Token.Type.PERCENT, "%", start);
            case '!' -> new Token(Token.Type.BANG, "!", start);
            case '(' -> new Token(Token.Type.LEFT_PAREN, "(", start);
            case ')' -> new Token(Token.Type.RIGHT_PAREN, ")", start);
            case ',' -> new Token(Token.Type.COMMA, ",", start);
            case '*' -> match('*')
                    ? new Token(Token.Type.DOUBLE_STAR, "**", start)
                    : new Token(Token.Type.STAR, "*", start);
            case '/' -> match('/')
                    ? new Token(Token.Type.DOUBLE_SLASH, "//", start)
                    : new Token(Token.Type.SLASH, "/", start);
            default -> throw new CalcException(ErrorKind.SYNTAX,
                    "unexpected character '" + c + "' at position " + start);
        };
    }

    private Token readNumber() {
        int start = position;
        while (isDigit(peek(0))) {
            position++;
        }
        if (peek(0) == '.') {
            position++;
            while (isDigit(peek(0))) {
                position++;
            }
        }
        if ((peek(0) == 'e' || peek(0) == 'E') && hasExponentDigits()) {
            position++;
            if (peek(0) == '+' || peek(0) == '-') {
                position++;
            }
            while (isDigit(peek(0))) {
                position++;
            }
        }

        String literal = text.substring(start, position);
        if (isIdentifierStart(peek(0)) || peek(0) == '.') {
            throw new CalcException(ErrorKind.SYNTAX,
                    "malformed number '" + literal + peek(0) + "' at position " + start);
        }
        return new Token(Token.Type.NUMBER, literal, start);
    }

    private boolean hasExponentDigits() {
        char next = peek(1);
        if (next == '+' || next == '-') {
            return isDigit(peek(2));
        }
        return isDigit(next);
    }

    private Token readIdentifier() {
        int start = position;
        while (isIdentifierPart(peek(0))) {
            position++;
        }

        String name = text.substring(start, position);
        if (RESERVED_WORDS.contains(name)) {
            throw new CalcException(ErrorKind.SYNTAX, "'" + name + "' is not allowed in an expression");
        }
        return new Token(Token.Type.IDENTIFIER, name, start);
    }

    private boolean match(char expected) {
        if (peek(0) == expected) {
            position++;
            return true;
        }
        return false;
    }

    private char peek(int offset) {
        int index = position + offset;
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private void skipWhitespace() {
        while (position < text.length() && isWhitespace(text.charAt(position))) {
            position++;
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
