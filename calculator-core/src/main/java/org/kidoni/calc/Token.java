package org.kidoni.calc;

/**
 * @param position zero-based offset of the first character in the canonical text
 */
public record Token(Type type, String text, int position) {
    public enum Type {
        NUMBER,
        IDENTIFIER,
        PLUS,
        MINUS,
        STAR,
        DOUBLE_STAR,
        SLASH,
        DOUBLE_SLASH,
        PERCENT,
        BANG,
        LEFT_PAREN,
        RIGHT_PAREN,
        COMMA,
        EOF
    }

    public boolean is(Type type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        return type == Type.EOF ? "end of input" : "'" + text + "'";
    }
}
