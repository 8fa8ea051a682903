package nl.bytesoflife.sequent.lexer;

/**
 * A lexical token. Operator aliases are already normalized, so {@code text} holds the
 * canonical glyph; {@code position} is the offset of the token in the input.
 */
public record Token(TokenType type, String text, int position) {

    public boolean is(TokenType other) {
        return type == other;
    }

    public int length() {
        return type == TokenType.VARIABLE ? text.length() : 1;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
