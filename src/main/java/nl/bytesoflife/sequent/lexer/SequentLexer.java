package nl.bytesoflife.sequent.lexer;

import nl.bytesoflife.sequent.parser.ParseException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexer for sequent input.
 * Produces tokens on demand; spaces and tabs between tokens are skipped.
 */
public class SequentLexer {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9]*");

    private final String input;
    private int pos;

    public SequentLexer(String input) {
        this.input = input;
        this.pos = 0;
        skipSpaces();
    }

    /**
     * Returns the next token without consuming it, or null at the end of input.
     */
    public Token peek() {
        if (pos >= input.length()) {
            return null;
        }

        Matcher matcher = IDENTIFIER.matcher(input);
        matcher.region(pos, input.length());
        if (matcher.lookingAt()) {
            return new Token(TokenType.VARIABLE, matcher.group(), pos);
        }

        TokenType type = TokenType.fromSymbol(input.charAt(pos));
        if (type == null) {
            throw new ParseException("Invalid symbol", pos);
        }
        return new Token(type, type.getSymbol(), pos);
    }

    /**
     * Returns the next token and advances past it.
     */
    public Token take() {
        Token token = peek();
        if (token == null) {
            throw new IllegalStateException("Advancing beyond last token");
        }
        pos += token.length();
        skipSpaces();
        return token;
    }

    /**
     * Takes the next token, which the caller has already peeked and expects to be of the given type.
     */
    public Token consume(TokenType expected) {
        Token token = take();
        if (token.type() != expected) {
            throw new IllegalStateException("Token mismatch: expected " + expected + " but got " + token);
        }
        return token;
    }

    public int position() {
        return pos;
    }

    private void skipSpaces() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c != ' ' && c != '\t') break;
            pos++;
        }
    }
}
