package nl.bytesoflife.sequent.parser;

/**
 * Malformed input. The position is a character offset into the original string.
 */
public class ParseException extends RuntimeException {
    private final int position;

    public ParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
