package nl.bytesoflife.sequent.model;

/**
 * Canonical glyphs used when reading and writing sequents.
 */
public final class Symbols {

    public static final String TURNSTILE = "⊦";
    public static final String EMPTY = "∅";
    public static final String NOT = "¬";
    public static final String AND = "∧";
    public static final String OR = "∨";

    private Symbols() {
    }
}
