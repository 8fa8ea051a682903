package nl.bytesoflife.sequent.lexer;

import nl.bytesoflife.sequent.model.Symbols;

public enum TokenType {
    VARIABLE(null),
    NOT(Symbols.NOT),
    AND(Symbols.AND),
    OR(Symbols.OR),
    TURNSTILE(Symbols.TURNSTILE),
    EMPTY(Symbols.EMPTY),
    COMMA(","),
    OPEN_PAREN("("),
    CLOSE_PAREN(")");

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Canonical text of a fixed token, or null for variables.
     */
    public String getSymbol() {
        return symbol;
    }

    public static TokenType fromSymbol(char c) {
        return switch (c) {
            case '¬', '!' -> NOT;
            case '∧', '&' -> AND;
            case '∨', '|' -> OR;
            case '⊦', '>' -> TURNSTILE;
            case '∅' -> EMPTY;
            case ',' -> COMMA;
            case '(' -> OPEN_PAREN;
            case ')' -> CLOSE_PAREN;
            default -> null;
        };
    }
}
