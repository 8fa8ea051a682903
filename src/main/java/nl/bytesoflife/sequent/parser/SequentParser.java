package nl.bytesoflife.sequent.parser;

import nl.bytesoflife.sequent.lexer.SequentLexer;
import nl.bytesoflife.sequent.lexer.Token;
import nl.bytesoflife.sequent.lexer.TokenType;
import nl.bytesoflife.sequent.model.Sequent;
import nl.bytesoflife.sequent.model.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses {@code side ⊦ side}, where a side is {@code ∅}, nothing at all, or a
 * comma-separated list of terms.
 */
public class SequentParser {

    private final TermParser termParser = new TermParser();

    public Sequent parse(String text) {
        SequentLexer lexer = new SequentLexer(text);
        List<Term> left = parseLeft(lexer);
        List<Term> right = parseRight(lexer);
        return new Sequent(left, right);
    }

    public ParseOutcome tryParse(String text) {
        try {
            return new ParseOutcome.Parsed(parse(text));
        } catch (ParseException e) {
            return new ParseOutcome.Failed(e.getMessage(), e.getPosition());
        }
    }

    private List<Term> parseLeft(SequentLexer lexer) {
        List<Term> terms = new ArrayList<>();
        boolean expectComma = false;
        boolean sawEmpty = false;
        while (true) {
            Token next = lexer.peek();
            if (next == null) {
                throw new ParseException("Comma or turnstile expected", lexer.position());
            }
            if (next.is(TokenType.TURNSTILE)) {
                lexer.consume(TokenType.TURNSTILE);
                return terms;
            }
            if (expectComma) {
                consumeSeparator(lexer, next, sawEmpty);
            } else if (next.is(TokenType.COMMA)) {
                throw new ParseException("Term or turnstile expected", lexer.position());
            }
            expectComma = true;
            sawEmpty |= parseElement(lexer, terms);
        }
    }

    private List<Term> parseRight(SequentLexer lexer) {
        List<Term> terms = new ArrayList<>();
        boolean expectComma = false;
        boolean sawEmpty = false;
        while (true) {
            Token next = lexer.peek();
            if (next == null) {
                return terms;
            }
            if (next.is(TokenType.TURNSTILE)) {
                throw new ParseException("Turnstile not expected", lexer.position());
            }
            if (expectComma) {
                consumeSeparator(lexer, next, sawEmpty);
            } else if (next.is(TokenType.COMMA)) {
                throw new ParseException("Term or end expected", lexer.position());
            }
            expectComma = true;
            sawEmpty |= parseElement(lexer, terms);
        }
    }

    private void consumeSeparator(SequentLexer lexer, Token next, boolean sawEmpty) {
        if (!next.is(TokenType.COMMA)) {
            throw new ParseException("Comma expected", lexer.position());
        }
        if (sawEmpty) {
            throw new ParseException("Empty set must be the only item", lexer.position());
        }
        lexer.consume(TokenType.COMMA);
        if (lexer.peek() == null) {
            throw new ParseException("Term expected", lexer.position());
        }
    }

    // Returns true if the element was the empty-set marker.
    private boolean parseElement(SequentLexer lexer, List<Term> terms) {
        Token start = lexer.peek();
        Optional<Term> term = termParser.parse(lexer);
        if (term.isPresent()) {
            terms.add(term.get());
            return false;
        }
        if (!terms.isEmpty()) {
            throw new ParseException("Empty set must be the only item", start.position());
        }
        return true;
    }
}
