package nl.bytesoflife.sequent.lexer;

import nl.bytesoflife.sequent.parser.ParseException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SequentLexerTest {

    private static List<Token> tokenize(String input) {
        SequentLexer lexer = new SequentLexer(input);
        List<Token> tokens = new ArrayList<>();
        while (lexer.peek() != null) {
            tokens.add(lexer.take());
        }
        return tokens;
    }

    @Test
    void tokenizeCanonicalGlyphs() {
        List<Token> tokens = tokenize("¬A ∧ B ⊦ C ∨ D, ∅");
        assertEquals(List.of(TokenType.NOT, TokenType.VARIABLE, TokenType.AND, TokenType.VARIABLE,
                        TokenType.TURNSTILE, TokenType.VARIABLE, TokenType.OR, TokenType.VARIABLE,
                        TokenType.COMMA, TokenType.EMPTY),
                tokens.stream().map(Token::type).toList());
    }

    @Test
    void asciiAliasesAreNormalized() {
        List<Token> tokens = tokenize("!A & B > C | D");
        assertEquals("¬", tokens.get(0).text());
        assertEquals("∧", tokens.get(2).text());
        assertEquals("⊦", tokens.get(4).text());
        assertEquals("∨", tokens.get(6).text());
    }

    @Test
    void positionsAreOffsetsIntoOriginalInput() {
        List<Token> tokens = tokenize("  Foo1 &\t(Bar)");
        assertEquals(new Token(TokenType.VARIABLE, "Foo1", 2), tokens.get(0));
        assertEquals(7, tokens.get(1).position());
        assertEquals(9, tokens.get(2).position());
        assertEquals(new Token(TokenType.VARIABLE, "Bar", 10), tokens.get(3));
        assertEquals(13, tokens.get(4).position());
    }

    @Test
    void identifiersMayContainDigitsAfterFirstLetter() {
        List<Token> tokens = tokenize("x1y2");
        assertEquals(1, tokens.size());
        assertEquals("x1y2", tokens.get(0).text());
    }

    @Test
    void peekDoesNotConsume() {
        SequentLexer lexer = new SequentLexer("A ⊦ B");
        assertEquals(lexer.peek(), lexer.peek());
        assertEquals(0, lexer.position());
        lexer.consume(TokenType.VARIABLE);
        assertEquals(2, lexer.position());
    }

    @Test
    void endOfInputReturnsNull() {
        SequentLexer lexer = new SequentLexer("   ");
        assertNull(lexer.peek());
        assertEquals(3, lexer.position());
    }

    @Test
    void invalidSymbolReportsOffset() {
        SequentLexer lexer = new SequentLexer("A ⊦ B $ C");
        lexer.take();
        lexer.take();
        lexer.take();
        ParseException e = assertThrows(ParseException.class, lexer::peek);
        assertEquals("Invalid symbol", e.getMessage());
        assertEquals(6, e.getPosition());
    }

    @Test
    void digitCannotStartIdentifier() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("1A"));
        assertEquals(0, e.getPosition());
    }

    @Test
    void takingPastEndIsAnInternalError() {
        SequentLexer lexer = new SequentLexer("");
        assertThrows(IllegalStateException.class, lexer::take);
    }

    @Test
    void consumeOfWrongTypeIsAnInternalError() {
        SequentLexer lexer = new SequentLexer("A");
        assertThrows(IllegalStateException.class, () -> lexer.consume(TokenType.COMMA));
    }
}
