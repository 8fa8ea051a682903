package nl.bytesoflife.sequent.parser;

import nl.bytesoflife.sequent.BuiltinExamples;
import nl.bytesoflife.sequent.model.Sequent;
import nl.bytesoflife.sequent.model.Term;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SequentParserTest {

    private static final Term A = new Term.Variable("A");
    private static final Term B = new Term.Variable("B");
    private static final Term C = new Term.Variable("C");

    private final SequentParser parser = new SequentParser();

    private ParseException parseError(String input) {
        return assertThrows(ParseException.class, () -> parser.parse(input));
    }

    @Test
    void parseSimpleSequent() {
        assertEquals(Sequent.of(A, A), parser.parse("A ⊦ A"));
    }

    @Test
    void parseCommaSeparatedSides() {
        Sequent sequent = parser.parse("A ∧ B, ¬C ⊦ C, A ∨ B");
        assertEquals(List.of(new Term.And(A, B), new Term.Not(C)), sequent.left());
        assertEquals(List.of(C, new Term.Or(A, B)), sequent.right());
    }

    @Test
    void parseAsciiNotation() {
        assertEquals(parser.parse("¬A ∧ B ⊦ A ∨ C"), parser.parse("!A&B>A|C"));
    }

    @Test
    void emptySideMayBeOmittedOrWrittenAsEmptySet() {
        Sequent expected = new Sequent(List.of(), List.of(new Term.Or(A, new Term.Not(A))));
        assertEquals(expected, parser.parse("⊦ A∨¬A"));
        assertEquals(expected, parser.parse("∅ ⊦ A∨¬A"));

        assertEquals(new Sequent(List.of(A), List.of()), parser.parse("A ⊦"));
        assertEquals(new Sequent(List.of(A), List.of()), parser.parse("A ⊦ ∅"));
        assertEquals(new Sequent(List.of(), List.of()), parser.parse("∅ ⊦ ∅"));
        assertEquals(new Sequent(List.of(), List.of()), parser.parse(">"));
    }

    @Test
    void duplicateTermsAreKept() {
        assertEquals(new Sequent(List.of(A, A), List.of(B, B)), parser.parse("A, A ⊦ B, B"));
    }

    @Test
    void closingParenthesisAtStart() {
        ParseException e = parseError(")A ⊦ A");
        assertEquals(0, e.getPosition());
    }

    @Test
    void missingTurnstile() {
        ParseException e = parseError("A");
        assertEquals("Comma or turnstile expected", e.getMessage());
        assertEquals(1, e.getPosition());

        assertEquals(0, parseError("").getPosition());
        assertEquals(4, parseError("A, B").getPosition());
    }

    @Test
    void secondTurnstile() {
        ParseException e = parseError("A ⊦ B ⊦ C");
        assertEquals("Turnstile not expected", e.getMessage());
        assertEquals(6, e.getPosition());
    }

    @Test
    void danglingComma() {
        ParseException e = parseError("A ⊦ B,");
        assertEquals("Term expected", e.getMessage());
        assertEquals(6, e.getPosition());

        e = parseError("A,");
        assertEquals("Term expected", e.getMessage());
        assertEquals(2, e.getPosition());
    }

    @Test
    void commaBeforeTurnstile() {
        ParseException e = parseError("A, ⊦ B");
        assertEquals("Blank term", e.getMessage());
        assertEquals(3, e.getPosition());
    }

    @Test
    void leadingComma() {
        ParseException e = parseError(", A ⊦ B");
        assertEquals("Term or turnstile expected", e.getMessage());
        assertEquals(0, e.getPosition());

        e = parseError("A ⊦ , B");
        assertEquals("Term or end expected", e.getMessage());
        assertEquals(4, e.getPosition());
    }

    @Test
    void doubledComma() {
        ParseException e = parseError("A ⊦ B,, C");
        assertEquals("Blank term", e.getMessage());
        assertEquals(6, e.getPosition());
    }

    @Test
    void missingComma() {
        ParseException e = parseError("∅ A ⊦ B");
        assertEquals("Comma expected", e.getMessage());
        assertEquals(2, e.getPosition());
    }

    @Test
    void emptySetMustBeTheOnlyItem() {
        ParseException e = parseError("A, ∅ ⊦ B");
        assertEquals("Empty set must be the only item", e.getMessage());
        assertEquals(3, e.getPosition());

        e = parseError("A ⊦ ∅, B");
        assertEquals("Empty set must be the only item", e.getMessage());
        assertEquals(5, e.getPosition());
    }

    @Test
    void invalidCharacter() {
        ParseException e = parseError("A ⊦ B → C");
        assertEquals("Invalid symbol", e.getMessage());
        assertEquals(6, e.getPosition());
    }

    @Test
    void tryParseReturnsOutcome() {
        assertEquals(new ParseOutcome.Parsed(Sequent.of(A, B)), parser.tryParse("A ⊦ B"));
        assertEquals(new ParseOutcome.Failed("Comma or turnstile expected", 1), parser.tryParse("A"));
    }

    @Test
    void formattedSequentParsesBackToSameStructure() {
        List<String> inputs = List.of(
                "A ⊦ A",
                "⊦ A∨¬A",
                "!!A, (A|B)&C > !(A&B), C|D|E",
                "¬(A ∨ B) ∧ ¬¬C ⊦ ∅",
                "A ∧ (B ∨ (C ∧ ¬(D ∨ E))) ⊦ ((A))",
                "∅ ⊦ ∅");
        for (String input : inputs) {
            Sequent parsed = parser.parse(input);
            assertEquals(parsed, parser.parse(parsed.toString()), input);
        }
        for (String example : BuiltinExamples.all()) {
            Sequent parsed = parser.parse(example);
            assertEquals(parsed, parser.parse(parsed.toString()), example);
        }
    }
}
