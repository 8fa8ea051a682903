package nl.bytesoflife.sequent.parser;

import nl.bytesoflife.sequent.model.Sequent;

/**
 * Result of {@link SequentParser#tryParse(String)}: either a sequent or the syntax error.
 */
public sealed interface ParseOutcome permits ParseOutcome.Parsed, ParseOutcome.Failed {

    record Parsed(Sequent sequent) implements ParseOutcome {
    }

    record Failed(String message, int position) implements ParseOutcome {
    }
}
