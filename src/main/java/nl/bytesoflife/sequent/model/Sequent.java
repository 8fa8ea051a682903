package nl.bytesoflife.sequent.model;

import java.util.List;

/**
 * An antecedent and a succedent. Multiplicities are kept; order only matters for display.
 */
public record Sequent(List<Term> left, List<Term> right) {

    public Sequent {
        left = List.copyOf(left);
        right = List.copyOf(right);
    }

    public static Sequent of(Term left, Term right) {
        return new Sequent(List.of(left), List.of(right));
    }

    public int connectiveCount() {
        int count = 0;
        for (Term term : left) count += term.connectiveCount();
        for (Term term : right) count += term.connectiveCount();
        return count;
    }

    /**
     * Returns e.g. {@code ¬(A ∧ B) ⊦ C, D ∨ E}; an empty side is written as {@code ∅}.
     */
    @Override
    public String toString() {
        return formatSide(left) + " " + Symbols.TURNSTILE + " " + formatSide(right);
    }

    private static String formatSide(List<Term> terms) {
        if (terms.isEmpty()) {
            return Symbols.EMPTY;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < terms.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(terms.get(i).format(true));
        }
        return sb.toString();
    }
}
