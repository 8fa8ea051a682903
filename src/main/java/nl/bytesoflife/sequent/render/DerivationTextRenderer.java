package nl.bytesoflife.sequent.render;

import nl.bytesoflife.sequent.prover.Derivation;

/**
 * Renders a derivation as an indented outline, one node per line:
 * <pre>
 * ∅ ⊦ A ∨ (¬A)
 *   ∅ ⊦ A, ¬A
 *     A ⊦ A
 * </pre>
 */
public class DerivationTextRenderer {

    private static final String INDENT = "  ";

    public String render(Derivation derivation) {
        StringBuilder sb = new StringBuilder();
        append(sb, derivation, 0);
        return sb.toString();
    }

    private void append(StringBuilder sb, Derivation derivation, int level) {
        sb.append(INDENT.repeat(level));
        if (derivation instanceof Derivation.Step step) {
            sb.append(step.sequent()).append('\n');
            for (Derivation child : step.children()) {
                append(sb, child, level + 1);
            }
        } else {
            sb.append("Fail\n");
        }
    }
}
