package nl.bytesoflife.sequent.render;

import nl.bytesoflife.sequent.model.Sequent;
import nl.bytesoflife.sequent.model.Symbols;
import nl.bytesoflife.sequent.model.Term;
import nl.bytesoflife.sequent.prover.Derivation;

import java.util.List;

/**
 * Renders a derivation as nested HTML lists. Each sequent becomes a list item whose
 * sub-derivations form a nested {@code <ul>}; commas and the turnstile are wrapped in
 * spans so a stylesheet can space them out.
 */
public class DerivationHtmlRenderer {

    public String render(Derivation derivation) {
        StringBuilder sb = new StringBuilder();
        appendList(sb, List.of(derivation));
        return sb.toString();
    }

    String renderSequent(Sequent sequent) {
        StringBuilder sb = new StringBuilder();
        appendSequent(sb, sequent);
        return sb.toString();
    }

    private void appendList(StringBuilder sb, List<Derivation> derivations) {
        if (derivations.isEmpty()) return;
        sb.append("<ul>");
        for (Derivation derivation : derivations) {
            if (derivation instanceof Derivation.Step step) {
                sb.append("<li>");
                appendSequent(sb, step.sequent());
                appendList(sb, step.children());
                sb.append("</li>");
            } else {
                sb.append("<li class=\"fail\">Fail</li>");
            }
        }
        sb.append("</ul>");
    }

    private void appendSequent(StringBuilder sb, Sequent sequent) {
        appendSide(sb, sequent.left());
        sb.append("<span class=\"turnstile\"> ").append(Symbols.TURNSTILE).append(" </span>");
        appendSide(sb, sequent.right());
    }

    private void appendSide(StringBuilder sb, List<Term> terms) {
        if (terms.isEmpty()) {
            sb.append(Symbols.EMPTY);
            return;
        }
        for (int i = 0; i < terms.size(); i++) {
            if (i > 0) sb.append("<span class=\"comma\">, </span>");
            sb.append(Html.escape(terms.get(i).format(true)));
        }
    }
}
