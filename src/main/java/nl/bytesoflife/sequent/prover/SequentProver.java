package nl.bytesoflife.sequent.prover;

import nl.bytesoflife.sequent.model.Sequent;
import nl.bytesoflife.sequent.model.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Backward proof search in the propositional sequent calculus.
 *
 * <p>At every sequent the first applicable rule wins, tried in this order: axiom on a
 * variable shared by both sides, non-branching rules on the left (¬, ∧), non-branching
 * rules on the right (¬, ∨), branching on the left (∨), branching on the right (∧).
 * Each rule removes one connective, so the recursion depth is bounded by the
 * connective count of the input.
 */
public class SequentProver {

    private static final Logger log = LoggerFactory.getLogger(SequentProver.class);

    public Derivation.Step prove(Sequent sequent) {
        long startTime = System.nanoTime();
        Derivation.Step proof = search(sequent);
        if (log.isDebugEnabled()) {
            log.debug("Searched {} ({} connectives): {} in {} nodes, depth {}, {}us",
                    sequent, sequent.connectiveCount(), proof.isProved() ? "proved" : "not provable",
                    proof.size(), proof.depth(), (System.nanoTime() - startTime) / 1000);
        }
        return proof;
    }

    private Derivation.Step search(Sequent sequent) {
        List<Term> left = sequent.left();
        List<Term> right = sequent.right();

        // Axiom: first variable on the left that also occurs on the right
        for (Term lt : left) {
            if (lt instanceof Term.Variable lv) {
                for (Term rt : right) {
                    if (rt instanceof Term.Variable rv && rv.name().equals(lv.name())) {
                        if (left.size() == 1 && right.size() == 1) {
                            return new Derivation.Step(sequent);
                        }
                        return new Derivation.Step(sequent, new Derivation.Step(Sequent.of(lt, rt)));
                    }
                }
            }
        }

        // Non-branching rules on the left
        for (int i = 0; i < left.size(); i++) {
            Term term = left.get(i);
            if (term instanceof Term.Not not) {
                List<Term> newLeft = new ArrayList<>(left);
                newLeft.remove(i);
                List<Term> newRight = new ArrayList<>(right);
                newRight.add(not.child());
                return new Derivation.Step(sequent, search(new Sequent(newLeft, newRight)));
            } else if (term instanceof Term.And and) {
                return new Derivation.Step(sequent,
                        search(new Sequent(expand(left, i, and.left(), and.right()), right)));
            }
        }

        // Non-branching rules on the right
        for (int i = 0; i < right.size(); i++) {
            Term term = right.get(i);
            if (term instanceof Term.Not not) {
                List<Term> newRight = new ArrayList<>(right);
                newRight.remove(i);
                List<Term> newLeft = new ArrayList<>(left);
                newLeft.add(not.child());
                return new Derivation.Step(sequent, search(new Sequent(newLeft, newRight)));
            } else if (term instanceof Term.Or or) {
                return new Derivation.Step(sequent,
                        search(new Sequent(left, expand(right, i, or.left(), or.right()))));
            }
        }

        // Branching rules
        for (int i = 0; i < left.size(); i++) {
            if (left.get(i) instanceof Term.Or or) {
                Derivation first = search(new Sequent(replace(left, i, or.left()), right));
                Derivation second = search(new Sequent(replace(left, i, or.right()), right));
                return new Derivation.Step(sequent, first, second);
            }
        }
        for (int i = 0; i < right.size(); i++) {
            if (right.get(i) instanceof Term.And and) {
                Derivation first = search(new Sequent(left, replace(right, i, and.left())));
                Derivation second = search(new Sequent(left, replace(right, i, and.right())));
                return new Derivation.Step(sequent, first, second);
            }
        }

        // Only variables remain and none is shared
        return new Derivation.Step(sequent, Derivation.Fail.INSTANCE);
    }

    private static List<Term> expand(List<Term> terms, int index, Term first, Term second) {
        List<Term> result = new ArrayList<>(terms.size() + 1);
        result.addAll(terms.subList(0, index));
        result.add(first);
        result.add(second);
        result.addAll(terms.subList(index + 1, terms.size()));
        return result;
    }

    private static List<Term> replace(List<Term> terms, int index, Term replacement) {
        List<Term> result = new ArrayList<>(terms);
        result.set(index, replacement);
        return result;
    }
}
