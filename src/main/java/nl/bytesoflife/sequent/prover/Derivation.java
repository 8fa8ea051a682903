package nl.bytesoflife.sequent.prover;

import nl.bytesoflife.sequent.model.Sequent;

import java.util.List;
import java.util.Objects;

/**
 * A node of a derivation tree: either a sequent with up to two sub-derivations, or the
 * fail leaf marking a branch that cannot be closed.
 */
public sealed interface Derivation permits Derivation.Step, Derivation.Fail {

    /**
     * True if no fail leaf occurs anywhere in this subtree.
     */
    boolean isProved();

    /**
     * Number of nodes in this subtree.
     */
    int size();

    /**
     * Number of nodes on the longest path from this node to a leaf.
     */
    int depth();

    record Step(Sequent sequent, List<Derivation> children) implements Derivation {

        public Step {
            Objects.requireNonNull(sequent, "sequent");
            children = List.copyOf(children);
            if (children.size() > 2) {
                throw new IllegalArgumentException("A derivation step has at most two children, got " + children.size());
            }
        }

        public Step(Sequent sequent, Derivation... children) {
            this(sequent, List.of(children));
        }

        /**
         * A step with no children: the sequent is closed as an axiom.
         */
        public boolean isAxiom() {
            return children.isEmpty();
        }

        @Override
        public boolean isProved() {
            for (Derivation child : children) {
                if (!child.isProved()) return false;
            }
            return true;
        }

        @Override
        public int size() {
            int size = 1;
            for (Derivation child : children) size += child.size();
            return size;
        }

        @Override
        public int depth() {
            int deepest = 0;
            for (Derivation child : children) deepest = Math.max(deepest, child.depth());
            return deepest + 1;
        }
    }

    record Fail() implements Derivation {

        public static final Fail INSTANCE = new Fail();

        @Override
        public boolean isProved() {
            return false;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public String toString() {
            return "Fail";
        }
    }
}
