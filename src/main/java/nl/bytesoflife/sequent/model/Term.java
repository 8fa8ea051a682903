package nl.bytesoflife.sequent.model;

import java.util.Objects;

/**
 * A propositional formula. Compound terms own their children; equality is structural.
 */
public sealed interface Term permits Term.Variable, Term.Not, Term.And, Term.Or {

    /**
     * Formats this term. A root term is written without outer parentheses,
     * every compound sub-term is parenthesized, e.g. {@code (A ∧ (¬B)) ∨ C}.
     */
    String format(boolean root);

    int connectiveCount();

    record Variable(String name) implements Term {
        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String format(boolean root) {
            return name;
        }

        @Override
        public int connectiveCount() {
            return 0;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Not(Term child) implements Term {
        public Not {
            Objects.requireNonNull(child, "child");
        }

        @Override
        public String format(boolean root) {
            return wrap(Symbols.NOT + child.format(false), root);
        }

        @Override
        public int connectiveCount() {
            return 1 + child.connectiveCount();
        }

        @Override
        public String toString() {
            return format(true);
        }
    }

    record And(Term left, Term right) implements Term {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String format(boolean root) {
            return wrap(left.format(false) + " " + Symbols.AND + " " + right.format(false), root);
        }

        @Override
        public int connectiveCount() {
            return 1 + left.connectiveCount() + right.connectiveCount();
        }

        @Override
        public String toString() {
            return format(true);
        }
    }

    record Or(Term left, Term right) implements Term {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String format(boolean root) {
            return wrap(left.format(false) + " " + Symbols.OR + " " + right.format(false), root);
        }

        @Override
        public int connectiveCount() {
            return 1 + left.connectiveCount() + right.connectiveCount();
        }

        @Override
        public String toString() {
            return format(true);
        }
    }

    private static String wrap(String text, boolean root) {
        return root ? text : "(" + text + ")";
    }
}
