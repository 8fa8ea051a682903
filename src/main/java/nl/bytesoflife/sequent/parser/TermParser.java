package nl.bytesoflife.sequent.parser;

import nl.bytesoflife.sequent.lexer.SequentLexer;
import nl.bytesoflife.sequent.lexer.Token;
import nl.bytesoflife.sequent.lexer.TokenType;
import nl.bytesoflife.sequent.model.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses a single term, stopping before a comma, a turnstile or the end of input.
 *
 * <p>Shift-reduce parser with deferred reductions. {@code ¬} and {@code ∧} are reduced
 * eagerly as soon as their right operand is complete, so the stack only ever holds
 * operands separated by pending {@code ∨} operators (plus open parentheses and unary
 * prefixes still waiting for an operand). Pending {@code ∨}s are folded left to right
 * when another {@code ∨}, a closing parenthesis or the end of the term is reached.
 */
public class TermParser {

    private sealed interface Item permits Operand, Operator {
    }

    private record Operand(Term term) implements Item {
    }

    private record Operator(TokenType type) implements Item {
    }

    /**
     * Parses the term at the lexer's position. Returns empty if the leading token is {@code ∅}.
     */
    public Optional<Term> parse(SequentLexer lexer) {
        Token first = lexer.peek();
        if (first != null && first.is(TokenType.EMPTY)) {
            lexer.consume(TokenType.EMPTY);
            return Optional.empty();
        }

        List<Item> stack = new ArrayList<>();
        while (true) {
            Token next = lexer.peek();
            if (next == null || next.is(TokenType.TURNSTILE) || next.is(TokenType.COMMA)) {
                break;
            }

            switch (next.type()) {
                case VARIABLE -> {
                    checkBeforePushingUnary(stack, lexer);
                    stack.add(new Operand(new Term.Variable(lexer.take().text())));
                    reduce(stack);
                }
                case NOT, OPEN_PAREN -> {
                    checkBeforePushingUnary(stack, lexer);
                    stack.add(new Operator(lexer.take().type()));
                }
                case AND -> {
                    checkBeforePushingBinary(stack, lexer);
                    stack.add(new Operator(lexer.take().type()));
                }
                case OR -> {
                    checkBeforePushingBinary(stack, lexer);
                    finalReduce(stack);
                    stack.add(new Operator(lexer.take().type()));
                }
                case CLOSE_PAREN -> {
                    finalReduce(stack);
                    int size = stack.size();
                    if (size < 2 || !(stack.get(size - 1) instanceof Operand)
                            || !isOperator(stack.get(size - 2), TokenType.OPEN_PAREN)) {
                        throw new ParseException("Unexpected closing parenthesis", lexer.position());
                    }
                    lexer.consume(TokenType.CLOSE_PAREN);
                    stack.remove(size - 2);
                    reduce(stack);
                }
                case EMPTY -> throw new ParseException("Empty not expected", lexer.position());
                default -> throw new IllegalStateException("Unhandled token " + next);
            }
        }
        finalReduce(stack);

        if (stack.size() == 1 && stack.get(0) instanceof Operand operand) {
            return Optional.of(operand.term());
        } else if (stack.isEmpty()) {
            throw new ParseException("Blank term", lexer.position());
        } else {
            throw new ParseException("Expected more", lexer.position());
        }
    }

    // Folds ¬ and ∧ whose operands are complete.
    private static void reduce(List<Item> stack) {
        while (true) {
            int size = stack.size();
            if (size >= 2 && stack.get(size - 1) instanceof Operand operand
                    && isOperator(stack.get(size - 2), TokenType.NOT)) {
                stack.remove(size - 1);
                stack.set(size - 2, new Operand(new Term.Not(operand.term())));
            } else if (size >= 3 && stack.get(size - 1) instanceof Operand right
                    && isOperator(stack.get(size - 2), TokenType.AND)
                    && stack.get(size - 3) instanceof Operand left) {
                stack.subList(size - 2, size).clear();
                stack.set(size - 3, new Operand(new Term.And(left.term(), right.term())));
            } else {
                break;
            }
        }
    }

    // Folds pending ∨ operators.
    private static void finalReduce(List<Item> stack) {
        while (true) {
            int size = stack.size();
            if (size >= 3 && stack.get(size - 1) instanceof Operand right
                    && isOperator(stack.get(size - 2), TokenType.OR)
                    && stack.get(size - 3) instanceof Operand left) {
                stack.subList(size - 2, size).clear();
                stack.set(size - 3, new Operand(new Term.Or(left.term(), right.term())));
            } else {
                break;
            }
        }
    }

    private static void checkBeforePushingUnary(List<Item> stack, SequentLexer lexer) {
        if (!stack.isEmpty() && stack.get(stack.size() - 1) instanceof Operand) {
            throw new ParseException("Unexpected item", lexer.position());
        }
    }

    private static void checkBeforePushingBinary(List<Item> stack, SequentLexer lexer) {
        if (stack.isEmpty() || !(stack.get(stack.size() - 1) instanceof Operand)) {
            throw new ParseException("Unexpected item", lexer.position());
        }
    }

    private static boolean isOperator(Item item, TokenType type) {
        return item instanceof Operator operator && operator.type() == type;
    }
}
