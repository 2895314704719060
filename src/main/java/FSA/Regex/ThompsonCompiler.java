package FSA.Regex;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import FSA.Graph.Nfa;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Thompson's construction: builds an NFA from the postfix form of a regular expression, one {@link Fragment} per
 * sub-expression. Every operation below preserves the single initial state and the single final state of its
 * fragments; the fragments passed as operands must not be used afterwards.
 */
public class ThompsonCompiler extends RpnSink<Fragment> {
    private final Collection<Character> alphabet;

    /**
     * @param alphabet the whole alphabet, complemented by negated classes
     */
    public ThompsonCompiler(Collection<Character> alphabet) {
        super(Operators.REGEX);
        this.alphabet = alphabet;
    }

    /**
     * @throws RegexSyntaxException if {@code pattern} is malformed
     */
    public static Fragment compile(String pattern, Collection<Character> alphabet) {
        if (pattern.isEmpty()) {
            final Nfa<Character> nfa = new Nfa<>(1);
            nfa.setFinal(0);
            return new Fragment(nfa, 0, 0);
        }
        final ThompsonCompiler sink = new ThompsonCompiler(alphabet);
        try {
            return ShuntingYard.evaluate(RegexTokenizer.tokenize(pattern), Operators.REGEX, sink);
        } catch (RegexSyntaxException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new RegexSyntaxException(e.getMessage(), pattern, -1);
        }
    }

    public static Fragment compile(String pattern) {
        return compile(pattern, CharClasses.PRINTABLE);
    }

    @Override
    protected Operator operatorOf(String token) {
        if (token.length() > 1 && token.charAt(0) == '{') {
            return Operators.REPETITION;
        }
        return super.operatorOf(token);
    }

    @Override
    protected Fragment onAppend(String token, Operator op) {
        if (op != null) {
            return null;
        }
        if (token.length() > 1 && token.charAt(0) == '[') {
            return bracket(CharClasses.parseBracket(token, alphabet));
        }
        if (token.length() > 1 && token.charAt(0) == '\\') {
            return bracket(CharClasses.parseEscaped(token, alphabet));
        }
        return literal(token.charAt(0));
    }

    @Override
    protected Fragment onOperation(String token, Operator op, Fragment u, List<Fragment> operands) {
        switch (token) {
            case ".": return concatenation(operands.get(0), operands.get(1));
            case "|": return alternation(operands.get(0), operands.get(1));
            case "?": return zeroOrOne(operands.get(0));
            case "*": return zeroOrMore(operands.get(0));
            case "+": return oneOrMore(operands.get(0));
            default:
                final CharClasses.Repetition repetition = CharClasses.parseRepetition(token);
                return repetitionRange(operands.get(0), repetition.min(), repetition.max());
        }
    }

    public static Fragment literal(char a) {
        final Nfa<Character> nfa = new Nfa<>(2);
        nfa.addTransition(0, 1, a);
        nfa.setFinal(1);
        return new Fragment(nfa, 0, 1);
    }

    /**
     * One transition from the initial state to the final state per character.
     */
    public static Fragment bracket(Set<Character> chars) {
        final Nfa<Character> nfa = new Nfa<>(2);
        nfa.setFinal(1);
        for (char a : CharClasses.sorted(chars)) {
            nfa.addTransition(0, 1, a);
        }
        return new Fragment(nfa, 0, 1);
    }

    /**
     * Copies f2 into f1 and links the final state of f1 to the initial state of the copy.
     */
    public static Fragment concatenation(Fragment f1, Fragment f2) {
        final Nfa<Character> nfa = f1.nfa();
        final Int2IntMap copies = nfa.insert(f2.nfa());
        nfa.addEpsilonTransition(f1.finalState(), copies.get(f2.initial()));
        nfa.setInitials(IntSet.of(f1.initial()));
        nfa.setFinal(f1.finalState(), false);
        return new Fragment(nfa, f1.initial(), copies.get(f2.finalState()));
    }

    public static Fragment alternation(Fragment f1, Fragment f2) {
        final Nfa<Character> nfa = f1.nfa();
        final Int2IntMap copies = nfa.insert(f2.nfa());
        final int q0 = nfa.addState();
        nfa.addEpsilonTransition(q0, f1.initial());
        nfa.addEpsilonTransition(q0, copies.get(f2.initial()));
        nfa.setInitials(IntSet.of(q0));
        final int f = nfa.addState();
        nfa.addEpsilonTransition(f1.finalState(), f);
        nfa.addEpsilonTransition(copies.get(f2.finalState()), f);
        nfa.setFinal(f1.finalState(), false);
        nfa.setFinal(copies.get(f2.finalState()), false);
        nfa.setFinal(f);
        return new Fragment(nfa, q0, f);
    }

    /**
     * Adds a bypass from the initial to the final state. Fragments built here never have a transition entering their
     * initial state or leaving their final state, so the bypass cannot be reached from inside f1.
     */
    public static Fragment zeroOrOne(Fragment f1) {
        f1.nfa().addEpsilonTransition(f1.initial(), f1.finalState());
        return f1;
    }

    public static Fragment zeroOrMore(Fragment f1) {
        return loop(f1, true);
    }

    public static Fragment oneOrMore(Fragment f1) {
        return loop(f1, false);
    }

    private static Fragment loop(Fragment f1, boolean allowEmpty) {
        final Nfa<Character> nfa = f1.nfa();
        final int q0 = nfa.addState();
        final int f = nfa.addState();
        nfa.addEpsilonTransition(q0, f1.initial());
        nfa.addEpsilonTransition(f1.finalState(), f);
        if (allowEmpty) {
            nfa.addEpsilonTransition(q0, f);
        }
        // the back edge stays inside f1: q0 gets no incoming and f no outgoing transition
        nfa.addEpsilonTransition(f1.finalState(), f1.initial());
        nfa.setInitials(IntSet.of(q0));
        nfa.setFinal(f1.finalState(), false);
        nfa.setFinal(f);
        return new Fragment(nfa, q0, f);
    }

    /**
     * {@code m} copies of f1 in a row. For {@code m == 0}, a fresh fragment recognizing only the empty word.
     */
    public static Fragment repetition(Fragment f1, int m) {
        if (m < 0) {
            throw new IllegalArgumentException("Negative repetition: " + m);
        }
        if (m == 0) {
            final Nfa<Character> nfa = new Nfa<>(1);
            nfa.setFinal(0);
            return new Fragment(nfa, 0, 0);
        }
        // copy() keeps the state ids, so f1's initial and final states stay valid in it
        final Nfa<Character> original = f1.nfa().copy();
        Fragment result = f1;
        for (int i = 1; i < m; i++) {
            result = concatenation(result, new Fragment(original, f1.initial(), f1.finalState()));
        }
        return result;
    }

    /**
     * Between {@code m} and {@code n} copies of f1, {@code n} being {@link CharClasses.Repetition#UNBOUNDED} for no
     * upper bound.
     */
    public static Fragment repetitionRange(Fragment f1, int m, int n) {
        final boolean unbounded = n == CharClasses.Repetition.UNBOUNDED;
        if (!unbounded && n < m) {
            throw new IllegalArgumentException("The lower bound " + m + " exceeds the upper bound " + n);
        }
        if (m == 0 && n == 1) {
            return zeroOrOne(f1);
        } else if (m == 0 && unbounded) {
            return zeroOrMore(f1);
        } else if (m == 1 && unbounded) {
            return oneOrMore(f1);
        }

        final Fragment original = new Fragment(f1.nfa().copy(), f1.initial(), f1.finalState());
        if (unbounded) {
            final Fragment mandatory = repetition(f1, m - 1);
            return concatenation(mandatory, oneOrMore(original));
        }
        Fragment result = repetition(f1, m);
        final IntList optionalFinals = new IntArrayList();
        optionalFinals.add(result.finalState());
        for (int i = 0; i < n - m; i++) {
            result = concatenation(result, original);
            optionalFinals.add(result.finalState());
        }
        // stopping after any of the optional copies is accepted
        for (int f : optionalFinals) {
            if (f != result.finalState()) {
                result.nfa().addEpsilonTransition(f, result.finalState());
            }
        }
        return result;
    }
}
