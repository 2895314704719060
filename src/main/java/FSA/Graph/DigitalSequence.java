package FSA.Graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Read-only automaton recognizing a single word w: states 0..|w|, transitions (i, i+1, w[i]), final state |w|.
 * Every mutator throws {@link IllegalStateException}.
 */
public class DigitalSequence<I> implements MutableDeterministicAutomaton<I>, IncidenceGraph<I> {
    private static final String IMMUTABLE = "A digital sequence is immutable";

    private final List<I> word;

    public DigitalSequence(List<? extends I> word) {
        this.word = List.copyOf(word);
    }

    public static DigitalSequence<Character> of(String s) {
        return new DigitalSequence<>(Automata.chars(s));
    }

    public List<I> word() {
        return word;
    }

    @Override
    public int initial() {
        return 0;
    }

    @Override
    public int delta(int q, I a) {
        return hasState(q) && !isFinal(q) && word.get(q).equals(a) ? q + 1 : BOTTOM;
    }

    @Override
    public Set<I> sigma(int q) {
        return hasState(q) && !isFinal(q) ? Collections.singleton(word.get(q)) : Collections.emptySet();
    }

    @Override
    public Set<I> alphabet() {
        return new LinkedHashSet<>(word);
    }

    @Override
    public IntList states() {
        final IntList result = new IntArrayList(word.size() + 1);
        for (int q = 0; q <= word.size(); q++) {
            result.add(q);
        }
        return result;
    }

    @Override
    public int numStates() {
        return word.size() + 1;
    }

    @Override
    public boolean hasState(int q) {
        return q >= 0 && q <= word.size();
    }

    @Override
    public List<Transition<I>> outTransitions(int q) {
        return hasState(q) && !isFinal(q)
            ? List.of(new Transition<>(q, q + 1, word.get(q)))
            : Collections.emptyList();
    }

    @Override
    public List<Transition<I>> inTransitions(int q) {
        return hasState(q) && q > 0
            ? List.of(new Transition<>(q - 1, q, word.get(q - 1)))
            : Collections.emptyList();
    }

    @Override
    public List<Transition<I>> transitions() {
        final List<Transition<I>> result = new ArrayList<>(word.size());
        for (int q = 0; q < word.size(); q++) {
            result.add(new Transition<>(q, q + 1, word.get(q)));
        }
        return result;
    }

    @Override
    public int numTransitions() {
        return word.size();
    }

    @Override
    public boolean isFinal(int q) {
        return q == word.size();
    }

    @Override
    public boolean isInitial(int q) {
        return q == 0;
    }

    @Override
    public int addState() {
        throw new IllegalStateException(IMMUTABLE);
    }

    @Override
    public boolean addTransition(int q, int r, I a) {
        throw new IllegalStateException(IMMUTABLE);
    }

    @Override
    public boolean removeTransition(int q, I a) {
        throw new IllegalStateException(IMMUTABLE);
    }

    @Override
    public boolean removeTransition(Transition<I> e) {
        throw new IllegalStateException(IMMUTABLE);
    }

    @Override
    public void setInitial(int q, boolean initial) {
        throw new IllegalStateException(IMMUTABLE);
    }

    @Override
    public void setFinal(int q, boolean isFinal) {
        throw new IllegalStateException(IMMUTABLE);
    }
}
