package FSA.Graph;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Deterministic automaton: at most one transition per (state, symbol). Undefined transitions and missing states are
 * reported as {@link #BOTTOM}, which every query accepts and propagates.
 *
 * @param <I> symbol type
 */
public interface DeterministicAutomaton<I> extends TransitionGraph<I> {
    /**
     * "No such state". Distinct from every valid state id.
     */
    int BOTTOM = -1;

    /**
     * @return the initial state, or BOTTOM if there is none
     */
    int initial();

    /**
     * @return the {@code a}-successor of {@code q}, or BOTTOM
     */
    int delta(int q, I a);

    /**
     * @return the outgoing alphabet of {@code q} (empty for BOTTOM)
     */
    Set<I> sigma(int q);

    @Override
    default boolean isInitial(int q) {
        return q != BOTTOM && q == initial();
    }

    default Set<I> alphabet() {
        final Set<I> result = new LinkedHashSet<>();
        for (int q : states()) {
            result.addAll(sigma(q));
        }
        return result;
    }

    default int deltaWord(int q, Iterable<? extends I> word) {
        for (I a : word) {
            if (q == BOTTOM) {
                return q;
            }
            q = delta(q, a);
        }
        return q;
    }

    default boolean accepts(Iterable<? extends I> word) {
        final int q = deltaWord(initial(), word);
        return q != BOTTOM && isFinal(q);
    }

    /**
     * @return true iff every state has a transition for every symbol of {@link #alphabet()}
     */
    default boolean isComplete() {
        final Set<I> alphabet = alphabet();
        for (int q : states()) {
            if (!sigma(q).equals(alphabet)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Consumes the longest prefix of {@code word} readable from the initial state.
     *
     * @return the deepest state reached and the length of the consumed prefix
     */
    default Reach deltaBestEffort(Iterable<? extends I> word) {
        int q = initial();
        int length = 0;
        final Iterator<? extends I> it = word.iterator();
        while (q != BOTTOM && it.hasNext()) {
            final int r = delta(q, it.next());
            if (r == BOTTOM) {
                break;
            }
            q = r;
            length++;
        }
        return new Reach(q, length);
    }

    record Reach(int state, int length) { }
}
