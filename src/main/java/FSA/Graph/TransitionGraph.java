package FSA.Graph;

import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Read surface shared by every automaton: states, labeled transitions, finality. Traversals and external consumers
 * (renderers, converters) only rely on this interface.
 *
 * @param <I> symbol type
 */
public interface TransitionGraph<I> {
    /**
     * @return the states, sorted, as a snapshot that stays valid while the graph is mutated
     */
    IntList states();

    int numStates();

    boolean hasState(int q);

    /**
     * @return the outgoing transitions of {@code q}, as a snapshot
     */
    List<Transition<I>> outTransitions(int q);

    default int outDegree(int q) {
        return outTransitions(q).size();
    }

    List<Transition<I>> transitions();

    int numTransitions();

    boolean isFinal(int q);

    boolean isInitial(int q);

    default IntList finals() {
        final IntList result = new IntArrayList();
        for (int q : states()) {
            if (isFinal(q)) {
                result.add(q);
            }
        }
        return result;
    }
}
