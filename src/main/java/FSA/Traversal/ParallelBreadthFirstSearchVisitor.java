package FSA.Traversal;

import FSA.Graph.DeterministicAutomaton;
import FSA.Graph.Transition;

/**
 * Hooks of {@link ParallelBreadthFirstSearch}, called on pairs of states {@code (q1, q2)} of {@code (g1, g2)}.
 * <p>
 * Edge hooks receive one transition per automaton. A transition is null when its source is BOTTOM, and its target
 * is BOTTOM when the automaton has no transition for the symbol.
 */
public interface ParallelBreadthFirstSearchVisitor<I> {
    /**
     * Called once per source pair, before the search starts.
     */
    default void startVertex(int s1, DeterministicAutomaton<I> g1, int s2, DeterministicAutomaton<I> g2) { }

    default void examineVertex(int q1, DeterministicAutomaton<I> g1, int q2, DeterministicAutomaton<I> g2) { }

    default void discoverVertex(int q1, DeterministicAutomaton<I> g1, int q2, DeterministicAutomaton<I> g2) { }

    default void finishVertex(int q1, DeterministicAutomaton<I> g1, int q2, DeterministicAutomaton<I> g2) { }

    default void examineSymbol(int q1, DeterministicAutomaton<I> g1, int q2, DeterministicAutomaton<I> g2, I a) { }

    default void examineEdge(Transition<I> e1, DeterministicAutomaton<I> g1,
                             Transition<I> e2, DeterministicAutomaton<I> g2, I a) { }

    default void treeEdge(Transition<I> e1, DeterministicAutomaton<I> g1,
                          Transition<I> e2, DeterministicAutomaton<I> g2, I a) { }

    default void grayTarget(Transition<I> e1, DeterministicAutomaton<I> g1,
                            Transition<I> e2, DeterministicAutomaton<I> g2, I a) { }

    default void blackTarget(Transition<I> e1, DeterministicAutomaton<I> g1,
                             Transition<I> e2, DeterministicAutomaton<I> g2, I a) { }
}
