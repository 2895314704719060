package FSA.Minimize;

import FSA.Graph.IncidenceAutomaton;
import FSA.Graph.Transition;

/**
 * Hooks of {@link RevuzMinimizer#minimize}. When q2 is merged into q1, the calls are: {@link #mergingStates}, one
 * {@link #moveTransition} per transition entering q2, {@link #removeVertex} for q2, {@link #statesMerged}.
 */
public interface RevuzMinimizeVisitor<I> {
    default void mergingStates(int q1, int q2, IncidenceAutomaton<I> g) { }

    default void moveTransition(Transition<I> eOld, Transition<I> eNew, IncidenceAutomaton<I> g) { }

    default void removeVertex(int u, IncidenceAutomaton<I> g) { }

    default void statesMerged(int q1, int q2, IncidenceAutomaton<I> g) { }
}
