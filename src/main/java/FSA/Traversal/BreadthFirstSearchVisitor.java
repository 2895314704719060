package FSA.Traversal;

import FSA.Graph.Transition;
import FSA.Graph.TransitionGraph;

/**
 * Hooks of {@link BreadthFirstSearch}. Every hook does nothing by default.
 */
public interface BreadthFirstSearchVisitor<I> {
    default void initializeVertex(int u, TransitionGraph<I> g) { }

    default void discoverVertex(int u, TransitionGraph<I> g) { }

    default void examineVertex(int u, TransitionGraph<I> g) { }

    default void examineEdge(Transition<I> e, TransitionGraph<I> g) { }

    default void treeEdge(Transition<I> e, TransitionGraph<I> g) { }

    /**
     * Called before {@link #grayTarget} or {@link #blackTarget}.
     */
    default void nonTreeEdge(Transition<I> e, TransitionGraph<I> g) { }

    default void grayTarget(Transition<I> e, TransitionGraph<I> g) { }

    default void blackTarget(Transition<I> e, TransitionGraph<I> g) { }

    default void finishVertex(int u, TransitionGraph<I> g) { }
}
