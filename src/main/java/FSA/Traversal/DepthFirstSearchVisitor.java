package FSA.Traversal;

import FSA.Graph.Transition;
import FSA.Graph.TransitionGraph;

/**
 * Hooks of {@link DepthFirstSearch}. Every hook does nothing by default.
 */
public interface DepthFirstSearchVisitor<I> {
    default void startVertex(int s, TransitionGraph<I> g) { }

    default void discoverVertex(int u, TransitionGraph<I> g) { }

    default void examineEdge(Transition<I> e, TransitionGraph<I> g) { }

    default void treeEdge(Transition<I> e, TransitionGraph<I> g) { }

    /**
     * The target of {@code e} is an ancestor of its source: {@code e} closes a cycle.
     */
    default void backEdge(Transition<I> e, TransitionGraph<I> g) { }

    default void forwardOrCrossEdge(Transition<I> e, TransitionGraph<I> g) { }

    default void finishVertex(int u, TransitionGraph<I> g) { }
}
