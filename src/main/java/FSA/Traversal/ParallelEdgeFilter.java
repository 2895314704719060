package FSA.Traversal;

import FSA.Graph.Transition;

/**
 * Tells {@link ParallelBreadthFirstSearch} whether a discovered pair must be explored. A side is null when its
 * source state is BOTTOM; otherwise its target may be BOTTOM.
 */
@FunctionalInterface
public interface ParallelEdgeFilter<I> {
    boolean ifPush(Transition<I> e1, Transition<I> e2);

    static <I> ParallelEdgeFilter<I> all() {
        return (e1, e2) -> true;
    }
}
