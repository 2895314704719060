package FSA.Traversal;

import FSA.Graph.Transition;

/**
 * Tells a traversal whether the target of a transition must be explored.
 */
@FunctionalInterface
public interface EdgeFilter<I> {
    boolean ifPush(Transition<I> e);

    static <I> EdgeFilter<I> all() {
        return e -> true;
    }
}
