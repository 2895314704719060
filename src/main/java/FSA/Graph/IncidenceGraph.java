package FSA.Graph;

import java.util.List;

/**
 * A {@link TransitionGraph} that also indexes incoming transitions, for algorithms walking backwards.
 */
public interface IncidenceGraph<I> extends TransitionGraph<I> {
    List<Transition<I>> inTransitions(int q);

    default int inDegree(int q) {
        return inTransitions(q).size();
    }

    /**
     * @return a view of this graph where every transition is flipped. Finality and initiality are unchanged.
     */
    default IncidenceGraph<I> reverse() {
        return new ReversedGraph<>(this);
    }
}
