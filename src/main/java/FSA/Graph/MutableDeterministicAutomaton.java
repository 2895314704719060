package FSA.Graph;

/**
 * Mutators of a deterministic automaton.
 */
public interface MutableDeterministicAutomaton<I> extends DeterministicAutomaton<I> {
    int addState();

    /**
     * Adds the transition {@code (q, a, r)}.
     *
     * @return false, and nothing is changed, if {@code q} already has an {@code a}-transition
     */
    boolean addTransition(int q, int r, I a);

    boolean removeTransition(int q, I a);

    default boolean removeTransition(Transition<I> e) {
        return delta(e.source(), e.symbol()) == e.target() && removeTransition(e.source(), e.symbol());
    }

    void setInitial(int q, boolean initial);

    default void setInitial(int q) {
        setInitial(q, true);
    }

    void setFinal(int q, boolean isFinal);

    default void setFinal(int q) {
        setFinal(q, true);
    }
}
