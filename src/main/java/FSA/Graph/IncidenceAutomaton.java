package FSA.Graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import FSA.Property.AttributeMap;

/**
 * {@link Automaton} that also maintains, for every state, the set of its incoming transitions. The backward index is
 * updated by every add and remove.
 */
public class IncidenceAutomaton<I> extends Automaton<I> implements IncidenceGraph<I> {
    private final List<Set<Transition<I>>> inAdjacencies = new ArrayList<>();

    public IncidenceAutomaton() {
        this(0);
    }

    public IncidenceAutomaton(int numStates) {
        this(numStates, AttributeMap.assoc(false));
    }

    public IncidenceAutomaton(int numStates, AttributeMap<Integer, Boolean> finals) {
        super(0, finals);
        for (int i = 0; i < numStates; i++) {
            addState();
        }
    }

    @Override
    public int addState() {
        final int q = super.addState();
        inAdjacencies.add(new LinkedHashSet<>());
        return q;
    }

    @Override
    public boolean addTransition(int q, int r, I a) {
        if (!super.addTransition(q, r, a)) {
            return false;
        }
        inAdjacencies.get(r).add(new Transition<>(q, r, a));
        return true;
    }

    @Override
    public boolean removeTransition(int q, I a) {
        final int r = delta(q, a);
        if (!super.removeTransition(q, a)) {
            return false;
        }
        inAdjacencies.get(r).remove(new Transition<>(q, r, a));
        return true;
    }

    /**
     * Removes the incident transitions of {@code q} (outgoing, then incoming), then {@code q} itself.
     */
    @Override
    public void removeState(int q) {
        checkState(q);
        for (Transition<I> e : outTransitions(q)) {
            removeTransition(e.source(), e.symbol());
        }
        for (Transition<I> e : inTransitions(q)) {
            removeTransition(e.source(), e.symbol());
        }
        dropState(q);
        inAdjacencies.set(q, null);
    }

    @Override
    public List<Transition<I>> inTransitions(int q) {
        return hasState(q) ? new ArrayList<>(inAdjacencies.get(q)) : Collections.emptyList();
    }

    @Override
    public int inDegree(int q) {
        return hasState(q) ? inAdjacencies.get(q).size() : 0;
    }
}
