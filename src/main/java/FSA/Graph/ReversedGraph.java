package FSA.Graph;

import java.util.ArrayList;
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntList;

class ReversedGraph<I> implements IncidenceGraph<I> {
    private final IncidenceGraph<I> g;

    ReversedGraph(IncidenceGraph<I> g) {
        this.g = g;
    }

    private static <I> List<Transition<I>> flip(List<Transition<I>> transitions) {
        final List<Transition<I>> result = new ArrayList<>(transitions.size());
        for (Transition<I> e : transitions) {
            result.add(e.reversed());
        }
        return result;
    }

    @Override
    public IntList states() {
        return g.states();
    }

    @Override
    public int numStates() {
        return g.numStates();
    }

    @Override
    public boolean hasState(int q) {
        return g.hasState(q);
    }

    @Override
    public List<Transition<I>> outTransitions(int q) {
        return flip(g.inTransitions(q));
    }

    @Override
    public int outDegree(int q) {
        return g.inDegree(q);
    }

    @Override
    public List<Transition<I>> inTransitions(int q) {
        return flip(g.outTransitions(q));
    }

    @Override
    public int inDegree(int q) {
        return g.outDegree(q);
    }

    @Override
    public List<Transition<I>> transitions() {
        return flip(g.transitions());
    }

    @Override
    public int numTransitions() {
        return g.numTransitions();
    }

    @Override
    public boolean isFinal(int q) {
        return g.isFinal(q);
    }

    @Override
    public boolean isInitial(int q) {
        return g.isInitial(q);
    }

    @Override
    public IncidenceGraph<I> reverse() {
        return g;
    }
}
