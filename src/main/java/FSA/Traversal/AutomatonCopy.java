package FSA.Traversal;

import java.util.function.IntPredicate;

import FSA.Graph.DeterministicAutomaton;
import FSA.Graph.MutableDeterministicAutomaton;
import FSA.Graph.Transition;
import FSA.Graph.TransitionGraph;
import FSA.Property.AssocAttributeMap;
import FSA.Property.AttributeMap;

/**
 * Copies the part of an automaton reachable from a state through relevant states and transitions.
 */
public final class AutomatonCopy {
    private AutomatonCopy() { }

    public static <I> AssocAttributeMap<Integer, Integer> copy(int s, DeterministicAutomaton<I> g,
                                                              MutableDeterministicAutomaton<I> dup) {
        return copy(s, g, dup, q -> true, EdgeFilter.all());
    }

    /**
     * Copies into {@code dup} the states reachable from {@code s} through transitions accepted by
     * {@code relevantEdge} whose targets are accepted by {@code relevantState}. Finality is copied and the copy of
     * {@code s} becomes the initial state of {@code dup}.
     *
     * @return the mapping from the copied states of {@code g} to their copies in {@code dup}
     */
    public static <I> AssocAttributeMap<Integer, Integer> copy(int s, DeterministicAutomaton<I> g,
                                                              MutableDeterministicAutomaton<I> dup,
                                                              IntPredicate relevantState,
                                                              EdgeFilter<I> relevantEdge) {
        final AssocAttributeMap<Integer, Integer> mapping = AttributeMap.assoc(DeterministicAutomaton.BOTTOM);
        final DepthFirstSearchVisitor<I> vis = new DepthFirstSearchVisitor<>() {
            private int dupState(int u, TransitionGraph<I> g) {
                final int uDup = dup.addState();
                mapping.put(u, uDup);
                if (g.isFinal(u)) {
                    dup.setFinal(uDup);
                }
                return uDup;
            }

            @Override
            public void startVertex(int s, TransitionGraph<I> g) {
                dup.setInitial(dupState(s, g));
            }

            @Override
            public void examineEdge(Transition<I> e, TransitionGraph<I> g) {
                final int uDup = mapping.get(e.source());
                final int vDup = mapping.containsKey(e.target()) ? mapping.get(e.target()) : dupState(e.target(), g);
                dup.addTransition(uDup, vDup, e.symbol());
            }
        };
        DepthFirstSearch.search(g, s, AttributeMap.assoc(Color.WHITE), vis,
                                e -> relevantEdge.ifPush(e) && relevantState.test(e.target()));
        return mapping;
    }
}
