package FSA.Product;

import FSA.Graph.Automaton;
import FSA.Graph.DeterministicAutomaton;
import FSA.Graph.MutableDeterministicAutomaton;
import FSA.Graph.Transition;
import FSA.Product.ProductBuilder.Combinator;
import FSA.Traversal.ParallelBreadthFirstSearch;
import FSA.Traversal.ParallelBreadthFirstSearchVisitor;

import static FSA.Graph.DeterministicAutomaton.BOTTOM;

/**
 * Builds a deterministic automaton recognizing L(g1) ∩ L(g2). Only pairs where both sides are defined are explored.
 */
public final class DeterministicIntersection {
    private DeterministicIntersection() { }

    public static <I> Automaton<I> intersection(DeterministicAutomaton<I> g1, DeterministicAutomaton<I> g2) {
        final Automaton<I> g12 = new Automaton<>();
        intersection(g1, g2, g12);
        return g12;
    }

    private static <I> boolean bothDefined(Transition<I> e1, Transition<I> e2) {
        return e1 != null && e1.target() != BOTTOM && e2 != null && e2.target() != BOTTOM;
    }

    /**
     * @param g12 empty output automaton
     */
    public static <I> void intersection(DeterministicAutomaton<I> g1, DeterministicAutomaton<I> g2,
                                        MutableDeterministicAutomaton<I> g12) {
        final ProductBuilder<I> builder = new ProductBuilder<>(g12, Combinator.AND);
        ParallelBreadthFirstSearch.search(g1, g2, new ParallelBreadthFirstSearchVisitor<>() {
            @Override
            public void startVertex(int s1, DeterministicAutomaton<I> g1, int s2, DeterministicAutomaton<I> g2) {
                if (s1 != BOTTOM && s2 != BOTTOM) {
                    builder.getOrCreateProductState(s1, g1, s2, g2);
                }
            }

            @Override
            public void examineEdge(Transition<I> e1, DeterministicAutomaton<I> g1,
                                    Transition<I> e2, DeterministicAutomaton<I> g2, I a) {
                if (bothDefined(e1, e2)) {
                    builder.addProductTransition(e1, g1, e2, g2);
                }
            }
        }, DeterministicIntersection::bothDefined);
    }
}
