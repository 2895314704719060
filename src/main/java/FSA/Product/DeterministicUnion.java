package FSA.Product;

import FSA.Graph.Automaton;
import FSA.Graph.DeterministicAutomaton;
import FSA.Graph.MutableDeterministicAutomaton;
import FSA.Graph.Transition;
import FSA.Product.ProductBuilder.Combinator;
import FSA.Traversal.ParallelBreadthFirstSearch;
import FSA.Traversal.ParallelBreadthFirstSearchVisitor;

/**
 * Builds a deterministic automaton recognizing L(g1) ∪ L(g2). The result is not minimized.
 */
public final class DeterministicUnion {
    private DeterministicUnion() { }

    public static <I> Automaton<I> union(DeterministicAutomaton<I> g1, DeterministicAutomaton<I> g2) {
        final Automaton<I> g12 = new Automaton<>();
        union(g1, g2, g12);
        return g12;
    }

    /**
     * @param g12 empty output automaton
     */
    public static <I> void union(DeterministicAutomaton<I> g1, DeterministicAutomaton<I> g2,
                                 MutableDeterministicAutomaton<I> g12) {
        final ProductBuilder<I> builder = new ProductBuilder<>(g12, Combinator.OR);
        ParallelBreadthFirstSearch.search(g1, g2, new ParallelBreadthFirstSearchVisitor<>() {
            @Override
            public void startVertex(int s1, DeterministicAutomaton<I> g1, int s2, DeterministicAutomaton<I> g2) {
                if (s1 != DeterministicAutomaton.BOTTOM || s2 != DeterministicAutomaton.BOTTOM) {
                    builder.getOrCreateProductState(s1, g1, s2, g2);
                }
            }

            @Override
            public void examineEdge(Transition<I> e1, DeterministicAutomaton<I> g1,
                                    Transition<I> e2, DeterministicAutomaton<I> g2, I a) {
                builder.addProductTransition(e1, g1, e2, g2);
            }
        });
    }
}
