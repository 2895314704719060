package FSA.Product;

import FSA.Graph.DeterministicAutomaton;
import FSA.Graph.MutableDeterministicAutomaton;
import FSA.Graph.Transition;
import FSA.Traversal.ParallelBreadthFirstSearch;
import FSA.Traversal.ParallelBreadthFirstSearchVisitor;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

import static FSA.Graph.DeterministicAutomaton.BOTTOM;

/**
 * Adds the words of a tree-shaped deterministic automaton (typically another trie) to a trie, in place.
 */
public final class TrieFusion {
    private TrieFusion() { }

    /**
     * Walks {@code trie} and {@code g2} in parallel. Every transition of g2 without counterpart in the trie gets a
     * new target state in the trie; a state of the trie becomes final if its counterpart in g2 is.
     */
    public static <I> void fuse(MutableDeterministicAutomaton<I> trie, DeterministicAutomaton<I> g2) {
        if (g2.initial() == BOTTOM) {
            return;
        }
        // state of g2 -> trie state it is merged into
        final Int2IntMap merged = new Int2IntOpenHashMap();
        merged.defaultReturnValue(BOTTOM);

        final ParallelBreadthFirstSearchVisitor<I> vis = new ParallelBreadthFirstSearchVisitor<>() {
            @Override
            public void startVertex(int s1, DeterministicAutomaton<I> g1, int s2, DeterministicAutomaton<I> g2) {
                merged.put(s2, s1);
                if (g2.isFinal(s2)) {
                    trie.setFinal(s1);
                }
            }

            @Override
            public void examineEdge(Transition<I> e1, DeterministicAutomaton<I> g1,
                                    Transition<I> e2, DeterministicAutomaton<I> g2, I a) {
                if (e2 == null || e2.target() == BOTTOM) {
                    return;
                }
                final int r2 = e2.target();
                final int r1;
                if (e1 == null || e1.target() == BOTTOM) {
                    // e1 is null when the source itself has just been created
                    final int q1 = e1 == null ? merged.get(e2.source()) : e1.source();
                    r1 = trie.addState();
                    trie.addTransition(q1, r1, a);
                } else {
                    r1 = e1.target();
                }
                merged.put(r2, r1);
                if (g2.isFinal(r2)) {
                    trie.setFinal(r1);
                }
            }
        };
        ParallelBreadthFirstSearch.search(trie, g2, vis, (e1, e2) -> e2 != null && e2.target() != BOTTOM);
    }
}
