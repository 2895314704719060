package FSA.Product;

import FSA.Graph.DeterministicAutomaton;
import FSA.Traversal.ParallelBreadthFirstSearch;
import FSA.Traversal.ParallelBreadthFirstSearchVisitor;

/**
 * Counts the prefixes shared by two tries, classified by their finality on each side.
 */
public final class TrieMatching {
    public static final int NONE = 0;
    public static final int FIRST_ONLY = 1;
    public static final int SECOND_ONLY = 2;
    public static final int BOTH = 3;

    private TrieMatching() { }

    /**
     * @return 4 counters indexed by {@code f1 + 2 * f2}, where f1 (resp. f2) is 1 if the prefix is a word of g1
     * (resp. g2): {@link #NONE}, {@link #FIRST_ONLY}, {@link #SECOND_ONLY}, {@link #BOTH}
     */
    public static <I> int[] match(DeterministicAutomaton<I> g1, DeterministicAutomaton<I> g2) {
        final int[] counters = new int[4];
        ParallelBreadthFirstSearch.search(g1, g2, new ParallelBreadthFirstSearchVisitor<>() {
            private void update(int q1, DeterministicAutomaton<I> g1, int q2, DeterministicAutomaton<I> g2) {
                counters[(g1.isFinal(q1) ? 1 : 0) + 2 * (g2.isFinal(q2) ? 1 : 0)]++;
            }

            @Override
            public void startVertex(int s1, DeterministicAutomaton<I> g1, int s2, DeterministicAutomaton<I> g2) {
                update(s1, g1, s2, g2);
            }

            @Override
            public void discoverVertex(int q1, DeterministicAutomaton<I> g1, int q2, DeterministicAutomaton<I> g2) {
                update(q1, g1, q2, g2);
            }
        });
        return counters;
    }
}
