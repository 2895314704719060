package FSA.Product;

import FSA.Graph.DeterministicAutomaton;
import FSA.Traversal.ParallelBreadthFirstSearch;
import FSA.Traversal.ParallelBreadthFirstSearchVisitor;

/**
 * Compares the languages of two deterministic automata by walking their product and comparing the finality of the
 * two sides of every reached pair.
 */
public final class DeterministicInclusion {
    private DeterministicInclusion() { }

    private static final class InclusionVisitor<I> implements ParallelBreadthFirstSearchVisitor<I> {
        private Inclusion verdict = Inclusion.EQUAL;

        private void update(int q1, DeterministicAutomaton<I> g1, int q2, DeterministicAutomaton<I> g2) {
            final boolean f1 = g1.isFinal(q1);
            final boolean f2 = g2.isFinal(q2);
            if (f1 == f2 || verdict == Inclusion.INCOMPARABLE) {
                return;
            }
            final Inclusion observed = f2 ? Inclusion.SUBSET : Inclusion.SUPERSET;
            if (verdict == Inclusion.EQUAL) {
                verdict = observed;
            } else if (verdict != observed) {
                verdict = Inclusion.INCOMPARABLE;
            }
        }

        @Override
        public void startVertex(int s1, DeterministicAutomaton<I> g1, int s2, DeterministicAutomaton<I> g2) {
            update(s1, g1, s2, g2);
        }

        @Override
        public void discoverVertex(int q1, DeterministicAutomaton<I> g1, int q2, DeterministicAutomaton<I> g2) {
            update(q1, g1, q2, g2);
        }
    }

    /**
     * @return {@link Inclusion#SUBSET} if L(g1) ⊂ L(g2), {@link Inclusion#SUPERSET} if L(g2) ⊂ L(g1),
     * {@link Inclusion#EQUAL} if both languages are equal, {@link Inclusion#INCOMPARABLE} otherwise
     */
    public static <I> Inclusion compare(DeterministicAutomaton<I> g1, DeterministicAutomaton<I> g2) {
        final InclusionVisitor<I> vis = new InclusionVisitor<>();
        // once incomparable, nothing left to learn: stop growing the frontier
        ParallelBreadthFirstSearch.search(g1, g2, vis, (e1, e2) -> vis.verdict != Inclusion.INCOMPARABLE);
        return vis.verdict;
    }
}
