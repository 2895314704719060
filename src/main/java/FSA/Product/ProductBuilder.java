package FSA.Product;

import java.util.HashMap;
import java.util.Map;

import FSA.Graph.DeterministicAutomaton;
import FSA.Graph.MutableDeterministicAutomaton;
import FSA.Graph.Transition;
import FSA.Traversal.StatePair;

import static FSA.Graph.DeterministicAutomaton.BOTTOM;

/**
 * Materializes the pairs visited by a product traversal as states of an output automaton. A product state is final
 * when the combinator applied to the finality of its two sides holds. The first product state for which the
 * combinator holds on initiality becomes the initial state.
 */
public class ProductBuilder<I> {
    public enum Combinator {
        OR {
            @Override
            public boolean apply(boolean b1, boolean b2) {
                return b1 || b2;
            }
        },
        AND {
            @Override
            public boolean apply(boolean b1, boolean b2) {
                return b1 && b2;
            }
        };

        public abstract boolean apply(boolean b1, boolean b2);
    }

    private final MutableDeterministicAutomaton<I> g12;
    private final Combinator combinator;
    private final Map<StatePair, Integer> productStates = new HashMap<>();
    private boolean hasInitial = false;

    public ProductBuilder(MutableDeterministicAutomaton<I> g12, Combinator combinator) {
        this.g12 = g12;
        this.combinator = combinator;
    }

    public MutableDeterministicAutomaton<I> product() {
        return g12;
    }

    /**
     * @return the product state of {@code (q1, q2)}, or BOTTOM if it has not been created
     */
    public int productState(int q1, int q2) {
        return productStates.getOrDefault(new StatePair(q1, q2), BOTTOM);
    }

    /**
     * @throws IllegalStateException if both sides are BOTTOM
     */
    public int getOrCreateProductState(int q1, DeterministicAutomaton<I> g1, int q2, DeterministicAutomaton<I> g2) {
        if (q1 == BOTTOM && q2 == BOTTOM) {
            throw new IllegalStateException("Tried to create a (BOTTOM, BOTTOM) product state");
        }
        final StatePair pair = new StatePair(q1, q2);
        final Integer q12 = productStates.get(pair);
        if (q12 != null) {
            return q12;
        }
        final int r12 = g12.addState();
        // the first initial product state wins: with OR, (q01, r) may be reached again later
        if (!hasInitial) {
            hasInitial = combinator.apply(g1.isInitial(q1), g2.isInitial(q2));
            g12.setInitial(r12, hasInitial);
        }
        if (combinator.apply(g1.isFinal(q1), g2.isFinal(q2))) {
            g12.setFinal(r12);
        }
        productStates.put(pair, r12);
        return r12;
    }

    /**
     * Adds the product transition of {@code e1} and {@code e2}, creating its endpoints if needed. A null side stands
     * for BOTTOM.
     *
     * @return false if the source product state already had a transition for that symbol
     */
    public boolean addProductTransition(Transition<I> e1, DeterministicAutomaton<I> g1,
                                        Transition<I> e2, DeterministicAutomaton<I> g2) {
        final int q1 = e1 != null ? e1.source() : BOTTOM;
        final int r1 = e1 != null ? e1.target() : BOTTOM;
        final int q2 = e2 != null ? e2.source() : BOTTOM;
        final int r2 = e2 != null ? e2.target() : BOTTOM;
        final I a = e1 != null ? e1.symbol() : e2.symbol();
        final int q12 = getOrCreateProductState(q1, g1, q2, g2);
        final int r12 = getOrCreateProductState(r1, g1, r2, g2);
        return g12.addTransition(q12, r12, a);
    }
}
