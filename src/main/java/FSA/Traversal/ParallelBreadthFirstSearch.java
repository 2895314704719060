package FSA.Traversal;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import FSA.Graph.DeterministicAutomaton;
import FSA.Graph.Transition;
import FSA.Property.AttributeMap;

import static FSA.Graph.DeterministicAutomaton.BOTTOM;

/**
 * Breadth first search over the product of two deterministic automata, without building the product.
 * <p>
 * From a pair {@code (q1, q2)}, every symbol of {@code sigma(q1) ∪ sigma(q2)} leads to
 * {@code (delta(q1, a), delta(q2, a))}, where one side may be BOTTOM. Each pair is discovered once; it is explored
 * only if the edge filter accepts the transitions that discovered it.
 */
public final class ParallelBreadthFirstSearch {
    private ParallelBreadthFirstSearch() { }

    public static <I> void search(DeterministicAutomaton<I> g1, DeterministicAutomaton<I> g2,
                                  ParallelBreadthFirstSearchVisitor<I> vis) {
        search(g1, g2, null, AttributeMap.assoc(Color.WHITE), vis, ParallelEdgeFilter.all());
    }

    public static <I> void search(DeterministicAutomaton<I> g1, DeterministicAutomaton<I> g2,
                                  ParallelBreadthFirstSearchVisitor<I> vis, ParallelEdgeFilter<I> ifPush) {
        search(g1, g2, null, AttributeMap.assoc(Color.WHITE), vis, ifPush);
    }

    /**
     * @param sources the pairs to start from, or null for the pair of initial states
     * @param colors pair colors, WHITE for unvisited pairs. Updated in place.
     */
    public static <I> void search(DeterministicAutomaton<I> g1, DeterministicAutomaton<I> g2,
                                  Collection<StatePair> sources, AttributeMap<StatePair, Color> colors,
                                  ParallelBreadthFirstSearchVisitor<I> vis, ParallelEdgeFilter<I> ifPush) {
        if (sources == null) {
            sources = List.of(new StatePair(g1.initial(), g2.initial()));
        }

        final Deque<StatePair> queue = new ArrayDeque<>();
        for (StatePair s : sources) {
            vis.startVertex(s.q1(), g1, s.q2(), g2);
            colors.put(s, Color.GRAY);
            queue.add(s);
        }

        while (!queue.isEmpty()) {
            final StatePair pair = queue.poll();
            final int q1 = pair.q1();
            final int q2 = pair.q2();
            vis.examineVertex(q1, g1, q2, g2);

            final Set<I> symbols = new LinkedHashSet<>(g1.sigma(q1));
            symbols.addAll(g2.sigma(q2));
            for (I a : symbols) {
                final int r1 = g1.delta(q1, a);
                final int r2 = g2.delta(q2, a);
                vis.examineSymbol(q1, g1, q2, g2, a);
                final Transition<I> e1 = q1 == BOTTOM ? null : new Transition<>(q1, r1, a);
                final Transition<I> e2 = q2 == BOTTOM ? null : new Transition<>(q2, r2, a);
                vis.examineEdge(e1, g1, e2, g2, a);

                final StatePair next = new StatePair(r1, r2);
                final Color color = colors.get(next);
                if (color == Color.WHITE) {
                    vis.treeEdge(e1, g1, e2, g2, a);
                    colors.put(next, Color.GRAY);
                    vis.discoverVertex(r1, g1, r2, g2);
                    if (ifPush.ifPush(e1, e2)) {
                        queue.add(next);
                    }
                } else if (color == Color.GRAY) {
                    vis.grayTarget(e1, g1, e2, g2, a);
                } else {
                    vis.blackTarget(e1, g1, e2, g2, a);
                }
            }
            colors.put(pair, Color.BLACK);
            vis.finishVertex(q1, g1, q2, g2);
        }
    }
}
