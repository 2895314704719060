package FSA.Traversal;

import java.util.ArrayDeque;
import java.util.Deque;

import FSA.Graph.Transition;
import FSA.Graph.TransitionGraph;
import FSA.Property.AttributeMap;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntList;

public final class BreadthFirstSearch {
    private BreadthFirstSearch() { }

    public static <I> void search(TransitionGraph<I> g, int s, BreadthFirstSearchVisitor<I> vis) {
        search(g, s, AttributeMap.assoc(Color.WHITE), vis, EdgeFilter.all());
    }

    /**
     * Initializes every vertex to WHITE, then visits the vertices reachable from {@code s}.
     */
    public static <I> void search(TransitionGraph<I> g, int s, AttributeMap<Integer, Color> colors,
                                  BreadthFirstSearchVisitor<I> vis, EdgeFilter<I> ifPush) {
        for (int u : g.states()) {
            vis.initializeVertex(u, g);
            colors.put(u, Color.WHITE);
        }
        searchGraph(g, IntList.of(s), colors, vis, ifPush);
    }

    /**
     * Visits the vertices reachable from {@code sources} in FIFO order. Colors are not reset.
     */
    public static <I> void searchGraph(TransitionGraph<I> g, IntCollection sources,
                                       AttributeMap<Integer, Color> colors, BreadthFirstSearchVisitor<I> vis,
                                       EdgeFilter<I> ifPush) {
        final Deque<Integer> queue = new ArrayDeque<>();
        for (int s : sources) {
            colors.put(s, Color.GRAY);
            vis.discoverVertex(s, g);
            queue.add(s);
        }

        while (!queue.isEmpty()) {
            final int u = queue.poll();
            vis.examineVertex(u, g);
            for (Transition<I> e : g.outTransitions(u)) {
                if (!ifPush.ifPush(e)) {
                    continue;
                }
                final int v = e.target();
                vis.examineEdge(e, g);
                final Color color = colors.get(v);
                if (color == Color.WHITE) {
                    vis.treeEdge(e, g);
                    colors.put(v, Color.GRAY);
                    vis.discoverVertex(v, g);
                    queue.add(v);
                } else {
                    vis.nonTreeEdge(e, g);
                    if (color == Color.GRAY) {
                        vis.grayTarget(e, g);
                    } else {
                        vis.blackTarget(e, g);
                    }
                }
            }
            colors.put(u, Color.BLACK);
            vis.finishVertex(u, g);
        }
    }
}
