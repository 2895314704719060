package FSA.Traversal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import FSA.Graph.Transition;
import FSA.Graph.TransitionGraph;
import FSA.Property.AttributeMap;
import it.unimi.dsi.fastutil.ints.IntCollection;

/**
 * Depth first search with an explicit stack of frames, so that deep automata do not overflow the call stack.
 */
public final class DepthFirstSearch {
    private DepthFirstSearch() { }

    /**
     * A vertex whose first {@code i} relevant out-transitions have been visited.
     */
    private static final class Frame<I> {
        final int u;
        final List<Transition<I>> edges;
        int i = 0;

        Frame(int u, List<Transition<I>> edges) {
            this.u = u;
            this.edges = edges;
        }
    }

    private static <I> List<Transition<I>> relevantEdges(TransitionGraph<I> g, int u, EdgeFilter<I> ifPush) {
        final List<Transition<I>> result = new ArrayList<>();
        for (Transition<I> e : g.outTransitions(u)) {
            if (ifPush.ifPush(e)) {
                result.add(e);
            }
        }
        return result;
    }

    public static <I> void search(TransitionGraph<I> g, int s, DepthFirstSearchVisitor<I> vis) {
        search(g, s, AttributeMap.assoc(Color.WHITE), vis, EdgeFilter.all());
    }

    /**
     * Visits the vertices reachable from {@code s} through transitions accepted by {@code ifPush}.
     *
     * @param colors vertex colors, WHITE for unvisited vertices. Updated in place.
     */
    public static <I> void search(TransitionGraph<I> g, int s, AttributeMap<Integer, Color> colors,
                                  DepthFirstSearchVisitor<I> vis, EdgeFilter<I> ifPush) {
        vis.startVertex(s, g);
        colors.put(s, Color.GRAY);
        vis.discoverVertex(s, g);

        final Deque<Frame<I>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(s, relevantEdges(g, s, ifPush)));

        while (!stack.isEmpty()) {
            final Frame<I> frame = stack.peek();
            if (frame.i == frame.edges.size()) {
                stack.pop();
                colors.put(frame.u, Color.BLACK);
                vis.finishVertex(frame.u, g);
                continue;
            }
            final Transition<I> e = frame.edges.get(frame.i++);
            final int v = e.target();
            vis.examineEdge(e, g);
            final Color color = colors.get(v);
            if (color == Color.WHITE) {
                vis.treeEdge(e, g);
                colors.put(v, Color.GRAY);
                vis.discoverVertex(v, g);
                stack.push(new Frame<>(v, relevantEdges(g, v, ifPush)));
            } else if (color == Color.GRAY) {
                vis.backEdge(e, g);
            } else {
                vis.forwardOrCrossEdge(e, g);
            }
        }
    }

    /**
     * Runs a search from every WHITE vertex of {@code sources}, or of the whole graph if {@code sources} is null.
     */
    public static <I> void searchGraph(TransitionGraph<I> g, IntCollection sources, AttributeMap<Integer, Color> colors,
                                       DepthFirstSearchVisitor<I> vis, EdgeFilter<I> ifPush) {
        for (int u : sources != null ? sources : g.states()) {
            if (colors.get(u) == Color.WHITE) {
                search(g, u, colors, vis, ifPush);
            }
        }
    }
}
