package FSA.Traversal;

import FSA.Graph.IncidenceGraph;
import FSA.Graph.TransitionGraph;
import FSA.Property.AssocAttributeMap;
import FSA.Property.AttributeMap;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

public final class Reachability {
    private Reachability() { }

    /**
     * @return the states reachable from {@code sources} (included)
     */
    public static <I> IntSortedSet forward(TransitionGraph<I> g, IntCollection sources) {
        final AssocAttributeMap<Integer, Color> colors = AttributeMap.assoc(Color.WHITE);
        final IntSortedSet result = new IntAVLTreeSet();
        if (sources.isEmpty()) {
            return result;
        }
        DepthFirstSearch.searchGraph(g, sources, colors, new DepthFirstSearchVisitor<>() { },
                                     EdgeFilter.all());
        for (int q : colors.asMap().keySet()) {
            if (g.hasState(q)) {
                result.add(q);
            }
        }
        return result;
    }

    /**
     * @return the states from which a state of {@code targets} can be reached
     */
    public static <I> IntSortedSet backward(IncidenceGraph<I> g, IntCollection targets) {
        return forward(g.reverse(), targets);
    }
}
