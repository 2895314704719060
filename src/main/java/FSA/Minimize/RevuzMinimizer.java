package FSA.Minimize;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import FSA.Graph.IncidenceAutomaton;
import FSA.Graph.IncidenceGraph;
import FSA.Graph.IncidenceNodeAutomaton;
import FSA.Graph.Transition;
import FSA.Property.AttributeMap;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Revuz's minimization of acyclic automata (tries, DAFSAs), in place.
 * <p>
 * States are processed by layers of increasing height, starting from the leaves. Inside a layer, states with the
 * same signature (finality, label, outgoing transitions) are equivalent: they are merged into the smallest one.
 * Processing a layer only after every layer below it guarantees that equivalent successors have already been merged.
 */
public final class RevuzMinimizer {
    public static boolean DEBUG = false;

    private RevuzMinimizer() { }

    private record Arc(Object label, int target) { }

    private record Signature(boolean isFinal, Object vertexLabel, Set<Arc> arcs) { }

    private static <I> IntSortedSet leaves(IncidenceGraph<I> g) {
        final IntSortedSet result = new IntAVLTreeSet();
        for (int q : g.states()) {
            if (g.outDegree(q) == 0) {
                result.add(q);
            }
        }
        return result;
    }

    /**
     * Computes, for each state, the length of the longest path from it to a leaf.
     *
     * @param heights written for every state
     * @param leaves the states of height 0, or null for the states without outgoing transition
     * @return the greatest height
     * @throws IllegalStateException if {@code g} is cyclic
     */
    public static <I> int height(IncidenceGraph<I> g, AttributeMap<Integer, Integer> heights, IntCollection leaves) {
        IntSortedSet layer = new IntAVLTreeSet(leaves != null ? leaves : leaves(g));
        final IntSet visited = new IntOpenHashSet();
        int h = 0;
        while (!layer.isEmpty()) {
            if (h > g.numStates()) {
                throw new IllegalStateException("The automaton is not acyclic");
            }
            final IntSortedSet next = new IntAVLTreeSet();
            for (int v : layer) {
                // a state reached again by a later layer gets the greater height
                heights.put(v, h);
                visited.add(v);
                for (Transition<I> e : g.inTransitions(v)) {
                    next.add(e.source());
                }
            }
            layer = next;
            h++;
        }
        if (visited.size() < g.numStates()) {
            checkAcyclic(g, visited);
        }
        return h - 1;
    }

    /**
     * Peels the states outside {@code visited} whose successors are all peeled or visited. States left over lie on
     * or lead to a cycle that no layer reached.
     */
    private static <I> void checkAcyclic(IncidenceGraph<I> g, IntSet visited) {
        final Int2IntOpenHashMap pending = new Int2IntOpenHashMap();
        final IntArrayList ready = new IntArrayList();
        for (int q : g.states()) {
            if (visited.contains(q)) {
                continue;
            }
            int n = 0;
            for (Transition<I> e : g.outTransitions(q)) {
                if (!visited.contains(e.target())) {
                    n++;
                }
            }
            pending.put(q, n);
            if (n == 0) {
                ready.add(q);
            }
        }
        int peeled = 0;
        while (!ready.isEmpty()) {
            final int r = ready.popInt();
            peeled++;
            for (Transition<I> e : g.inTransitions(r)) {
                final int p = e.source();
                if (!visited.contains(p) && pending.addTo(p, -1) == 1) {
                    ready.add(p);
                }
            }
        }
        if (peeled < pending.size()) {
            throw new IllegalStateException("The automaton is not acyclic");
        }
    }

    public static <I> int minimize(IncidenceAutomaton<I> g) {
        return minimize(g, null, null, null, new RevuzMinimizeVisitor<>() { });
    }

    /**
     * @param vertexLabels state labels taken into account by the signature, or null for the symbols of an
     *                     {@link IncidenceNodeAutomaton} (no label otherwise)
     * @param edgeLabels transition labels, or null for the transition symbols
     * @param leaves the states of height 0, or null for the states without outgoing transition
     * @return the greatest height
     * @throws IllegalStateException if {@code g} is cyclic
     */
    public static <I> int minimize(IncidenceAutomaton<I> g, AttributeMap<Integer, ?> vertexLabels,
                                   AttributeMap<Transition<I>, ?> edgeLabels, IntCollection leaves,
                                   RevuzMinimizeVisitor<I> vis) {
        final AttributeMap<Integer, Integer> heights = AttributeMap.assoc(0);
        final int hmax = height(g, heights, leaves);

        if (vertexLabels == null) {
            if (g instanceof IncidenceNodeAutomaton) {
                final IncidenceNodeAutomaton<I> node = (IncidenceNodeAutomaton<I>) g;
                vertexLabels = AttributeMap.func(node::symbol);
            } else {
                vertexLabels = AttributeMap.constant(null);
            }
        }
        final AttributeMap<Transition<I>, ?> labels = edgeLabels != null ? edgeLabels : AttributeMap.func(Transition::symbol);

        IntSortedSet layer = new IntAVLTreeSet(leaves != null ? leaves : leaves(g));
        int h = 0;
        int merged = 0;
        while (!layer.isEmpty()) {
            final Map<Signature, IntSortedSet> aggregates = new LinkedHashMap<>();
            for (int q : layer) {
                aggregates.computeIfAbsent(signature(g, q, vertexLabels, labels), k -> new IntAVLTreeSet()).add(q);
            }

            for (IntSortedSet mergeable : aggregates.values()) {
                if (mergeable.size() < 2) {
                    continue;
                }
                final IntIterator it = mergeable.iterator();
                final int q1 = it.nextInt();
                while (it.hasNext()) {
                    mergeInto(g, q1, it.nextInt(), vis);
                    merged++;
                }
            }

            final IntSortedSet next = new IntAVLTreeSet();
            for (int q : layer) {
                for (Transition<I> e : g.inTransitions(q)) {
                    if (heights.get(e.source()) == h + 1) {
                        next.add(e.source());
                    }
                }
            }
            layer = next;
            h++;
        }
        if (DEBUG) {
            System.out.println("DEBUG: Merged " + merged + " states, max height " + hmax);
        }
        return h - 1;
    }

    private static <I> Signature signature(IncidenceAutomaton<I> g, int q, AttributeMap<Integer, ?> vertexLabels,
                                           AttributeMap<Transition<I>, ?> edgeLabels) {
        final Set<Arc> arcs = new HashSet<>();
        for (Transition<I> e : g.outTransitions(q)) {
            arcs.add(new Arc(edgeLabels.get(e), e.target()));
        }
        return new Signature(g.isFinal(q), vertexLabels.get(q), arcs);
    }

    /**
     * Redirects the transitions entering q2 to q1, then removes q2.
     */
    private static <I> void mergeInto(IncidenceAutomaton<I> g, int q1, int q2, RevuzMinimizeVisitor<I> vis) {
        vis.mergingStates(q1, q2, g);
        for (Transition<I> eOld : g.inTransitions(q2)) {
            final int p = eOld.source();
            g.removeTransition(p, eOld.symbol());
            if (!g.addTransition(p, q1, eOld.symbol())) {
                // p already reaches q1 by this symbol: impossible while g stays deterministic
                throw new IllegalStateException(
                    "Transition collision while merging " + q2 + " into " + q1 + " from " + p);
            }
            vis.moveTransition(eOld, new Transition<>(p, q1, eOld.symbol()), g);
        }
        vis.removeVertex(q2, g);
        g.removeState(q2);
        vis.statesMerged(q1, q2, g);
    }
}
