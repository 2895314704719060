package FSA.Minimize;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import FSA.Graph.DeterministicAutomaton;
import FSA.Graph.IncidenceAutomaton;
import FSA.Graph.IncidenceGraph;
import FSA.Graph.Transition;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Hopcroft's partition refinement.
 * <p>
 * A partial automaton is refined as if it were completed by a non-final sink state; the sink is never materialized
 * and its block is dropped from the result unless it also contains real states.
 */
public final class HopcroftMinimizer {
    public static boolean DEBUG = false;

    // complete automata need no sink
    private static final int NO_SINK = DeterministicAutomaton.BOTTOM;

    private HopcroftMinimizer() { }

    /**
     * @return a minimal automaton recognizing the language of {@code g}. Its initial state is 0, the other states are
     * numbered by increasing smallest original member.
     */
    public static <I, G extends DeterministicAutomaton<I> & IncidenceGraph<I>> IncidenceAutomaton<I> minimize(G g) {
        final IncidenceAutomaton<I> minG = new IncidenceAutomaton<>();
        if (g.numStates() == 0) {
            return minG;
        }
        final Set<I> alphabet = g.alphabet();
        final int sink = g.isComplete() ? NO_SINK : g.states().getInt(g.numStates() - 1) + 1;

        final List<IntSortedSet> partition = refine(g, alphabet, sink);
        if (DEBUG) {
            System.out.println("DEBUG: Refined " + g.numStates() + " states into " + partition.size() + " blocks");
        }

        // block id per state, then output ids: initial block first, others by smallest member
        final Int2IntOpenHashMap blockOf = new Int2IntOpenHashMap();
        final Int2ObjectRBTreeMap<IntSortedSet> blocksByMin = new Int2ObjectRBTreeMap<>();
        for (IntSortedSet block : partition) {
            if (block.size() == 1 && block.firstInt() == sink) {
                continue;
            }
            blocksByMin.put(block.firstInt(), block);
        }
        final List<IntSortedSet> blocks = new ArrayList<>(blocksByMin.size());
        final int q0 = g.initial();
        for (IntSortedSet block : blocksByMin.values()) {
            if (block.contains(q0)) {
                blocks.add(0, block);
            } else {
                blocks.add(block);
            }
        }
        for (int i = 0; i < blocks.size(); i++) {
            for (int q : blocks.get(i)) {
                blockOf.put(q, i);
            }
            minG.addState();
        }
        if (q0 != DeterministicAutomaton.BOTTOM) {
            minG.setInitial(0);
        } else {
            minG.setInitial(0, false);
        }

        for (int i = 0; i < blocks.size(); i++) {
            for (int q : blocks.get(i)) {
                if (q == sink) {
                    continue;
                }
                if (g.isFinal(q)) {
                    minG.setFinal(i);
                }
                for (Transition<I> e : g.outTransitions(q)) {
                    // members of a block agree on their transitions: later adds are duplicates
                    minG.addTransition(i, blockOf.get(e.target()), e.symbol());
                }
            }
        }
        return minG;
    }

    private static <I, G extends DeterministicAutomaton<I> & IncidenceGraph<I>> List<IntSortedSet> refine(
            G g, Set<I> alphabet, int sink) {
        final IntSortedSet finals = new IntAVLTreeSet();
        final IntSortedSet nonFinals = new IntAVLTreeSet();
        for (int q : g.states()) {
            (g.isFinal(q) ? finals : nonFinals).add(q);
        }
        if (sink != NO_SINK) {
            nonFinals.add(sink);
        }

        final List<IntSortedSet> partition = new ArrayList<>();
        final Set<IntSortedSet> waiting = new LinkedHashSet<>();
        for (IntSortedSet block : List.of(finals, nonFinals)) {
            if (!block.isEmpty()) {
                partition.add(block);
                waiting.add(block);
            }
        }

        while (!waiting.isEmpty()) {
            final Iterator<IntSortedSet> it = waiting.iterator();
            final IntSortedSet current = it.next();
            it.remove();
            for (I a : alphabet) {
                final IntSortedSet x = preImage(g, current, a, sink);
                if (x.isEmpty()) {
                    continue;
                }
                for (IntSortedSet y : new ArrayList<>(partition)) {
                    final IntSortedSet inter = new IntAVLTreeSet();
                    final IntSortedSet diff = new IntAVLTreeSet();
                    for (int q : y) {
                        (x.contains(q) ? inter : diff).add(q);
                    }
                    if (inter.isEmpty() || diff.isEmpty()) {
                        continue;
                    }
                    partition.remove(y);
                    partition.add(inter);
                    partition.add(diff);
                    if (waiting.remove(y)) {
                        waiting.add(inter);
                        waiting.add(diff);
                    } else if (inter.size() <= diff.size()) {
                        waiting.add(inter);
                    } else {
                        waiting.add(diff);
                    }
                }
            }
        }
        return partition;
    }

    /**
     * @return the states having an {@code a}-transition into {@code block}, the sink included
     */
    private static <I, G extends DeterministicAutomaton<I> & IncidenceGraph<I>> IntSortedSet preImage(
            G g, IntSortedSet block, I a, int sink) {
        final IntSortedSet result = new IntAVLTreeSet();
        for (int r : block) {
            if (r == sink) {
                result.add(sink);
                for (int q : g.states()) {
                    if (g.delta(q, a) == DeterministicAutomaton.BOTTOM) {
                        result.add(q);
                    }
                }
                continue;
            }
            for (Transition<I> e : g.inTransitions(r)) {
                if (a.equals(e.symbol())) {
                    result.add(e.source());
                }
            }
        }
        return result;
    }
}
