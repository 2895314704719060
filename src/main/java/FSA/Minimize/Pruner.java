package FSA.Minimize;

import FSA.Graph.DeterministicAutomaton;
import FSA.Graph.IncidenceAutomaton;
import FSA.Traversal.Reachability;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Removes the useless states of an automaton: those not reachable from the initial state, and those from which no
 * final state can be reached.
 */
public final class Pruner {
    public static boolean DEBUG = false;

    private Pruner() { }

    /**
     * Prunes {@code g} in place. State ids of the kept states are unchanged.
     *
     * @return the number of removed states
     */
    public static <I> int prune(IncidenceAutomaton<I> g) {
        final IntSortedSet accessible = g.initial() == DeterministicAutomaton.BOTTOM
            ? new IntAVLTreeSet()
            : Reachability.forward(g, IntList.of(g.initial()));
        final IntSortedSet coAccessible = Reachability.backward(g, g.finals());

        final IntList useless = new IntArrayList();
        for (int q : g.states()) {
            if (!accessible.contains(q) || !coAccessible.contains(q)) {
                useless.add(q);
            }
        }
        for (int q : useless) {
            g.removeState(q);
        }
        if (DEBUG) {
            System.out.println("DEBUG: Pruned " + useless.size() + " states, " + g.numStates() + " left");
        }
        return useless.size();
    }
}
