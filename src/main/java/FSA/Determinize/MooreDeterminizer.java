package FSA.Determinize;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import FSA.Graph.IncidenceAutomaton;
import FSA.Graph.MutableDeterministicAutomaton;
import FSA.Graph.Nfa;
import FSA.Graph.Transition;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Subset construction. Each state of the output automaton stands for the epsilon-closed set of NFA states reached
 * by the words leading to it. Output states are numbered in discovery order, the initial subset first.
 */
public final class MooreDeterminizer {
    public static boolean DEBUG = false;

    private static final int INITIAL_CLOSURE_CAPACITY = 10_000;
    private static final int STATES_EXPLORED_PERIOD = 10_000;

    private MooreDeterminizer() { }

    public static <I> IncidenceAutomaton<I> determinize(Nfa<I> nfa) {
        return determinize(nfa, true);
    }

    /**
     * @param complete if true, every subset gets a transition for every symbol of the NFA, so that the result is
     *                 complete (possibly with an empty trap subset); otherwise only the symbols enabled in a subset
     *                 are followed and no trap state is created
     */
    public static <I> IncidenceAutomaton<I> determinize(Nfa<I> nfa, boolean complete) {
        final IncidenceAutomaton<I> out = new IncidenceAutomaton<>();
        determinize(nfa, complete, out);
        return out;
    }

    /**
     * Determinizes into {@code out}, which must be empty.
     */
    public static <I> void determinize(Nfa<I> nfa, boolean complete, MutableDeterministicAutomaton<I> out) {
        final Map<Integer, BitSet> closures = newClosureCache(nfa.numStates());
        final Set<I> alphabet = complete ? nfa.alphabet() : null;

        final Map<BitSet, Integer> outStateMap = new HashMap<>();
        final Deque<DeterminizeRecord> worklist = new ArrayDeque<>();

        final BitSet init = new BitSet();
        for (int q0 : nfa.initials()) {
            init.or(closure(nfa, q0, closures));
        }
        final int initOut = addState(nfa, init, out);
        out.setInitial(initOut);
        outStateMap.put(init, initOut);
        worklist.add(new DeterminizeRecord(init, initOut));

        int statesExplored = 0;
        while (!worklist.isEmpty()) {
            final DeterminizeRecord curr = worklist.poll();
            final BitSet inState = curr.inputState();

            for (I a : complete ? alphabet : sigma(nfa, inState)) {
                final BitSet succ = new BitSet();
                for (int q = inState.nextSetBit(0); q >= 0; q = inState.nextSetBit(q + 1)) {
                    for (int r : nfa.deltaOneStep(IntSet.of(q), a)) {
                        succ.or(closure(nfa, r, closures));
                    }
                }
                Integer outSucc = outStateMap.get(succ);
                if (outSucc == null) {
                    outSucc = addState(nfa, succ, out);
                    outStateMap.put(succ, outSucc);
                    worklist.add(new DeterminizeRecord(succ, outSucc));
                }
                out.addTransition(curr.outputState(), outSucc, a);
            }

            statesExplored++;
            if (DEBUG && statesExplored % STATES_EXPLORED_PERIOD == 0) {
                System.out.println("DEBUG: Explored " + statesExplored + " states - "
                                   + outStateMap.size() + " discovered");
            }
        }
        if (DEBUG) {
            System.out.println("DEBUG: Determinized " + nfa.numStates() + " NFA states into "
                               + outStateMap.size() + " DFA states");
        }
    }

    private static <I> int addState(Nfa<I> nfa, BitSet subset, MutableDeterministicAutomaton<I> out) {
        final int q = out.addState();
        for (int r = subset.nextSetBit(0); r >= 0; r = subset.nextSetBit(r + 1)) {
            if (nfa.isFinal(r)) {
                out.setFinal(q);
                break;
            }
        }
        return q;
    }

    /**
     * @return the symbols labeling a non-epsilon transition leaving a state of {@code subset}
     */
    private static <I> Set<I> sigma(Nfa<I> nfa, BitSet subset) {
        final Set<I> result = new LinkedHashSet<>();
        for (int q = subset.nextSetBit(0); q >= 0; q = subset.nextSetBit(q + 1)) {
            for (Transition<I> e : nfa.outTransitions(q)) {
                if (!e.isEpsilon()) {
                    result.add(e.symbol());
                }
            }
        }
        return result;
    }

    private static <I> BitSet closure(Nfa<I> nfa, int q, Map<Integer, BitSet> closures) {
        BitSet result = closures.get(q);
        if (result == null) {
            result = new BitSet();
            for (int r : nfa.deltaEpsilon(IntSet.of(q))) {
                result.set(r);
            }
            closures.put(q, result);
        }
        return result;
    }

    private static Map<Integer, BitSet> newClosureCache(int numStates) {
        if (numStates < 1000) {
            return new HashMap<>(Math.min(numStates, INITIAL_CLOSURE_CAPACITY));
        }
        // Upper bound on cache size, should keep us from overflowing memory for large NFAs.
        final Cache<Integer, BitSet> cache = Caffeine.newBuilder()
            .initialCapacity(INITIAL_CLOSURE_CAPACITY)
            .maximumSize(1_000_000)
            .build();
        return cache.asMap();
    }

    private record DeterminizeRecord(BitSet inputState, int outputState) { }
}
