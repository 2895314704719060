package FSA.Interop;

import FSA.Graph.DeterministicAutomaton;
import FSA.Graph.IncidenceAutomaton;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Conversions between {@link DeterministicAutomaton} and AutomataLib's {@link CompactDFA}, so that results can be
 * checked against AutomataLib (equivalence, minimization).
 */
public final class AutomataLibConverter {
    private AutomataLibConverter() { }

    public static <I> CompactDFA<I> toCompactDFA(DeterministicAutomaton<I> g) {
        return toCompactDFA(g, Alphabets.fromCollection(g.alphabet()));
    }

    /**
     * Builds a complete {@link CompactDFA} over {@code alphabet}. Undefined transitions (and the symbols of
     * {@code alphabet} missing from {@code g}) lead to a non-accepting sink, added only when needed.
     */
    public static <I> CompactDFA<I> toCompactDFA(DeterministicAutomaton<I> g, Alphabet<I> alphabet) {
        final CompactDFA<I> result = new CompactDFA<>(alphabet);
        final Int2IntMap ids = new Int2IntOpenHashMap();
        ids.defaultReturnValue(DeterministicAutomaton.BOTTOM);
        for (int q : g.states()) {
            ids.put(q, result.addIntState(g.isFinal(q)));
        }

        int sink = DeterministicAutomaton.BOTTOM;
        if (g.initial() == DeterministicAutomaton.BOTTOM) {
            sink = result.addIntState(false);
            result.setInitial(sink, true);
        } else {
            result.setInitial(ids.get(g.initial()), true);
        }

        final int numInputs = alphabet.size();
        for (int q : g.states()) {
            for (int i = 0; i < numInputs; i++) {
                final int r = g.delta(q, alphabet.getSymbol(i));
                if (r != DeterministicAutomaton.BOTTOM) {
                    result.setTransition(ids.get(q), i, ids.get(r));
                    continue;
                }
                if (sink == DeterministicAutomaton.BOTTOM) {
                    sink = result.addIntState(false);
                }
                result.setTransition(ids.get(q), i, sink);
            }
        }
        if (sink != DeterministicAutomaton.BOTTOM) {
            for (int i = 0; i < numInputs; i++) {
                result.setTransition(sink, i, sink);
            }
        }
        return result;
    }

    /**
     * Copies {@code dfa}. State {@code i} of {@code dfa} becomes state {@code i} of the result.
     */
    public static <I> IncidenceAutomaton<I> fromCompactDFA(CompactDFA<I> dfa) {
        final IncidenceAutomaton<I> result = new IncidenceAutomaton<>(dfa.size());
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        for (int q = 0; q < dfa.size(); q++) {
            result.setFinal(q, dfa.isAccepting(q));
            for (int i = 0; i < alphabet.size(); i++) {
                final int r = dfa.getSuccessor(q, i);
                if (r >= 0) {
                    result.addTransition(q, r, alphabet.getSymbol(i));
                }
            }
        }
        final int init = dfa.getIntInitialState();
        if (init >= 0) {
            result.setInitial(init);
        } else if (result.numStates() > 0) {
            result.setInitial(0, false);
        }
        return result;
    }
}
