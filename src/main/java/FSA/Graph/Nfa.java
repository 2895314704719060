package FSA.Graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSA.Property.AttributeMap;
import it.unimi.dsi.fastutil.ints.Int2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Non-deterministic automaton with epsilon transitions (null symbol) and parallel transitions.
 * <p>
 * States are numbered 0..n-1. Each (state, symbol, target) slot stores a multiplicity, one {@link Transition} index
 * per copy. Unless {@link #setInitials(IntSet)} says otherwise, state 0 is the only initial state.
 *
 * @param <I> symbol type
 */
public class Nfa<I> implements TransitionGraph<I> {
    private final List<Map<I, Int2IntMap>> adjacencies = new ArrayList<>();
    private final AttributeMap<Integer, Boolean> finals;
    private IntSortedSet initials = new IntAVLTreeSet(new int[] {0});
    private int numTransitions = 0;

    public Nfa() {
        this(0);
    }

    public Nfa(int numStates) {
        this(numStates, AttributeMap.assoc(false));
    }

    public Nfa(int numStates, AttributeMap<Integer, Boolean> finals) {
        this.finals = finals;
        for (int i = 0; i < numStates; i++) {
            addState();
        }
    }

    private void checkState(int q) {
        if (!hasState(q)) {
            throw new IllegalArgumentException("Invalid state: " + q);
        }
    }

    public int addState() {
        adjacencies.add(new LinkedHashMap<>());
        return adjacencies.size() - 1;
    }

    /**
     * Adds a copy of {@code (q, r, a)}. Never fails: adding an existing triple again creates a parallel transition.
     *
     * @return the new transition, whose index tells it apart from its parallel copies
     */
    public Transition<I> addTransition(int q, int r, I a) {
        checkState(q);
        checkState(r);
        final Int2IntMap targets = adjacencies.get(q).computeIfAbsent(a, k -> new Int2IntLinkedOpenHashMap());
        final int index = targets.get(r);
        targets.put(r, index + 1);
        numTransitions++;
        return new Transition<>(q, r, a, index);
    }

    public Transition<I> addEpsilonTransition(int q, int r) {
        return addTransition(q, r, null);
    }

    /**
     * Removes one copy of the (source, target, symbol) triple of {@code e}.
     *
     * @return false if there was none
     */
    public boolean removeTransition(Transition<I> e) {
        if (!hasState(e.source())) {
            return false;
        }
        final Map<I, Int2IntMap> table = adjacencies.get(e.source());
        final Int2IntMap targets = table.get(e.symbol());
        if (targets == null || !targets.containsKey(e.target())) {
            return false;
        }
        final int count = targets.get(e.target()) - 1;
        if (count == 0) {
            targets.remove(e.target());
            if (targets.isEmpty()) {
                table.remove(e.symbol());
            }
        } else {
            targets.put(e.target(), count);
        }
        numTransitions--;
        return true;
    }

    @Override
    public boolean hasState(int q) {
        return q >= 0 && q < adjacencies.size();
    }

    @Override
    public IntList states() {
        final IntList result = new IntArrayList(adjacencies.size());
        for (int q = 0; q < adjacencies.size(); q++) {
            result.add(q);
        }
        return result;
    }

    @Override
    public int numStates() {
        return adjacencies.size();
    }

    @Override
    public List<Transition<I>> outTransitions(int q) {
        if (!hasState(q)) {
            return Collections.emptyList();
        }
        final List<Transition<I>> result = new ArrayList<>();
        for (Map.Entry<I, Int2IntMap> entry : adjacencies.get(q).entrySet()) {
            for (Int2IntMap.Entry target : entry.getValue().int2IntEntrySet()) {
                for (int index = 0; index < target.getIntValue(); index++) {
                    result.add(new Transition<>(q, target.getIntKey(), entry.getKey(), index));
                }
            }
        }
        return result;
    }

    @Override
    public List<Transition<I>> transitions() {
        final List<Transition<I>> result = new ArrayList<>(numTransitions);
        for (int q = 0; q < adjacencies.size(); q++) {
            result.addAll(outTransitions(q));
        }
        return result;
    }

    @Override
    public int numTransitions() {
        return numTransitions;
    }

    /**
     * @return the initial states that exist, sorted
     */
    public IntSortedSet initials() {
        final IntSortedSet result = new IntAVLTreeSet();
        for (int q : initials) {
            if (hasState(q)) {
                result.add(q);
            }
        }
        return result;
    }

    @Override
    public boolean isInitial(int q) {
        return hasState(q) && initials.contains(q);
    }

    public void setInitial(int q, boolean isInitial) {
        if (isInitial) {
            checkState(q);
            initials.add(q);
        } else {
            initials.remove(q);
        }
    }

    public void setInitials(IntSet q0s) {
        initials = new IntAVLTreeSet(q0s);
    }

    @Override
    public boolean isFinal(int q) {
        return hasState(q) && Boolean.TRUE.equals(finals.get(q));
    }

    public void setFinal(int q, boolean isFinal) {
        checkState(q);
        finals.put(q, isFinal);
    }

    public void setFinal(int q) {
        setFinal(q, true);
    }

    /**
     * @return the states reachable from {@code qs} by exactly one {@code a}-transition, epsilon included
     */
    public IntSet deltaOneStep(IntSet qs, I a) {
        final IntSet result = new IntOpenHashSet();
        for (IntIterator it = qs.iterator(); it.hasNext(); ) {
            final int q = it.nextInt();
            if (!hasState(q)) {
                continue;
            }
            final Int2IntMap targets = adjacencies.get(q).get(a);
            if (targets != null) {
                result.addAll(targets.keySet());
            }
        }
        return result;
    }

    /**
     * @return the epsilon closure of {@code qs} ({@code qs} included)
     */
    public IntSet deltaEpsilon(IntSet qs) {
        final IntSet result = new IntOpenHashSet();
        IntSet frontier = new IntOpenHashSet(qs);
        while (!frontier.isEmpty()) {
            result.addAll(frontier);
            frontier = deltaOneStep(frontier, null);
            frontier.removeAll(result);
        }
        return result;
    }

    /**
     * @return closure(one {@code a}-step from closure({q}))
     */
    public IntSet delta(int q, I a) {
        return delta(IntSet.of(q), a);
    }

    public IntSet delta(IntSet qs, I a) {
        return deltaEpsilon(deltaOneStep(deltaEpsilon(qs), a));
    }

    /**
     * @return the non-epsilon symbols readable from the epsilon closure of {@code q}
     */
    public Set<I> sigma(int q) {
        if (!hasState(q)) {
            return Collections.emptySet();
        }
        return sigma(deltaEpsilon(IntSet.of(q)));
    }

    /**
     * @return the non-epsilon symbols leaving any state of {@code qs} (no closure is applied)
     */
    public Set<I> sigma(IntSet qs) {
        final Set<I> result = new LinkedHashSet<>();
        for (IntIterator it = qs.iterator(); it.hasNext(); ) {
            final int q = it.nextInt();
            if (hasState(q)) {
                result.addAll(adjacencies.get(q).keySet());
            }
        }
        result.remove(null);
        return result;
    }

    public Set<I> alphabet() {
        final Set<I> result = new LinkedHashSet<>();
        for (Map<I, Int2IntMap> table : adjacencies) {
            result.addAll(table.keySet());
        }
        result.remove(null);
        return result;
    }

    /**
     * @return the states reached from the initial states by reading {@code word}
     */
    public IntSet deltaWord(Iterable<? extends I> word) {
        IntSet qs = deltaEpsilon(initials());
        for (I a : word) {
            if (qs.isEmpty()) {
                break;
            }
            qs = delta(qs, a);
        }
        return qs;
    }

    public boolean accepts(Iterable<? extends I> word) {
        for (IntIterator it = deltaWord(word).iterator(); it.hasNext(); ) {
            if (isFinal(it.nextInt())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Copies the states, finality and transitions of {@code other} into this automaton under fresh ids. The initial
     * states of this automaton are unchanged.
     *
     * @return the mapping from the states of {@code other} to their copies
     */
    public Int2IntMap insert(Nfa<I> other) {
        final Int2IntMap mapping = new Int2IntOpenHashMap(other.numStates());
        mapping.defaultReturnValue(DeterministicAutomaton.BOTTOM);
        for (int q : other.states()) {
            final int r = addState();
            mapping.put(q, r);
            if (other.isFinal(q)) {
                setFinal(r);
            }
        }
        for (Transition<I> e : other.transitions()) {
            addTransition(mapping.get(e.source()), mapping.get(e.target()), e.symbol());
        }
        return mapping;
    }

    /**
     * @return a deep copy of this automaton, state ids included
     */
    public Nfa<I> copy() {
        final Nfa<I> result = new Nfa<>();
        final Int2IntMap mapping = result.insert(this);
        final IntSet q0s = new IntOpenHashSet();
        for (int q0 : initials()) {
            q0s.add(mapping.get(q0));
        }
        result.setInitials(q0s);
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("Nfa(initials=").append(initials())
            .append(", finals=").append(finals()).append(", transitions=[");
        String sep = "";
        for (Transition<I> e : transitions()) {
            sb.append(sep).append('(').append(e.source()).append(", ").append(e.target()).append(", ")
              .append(e.isEpsilon() ? "ε" : e.symbol()).append(')');
            sep = ", ";
        }
        return sb.append("])").toString();
    }
}
