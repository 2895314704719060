package FSA.Graph;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import FSA.Property.AttributeMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

/**
 * Mutable deterministic automaton stored as one (symbol -> target) table per state. State ids are allocated in
 * increasing order and never reused after a removal.
 * <p>
 * Until {@link #setInitial(int, boolean)} is called, state 0 (if present) is the initial state.
 *
 * @param <I> symbol type
 */
public class Automaton<I> implements MutableDeterministicAutomaton<I> {
    private final List<Object2IntMap<I>> adjacencies = new ArrayList<>();
    private final BitSet liveStates = new BitSet();
    private final AttributeMap<Integer, Boolean> finals;
    private int initial = 0;
    private int numTransitions = 0;

    public Automaton() {
        this(0);
    }

    public Automaton(int numStates) {
        this(numStates, AttributeMap.assoc(false));
    }

    /**
     * @param numStates number of states created upfront
     * @param finals finality of each state. A read-only map makes {@link #setFinal(int, boolean)} unsupported.
     */
    public Automaton(int numStates, AttributeMap<Integer, Boolean> finals) {
        this.finals = finals;
        for (int i = 0; i < numStates; i++) {
            addState();
        }
    }

    private static <I> Object2IntMap<I> newTable() {
        final Object2IntMap<I> table = new Object2IntLinkedOpenHashMap<>();
        table.defaultReturnValue(BOTTOM);
        return table;
    }

    protected void checkState(int q) {
        if (!hasState(q)) {
            throw new IllegalArgumentException("Invalid state: " + q);
        }
    }

    @Override
    public int addState() {
        final int q = adjacencies.size();
        adjacencies.add(newTable());
        liveStates.set(q);
        return q;
    }

    @Override
    public boolean addTransition(int q, int r, I a) {
        checkState(q);
        checkState(r);
        final Object2IntMap<I> table = adjacencies.get(q);
        if (table.containsKey(a)) {
            return false;
        }
        table.put(a, r);
        numTransitions++;
        return true;
    }

    @Override
    public boolean removeTransition(int q, I a) {
        if (!hasState(q)) {
            return false;
        }
        final Object2IntMap<I> table = adjacencies.get(q);
        if (!table.containsKey(a)) {
            return false;
        }
        // the table itself stays allocated so that q can get new transitions later
        table.removeInt(a);
        numTransitions--;
        return true;
    }

    /**
     * Removes {@code q} and its incident transitions. Without a backward index, this scans every state.
     */
    public void removeState(int q) {
        checkState(q);
        for (int p : states()) {
            for (Transition<I> e : outTransitions(p)) {
                if (e.target() == q || p == q) {
                    removeTransition(e.source(), e.symbol());
                }
            }
        }
        dropState(q);
    }

    /**
     * Forgets {@code q}, which must have no incident transition left.
     */
    protected void dropState(int q) {
        adjacencies.set(q, null);
        liveStates.clear(q);
        if (initial == q) {
            initial = BOTTOM;
        }
    }

    @Override
    public boolean hasState(int q) {
        return q >= 0 && liveStates.get(q);
    }

    @Override
    public IntList states() {
        final IntList result = new IntArrayList(liveStates.cardinality());
        for (int q = liveStates.nextSetBit(0); q >= 0; q = liveStates.nextSetBit(q + 1)) {
            result.add(q);
        }
        return result;
    }

    @Override
    public int numStates() {
        return liveStates.cardinality();
    }

    @Override
    public int initial() {
        return hasState(initial) ? initial : BOTTOM;
    }

    @Override
    public void setInitial(int q, boolean isInitial) {
        if (isInitial) {
            checkState(q);
            initial = q;
        } else if (initial == q) {
            initial = BOTTOM;
        }
    }

    @Override
    public boolean isFinal(int q) {
        return q != BOTTOM && Boolean.TRUE.equals(finals.get(q));
    }

    @Override
    public void setFinal(int q, boolean isFinal) {
        checkState(q);
        finals.put(q, isFinal);
    }

    @Override
    public int delta(int q, I a) {
        return hasState(q) ? adjacencies.get(q).getInt(a) : BOTTOM;
    }

    @Override
    public Set<I> sigma(int q) {
        return hasState(q) ? Collections.unmodifiableSet(adjacencies.get(q).keySet()) : Collections.emptySet();
    }

    @Override
    public List<Transition<I>> outTransitions(int q) {
        if (!hasState(q)) {
            return Collections.emptyList();
        }
        final Object2IntMap<I> table = adjacencies.get(q);
        final List<Transition<I>> result = new ArrayList<>(table.size());
        for (Object2IntMap.Entry<I> entry : table.object2IntEntrySet()) {
            result.add(new Transition<>(q, entry.getIntValue(), entry.getKey()));
        }
        return result;
    }

    @Override
    public int outDegree(int q) {
        return hasState(q) ? adjacencies.get(q).size() : 0;
    }

    @Override
    public List<Transition<I>> transitions() {
        final List<Transition<I>> result = new ArrayList<>(numTransitions);
        for (int q : states()) {
            result.addAll(outTransitions(q));
        }
        return result;
    }

    @Override
    public int numTransitions() {
        return numTransitions;
    }

    /**
     * Adds {@code word} as a new branch hanging from the deepest state reachable by one of its prefixes, then marks
     * the state reached by the whole word as final.
     *
     * @return the state reached by {@code word}
     */
    public int insert(List<? extends I> word) {
        if (initial() == BOTTOM) {
            setInitial(addState());
        }
        final Reach reach = deltaBestEffort(word);
        int q = reach.state();
        for (I a : word.subList(reach.length(), word.size())) {
            final int r = addState();
            addTransition(q, r, a);
            q = r;
        }
        setFinal(q);
        return q;
    }

    protected AttributeMap<Integer, Boolean> finalMap() {
        return finals;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(getClass().getSimpleName())
            .append("(initial=").append(initial()).append(", finals=").append(finals()).append(", transitions=[");
        String sep = "";
        for (Transition<I> e : transitions()) {
            sb.append(sep).append('(').append(e.source()).append(", ").append(e.target()).append(", ")
              .append(e.symbol()).append(')');
            sep = ", ";
        }
        return sb.append("])").toString();
    }
}
