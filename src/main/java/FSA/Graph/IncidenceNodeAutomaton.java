package FSA.Graph;

import java.util.HashMap;
import java.util.Map;

import FSA.Property.AttributeMap;

/**
 * Node-labeled {@link IncidenceAutomaton}: every state carries a symbol and the transitions entering a state are
 * labeled by that symbol. The initial state has no symbol.
 */
public class IncidenceNodeAutomaton<I> extends IncidenceAutomaton<I> {
    private final Map<Integer, I> symbols = new HashMap<>();

    public IncidenceNodeAutomaton() {
        super();
    }

    public IncidenceNodeAutomaton(AttributeMap<Integer, Boolean> finals) {
        super(0, finals);
    }

    /**
     * Adds a state whose incoming transitions are labeled by {@code a}.
     */
    public int addState(I a) {
        final int q = addState();
        symbols.put(q, a);
        return q;
    }

    /**
     * @return the symbol of {@code q}, or null if it has none
     */
    public I symbol(int q) {
        return symbols.get(q);
    }

    /**
     * Adds the transition {@code (q, r)} labeled by the symbol of {@code r}.
     */
    public boolean addTransition(int q, int r) {
        return addTransition(q, r, symbol(r));
    }

    @Override
    public boolean addTransition(int q, int r, I a) {
        final I expected = symbol(r);
        if (expected != null && !expected.equals(a)) {
            throw new IllegalArgumentException(
                "Transition to " + r + " must be labeled by " + expected + ", got " + a);
        }
        return super.addTransition(q, r, a);
    }

    @Override
    public void removeState(int q) {
        super.removeState(q);
        symbols.remove(q);
    }
}
