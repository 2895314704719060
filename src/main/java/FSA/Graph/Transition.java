package FSA.Graph;

/**
 * A labeled transition. A {@code null} symbol denotes an epsilon transition (non-deterministic automata only).
 * The index tells parallel copies of the same (source, target, symbol) triple apart; it is always 0 in
 * deterministic automata.
 *
 * @param <I> symbol type
 */
public record Transition<I>(int source, int target, I symbol, int index) {
    public Transition(int source, int target, I symbol) {
        this(source, target, symbol, 0);
    }

    public boolean isEpsilon() {
        return symbol == null;
    }

    public Transition<I> reversed() {
        return new Transition<>(target, source, symbol, index);
    }
}
