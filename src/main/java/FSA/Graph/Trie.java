package FSA.Graph;

import java.util.List;

import FSA.Product.TrieFusion;
import FSA.Property.AttributeMap;

/**
 * Deterministic automaton built by inserting words. It always has an initial state, 0.
 */
public class Trie<I> extends Automaton<I> {
    public Trie() {
        this(AttributeMap.assoc(false));
    }

    public Trie(AttributeMap<Integer, Boolean> finals) {
        super(1, finals);
    }

    /**
     * Adds every word of {@code other} to this trie, reusing the existing prefixes.
     */
    public void insert(DeterministicAutomaton<I> other) {
        TrieFusion.fuse(this, other);
    }

    /**
     * Builds the trie of the factors of {@code word} of length at most {@code maxLength} (unbounded if
     * {@code maxLength <= 0}). Every state is final.
     */
    public static <I> Trie<I> suffixTrie(List<? extends I> word, int maxLength) {
        final Trie<I> g = new Trie<>(AttributeMap.func(q -> q != BOTTOM));
        final int n = word.size();
        for (int i = 0; i < n; i++) {
            int q = g.initial();
            final int end = maxLength > 0 ? Math.min(n, i + maxLength) : n;
            for (int j = i; j < end; j++) {
                final I a = word.get(j);
                int r = g.delta(q, a);
                if (r == BOTTOM) {
                    r = g.addState();
                    g.addTransition(q, r, a);
                }
                q = r;
            }
        }
        return g;
    }

    public static <I> Trie<I> suffixTrie(List<? extends I> word) {
        return suffixTrie(word, 0);
    }
}
