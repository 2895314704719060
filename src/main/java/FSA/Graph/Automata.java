package FSA.Graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Predicate;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Builds automata from explicit transition lists whose states are identified by arbitrary labels. Labels are
 * sorted to assign dense state ids, so the result does not depend on the order of the transitions.
 */
public final class Automata {
    private Automata() { }

    /**
     * A transition between two labeled states.
     */
    public record Edge<L, I>(L source, L target, I symbol) { }

    /**
     * An unlabeled transition, for node-labeled automata.
     */
    public record Arc<L>(L source, L target) { }

    public static <L, I> Edge<L, I> edge(L source, L target, I symbol) {
        return new Edge<>(source, target, symbol);
    }

    public static <L> Arc<L> arc(L source, L target) {
        return new Arc<>(source, target);
    }

    public static List<Character> chars(CharSequence s) {
        final List<Character> result = new ArrayList<>(s.length());
        for (int i = 0; i < s.length(); i++) {
            result.add(s.charAt(i));
        }
        return result;
    }

    private static <L extends Comparable<? super L>> Map<L, Integer> denseIds(Collection<? extends Edge<L, ?>> edges) {
        final TreeSet<L> labels = new TreeSet<>();
        for (Edge<L, ?> e : edges) {
            labels.add(e.source());
            labels.add(e.target());
        }
        final Map<L, Integer> ids = new HashMap<>();
        for (L label : labels) {
            ids.put(label, ids.size());
        }
        return ids;
    }

    /**
     * @param constructor allocates an automaton with the given number of states
     */
    public static <L extends Comparable<? super L>, I, A extends MutableDeterministicAutomaton<I>> A make(
            Collection<? extends Edge<L, I>> edges, L initial, Predicate<? super L> isFinal,
            IntFunction<A> constructor) {
        final Map<L, Integer> ids = denseIds(edges);
        final A g = constructor.apply(ids.size());
        for (Edge<L, I> e : edges) {
            g.addTransition(ids.get(e.source()), ids.get(e.target()), e.symbol());
        }
        if (g.numStates() > 0) {
            final Integer q0 = ids.get(initial);
            if (q0 == null) {
                throw new IllegalArgumentException("Initial state " + initial + " has no transition");
            }
            g.setInitial(q0);
        }
        for (Map.Entry<L, Integer> entry : ids.entrySet()) {
            if (isFinal.test(entry.getKey())) {
                g.setFinal(entry.getValue());
            }
        }
        return g;
    }

    public static <L extends Comparable<? super L>, I> Automaton<I> make(
            Collection<? extends Edge<L, I>> edges, L initial, Predicate<? super L> isFinal) {
        return make(edges, initial, isFinal, Automaton::new);
    }

    public static <L extends Comparable<? super L>, I> IncidenceAutomaton<I> incidence(
            Collection<? extends Edge<L, I>> edges, L initial, Predicate<? super L> isFinal) {
        return make(edges, initial, isFinal, IncidenceAutomaton::new);
    }

    /**
     * Builds an {@link Nfa}. A null symbol stands for epsilon.
     */
    public static <L extends Comparable<? super L>, I> Nfa<I> nfa(
            Collection<? extends Edge<L, I>> edges, Collection<? extends L> initials, Predicate<? super L> isFinal) {
        final Map<L, Integer> ids = denseIds(edges);
        final Nfa<I> g = new Nfa<>(ids.size());
        for (Edge<L, I> e : edges) {
            g.addTransition(ids.get(e.source()), ids.get(e.target()), e.symbol());
        }
        final IntSet q0s = new IntOpenHashSet();
        for (L label : initials) {
            q0s.add(ids.get(label));
        }
        g.setInitials(q0s);
        for (Map.Entry<L, Integer> entry : ids.entrySet()) {
            if (isFinal.test(entry.getKey())) {
                g.setFinal(entry.getValue());
            }
        }
        return g;
    }

    /**
     * Builds an {@link IncidenceNodeAutomaton}. The state labeled {@code initial} gets id 0; the other states get ids
     * in order of first appearance among the sorted arcs.
     */
    public static <L extends Comparable<? super L>, I> IncidenceNodeAutomaton<I> node(
            Collection<? extends Arc<L>> arcs, Function<? super L, ? extends I> symbols, L initial,
            Predicate<? super L> isFinal) {
        final List<Arc<L>> sorted = new ArrayList<>(arcs);
        sorted.sort(Comparator.<Arc<L>, L>comparing(Arc::source).thenComparing(Arc::target));

        final IncidenceNodeAutomaton<I> g = new IncidenceNodeAutomaton<>();
        final int q0 = g.addState();
        g.setInitial(q0);
        if (isFinal.test(initial)) {
            g.setFinal(q0);
        }
        final Map<L, Integer> ids = new HashMap<>();
        ids.put(initial, q0);
        final Function<L, Integer> addState = label -> ids.computeIfAbsent(label, k -> {
            final int q = g.addState(symbols.apply(k));
            if (isFinal.test(k)) {
                g.setFinal(q);
            }
            return q;
        });
        for (Arc<L> arc : sorted) {
            final int q = addState.apply(arc.source());
            final int r = addState.apply(arc.target());
            g.addTransition(q, r);
        }
        return g;
    }
}
