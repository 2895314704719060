package FSA.Regex;

import java.util.Collection;

import FSA.Determinize.MooreDeterminizer;
import FSA.Graph.IncidenceAutomaton;
import FSA.Graph.Nfa;
import FSA.Minimize.HopcroftMinimizer;

/**
 * Compiles a regular expression down to an NFA, a DFA or a minimal DFA.
 */
public final class Regexps {
    private Regexps() { }

    /**
     * @throws RegexSyntaxException if {@code pattern} is malformed
     */
    public static Nfa<Character> compileNfa(String pattern, Collection<Character> alphabet) {
        return ThompsonCompiler.compile(pattern, alphabet).nfa();
    }

    public static Nfa<Character> compileNfa(String pattern) {
        return compileNfa(pattern, CharClasses.PRINTABLE);
    }

    /**
     * @param complete see {@link MooreDeterminizer#determinize(Nfa, boolean)}
     */
    public static IncidenceAutomaton<Character> compileDfa(String pattern, boolean complete) {
        return MooreDeterminizer.determinize(compileNfa(pattern), complete);
    }

    public static IncidenceAutomaton<Character> compileDfa(String pattern) {
        return compileDfa(pattern, false);
    }

    /**
     * @return the minimal DFA of {@code pattern}, without trap state
     */
    public static IncidenceAutomaton<Character> compileMinimalDfa(String pattern) {
        return HopcroftMinimizer.minimize(compileDfa(pattern, false));
    }
}
