package FSA.Regex;

import FSA.Graph.Nfa;

/**
 * An NFA under construction by {@link ThompsonCompiler}: one initial state, one final state.
 */
public record Fragment(Nfa<Character> nfa, int initial, int finalState) { }
