package FSA.Traversal;

/**
 * A state of the product of two automata. Either side may be BOTTOM, but not both.
 */
public record StatePair(int q1, int q2) { }
