package FSA.Traversal;

/**
 * Traversal marks: WHITE = not seen yet, GRAY = discovered but not finished, BLACK = finished.
 */
public enum Color {
    WHITE,
    GRAY,
    BLACK
}
