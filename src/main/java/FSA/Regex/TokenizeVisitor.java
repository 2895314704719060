package FSA.Regex;

/**
 * Receives the pieces of a string split by {@link Tokenizer}: the substrings matched by the token pattern, and the
 * non-empty substrings between them. {@code end} is exclusive.
 */
public interface TokenizeVisitor {
    default void onUnmatched(String unmatched, int start, int end, String s) { }

    default void onMatched(String matched, int start, int end, String s) { }
}
