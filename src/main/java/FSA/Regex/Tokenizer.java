package FSA.Regex;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Tokenizer {
    private Tokenizer() { }

    /**
     * Splits {@code s} into the matches of {@code tokens} and the non-empty gaps between them, reported in order.
     */
    public static void tokenize(Pattern tokens, String s, TokenizeVisitor vis) {
        int start = 0;
        final Matcher matcher = tokens.matcher(s);
        while (matcher.find()) {
            if (matcher.start() > start) {
                vis.onUnmatched(s.substring(start, matcher.start()), start, matcher.start(), s);
            }
            if (matcher.end() > matcher.start()) {
                vis.onMatched(matcher.group(), matcher.start(), matcher.end(), s);
            }
            start = matcher.end();
        }
        if (start < s.length()) {
            vis.onUnmatched(s.substring(start), start, s.length(), s);
        }
    }
}
