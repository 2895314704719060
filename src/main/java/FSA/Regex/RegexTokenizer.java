package FSA.Regex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a regular expression into tokens (operators, parentheses, repetitions {@code {m,n}}, bracket classes
 * {@code [...]}, escape sequences, single-character literals) and makes concatenation explicit.
 */
public class RegexTokenizer implements TokenizeVisitor {
    public static final String CAT = ".";

    private static final Pattern TOKENS = Pattern.compile(String.join("|",
        "\\*", "\\+", "\\?", "\\.", "\\|", "\\(", "\\)",
        "\\{\\s*(?:\\d+(?:\\s*,\\s*\\d*)?|,\\s*\\d+)\\s*\\}",
        "\\[[^\\]]*\\]",
        "\\\\[abdDfnrsStvwW*+?.|\\[\\](){}]"));

    private static final String UNSUPPORTED_ESCAPES = "ABZxuUN0";

    private final String cat;
    private final List<String> tokens = new ArrayList<>();
    private boolean prevNeedsCat = false;

    /**
     * @param cat concatenation token to insert, or null to leave concatenation implicit
     */
    public RegexTokenizer(String cat) {
        this.cat = cat;
    }

    public static List<String> tokenize(String pattern) {
        return tokenize(pattern, CAT);
    }

    public static List<String> tokenize(String pattern, String cat) {
        final RegexTokenizer vis = new RegexTokenizer(cat);
        Tokenizer.tokenize(TOKENS, pattern, vis);
        return vis.tokens;
    }

    public List<String> tokens() {
        return tokens;
    }

    @Override
    public void onUnmatched(String unmatched, int start, int end, String s) {
        for (int i = 0; i < unmatched.length(); i++) {
            checkLiteral(unmatched.charAt(i), start + i, s);
        }
        if (cat == null) {
            tokens.add(unmatched);
        } else {
            for (int i = 0; i < unmatched.length(); i++) {
                if (prevNeedsCat) {
                    tokens.add(cat);
                }
                tokens.add(String.valueOf(unmatched.charAt(i)));
                prevNeedsCat = true;
            }
        }
        prevNeedsCat = true;
    }

    private static void checkLiteral(char a, int index, String s) {
        switch (a) {
            case '[':
            case ']':
                throw new RegexSyntaxException("Unmatched bracket", s, index);
            case '{':
            case '}':
                throw new RegexSyntaxException("Malformed repetition", s, index);
            case '\\':
                if (index + 1 >= s.length()) {
                    throw new RegexSyntaxException("Trailing backslash", s, index);
                }
                final char b = s.charAt(index + 1);
                if (UNSUPPORTED_ESCAPES.indexOf(b) >= 0) {
                    throw new RegexSyntaxException("Escape sequence \\" + b + " not supported", s, index);
                }
                throw new RegexSyntaxException("Invalid escape sequence \\" + b, s, index);
            default:
        }
    }

    @Override
    public void onMatched(String matched, int start, int end, String s) {
        final char first = matched.charAt(0);
        if (cat != null && prevNeedsCat && (first == '[' || first == '(' || first == '\\')) {
            tokens.add(cat);
        }
        tokens.add(matched);
        // binary operators and '(' expect an operand next
        prevNeedsCat = !matched.equals("(") && !matched.equals("|") && !matched.equals(CAT);
    }
}
