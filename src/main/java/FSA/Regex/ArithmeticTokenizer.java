package FSA.Regex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits an arithmetic expression into numbers, operators and parentheses. A {@code +} or {@code -} following an
 * operator (or starting the expression) is emitted as the unary sign {@code u+} / {@code u-}. Whitespace is ignored.
 */
public class ArithmeticTokenizer implements TokenizeVisitor {
    private static final Pattern TOKENS = Pattern.compile("\\^|\\*|/|\\+|-|\\(|\\)");

    private final List<String> tokens = new ArrayList<>();
    private boolean prevIsOperator = true;

    public static List<String> tokenize(String expression) {
        final ArithmeticTokenizer vis = new ArithmeticTokenizer();
        Tokenizer.tokenize(TOKENS, expression.replaceAll("\\s+", ""), vis);
        return vis.tokens;
    }

    @Override
    public void onUnmatched(String unmatched, int start, int end, String s) {
        // fail early on anything that is not a number
        Double.parseDouble(unmatched);
        tokens.add(unmatched);
        prevIsOperator = false;
    }

    @Override
    public void onMatched(String matched, int start, int end, String s) {
        String operator = matched;
        if (prevIsOperator && !matched.equals("(") && !matched.equals(")")) {
            if (matched.equals("+") || matched.equals("-")) {
                operator = "u" + matched;
            } else {
                throw new IllegalArgumentException("Invalid unary operator '" + matched + "' at index " + start);
            }
        }
        tokens.add(operator);
        prevIsOperator = !matched.equals(")");
    }
}
