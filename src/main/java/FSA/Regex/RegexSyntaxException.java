package FSA.Regex;

import java.util.regex.PatternSyntaxException;

/**
 * Malformed regular expression: bad or unsupported escape, invalid bracket range, invalid repetition bounds,
 * unbalanced brackets or parentheses, operator without operand.
 */
public class RegexSyntaxException extends PatternSyntaxException {
    private static final long serialVersionUID = 1L;

    public RegexSyntaxException(String description, String pattern, int index) {
        super(description, pattern, index);
    }
}
