package FSA.Regex;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator tables for {@link ShuntingYard}.
 */
public final class Operators {
    private Operators() { }

    /**
     * Regular expression operators. {@code .} is the explicit concatenation inserted by {@link RegexTokenizer}.
     */
    public static final Map<String, Operator> REGEX;

    /**
     * Bounded repetition {@code {m,n}}, applied to the operand preceding it in postfix order.
     */
    public static final Operator REPETITION = new Operator(1, 4, Associativity.LEFT);

    /**
     * Arithmetic operators. {@code u+} and {@code u-} are the unary signs emitted by {@link ArithmeticTokenizer}.
     */
    public static final Map<String, Operator> ARITHMETIC;

    static {
        final Map<String, Operator> regex = new LinkedHashMap<>();
        regex.put("*", new Operator(1, 4, Associativity.LEFT));
        regex.put("+", new Operator(1, 4, Associativity.LEFT));
        regex.put("?", new Operator(1, 3, Associativity.LEFT));
        regex.put(".", new Operator(2, 2, Associativity.LEFT));
        regex.put("|", new Operator(2, 1, Associativity.LEFT));
        REGEX = Collections.unmodifiableMap(regex);

        final Map<String, Operator> arithmetic = new LinkedHashMap<>();
        arithmetic.put("u+", new Operator(1, 3, Associativity.RIGHT));
        arithmetic.put("u-", new Operator(1, 3, Associativity.RIGHT));
        arithmetic.put("^", new Operator(2, 4, Associativity.RIGHT));
        arithmetic.put("*", new Operator(2, 3, Associativity.LEFT));
        arithmetic.put("/", new Operator(2, 3, Associativity.LEFT));
        arithmetic.put("+", new Operator(2, 2, Associativity.LEFT));
        arithmetic.put("-", new Operator(2, 2, Associativity.LEFT));
        ARITHMETIC = Collections.unmodifiableMap(arithmetic);
    }
}
