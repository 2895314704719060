package FSA.Regex;

import java.util.List;
import java.util.Map;

/**
 * Evaluates arithmetic expressions.
 */
public class RpnCalculator extends RpnSink<Double> {
    public RpnCalculator() {
        this(Operators.ARITHMETIC);
    }

    public RpnCalculator(Map<String, Operator> operators) {
        super(operators);
    }

    public static double evaluate(String expression) {
        return ShuntingYard.evaluate(ArithmeticTokenizer.tokenize(expression), Operators.ARITHMETIC,
                                     new RpnCalculator());
    }

    @Override
    protected Double onAppend(String token, Operator op) {
        return op == null ? Double.valueOf(token) : null;
    }

    @Override
    protected Double onOperation(String token, Operator op, Double u, List<Double> operands) {
        final double x = operands.get(0);
        final double y = op.arity() == 2 ? operands.get(1) : Double.NaN;
        switch (token) {
            case "+": return x + y;
            case "-": return x - y;
            case "*": return x * y;
            case "/": return x / y;
            case "^": return Math.pow(x, y);
            case "u+": return x;
            case "u-": return -x;
            default: throw new IllegalArgumentException("Unsupported operator '" + token + "'");
        }
    }
}
