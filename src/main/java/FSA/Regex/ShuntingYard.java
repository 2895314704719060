package FSA.Regex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Dijkstra's shunting-yard algorithm: converts an infix token stream to postfix order. Tokens that are neither
 * parentheses nor operators of the table are operands.
 * <p>
 * Postfix tokens are pushed to an output consumer as soon as they are known, so an {@link RpnSink} can evaluate
 * the expression on the fly.
 */
public final class ShuntingYard {
    private ShuntingYard() { }

    public static List<String> postfix(Iterable<String> tokens, Map<String, Operator> operators) {
        final List<String> output = new ArrayList<>();
        convert(tokens, operators, output::add, new ShuntingYardVisitor() { });
        return output;
    }

    public static <T> T evaluate(Iterable<String> tokens, Map<String, Operator> operators, RpnSink<T> sink) {
        convert(tokens, operators, sink, new ShuntingYardVisitor() { });
        return sink.result();
    }

    /**
     * Operator {@code o1} on top of the stack is popped before pushing {@code o2} when it binds tighter, or as tight
     * and {@code o2} is left-associative.
     */
    private static boolean precedes(Operator o1, Operator o2) {
        return o2.associativity() == Associativity.RIGHT
            ? o1.precedence() > o2.precedence()
            : o1.precedence() >= o2.precedence();
    }

    /**
     * @throws IllegalArgumentException on unbalanced parentheses
     */
    public static void convert(Iterable<String> tokens, Map<String, Operator> operators, Consumer<String> output,
                               ShuntingYardVisitor vis) {
        final Deque<String> stack = new ArrayDeque<>();

        for (String a : tokens) {
            if (a.equals("(")) {
                stack.push(a);
                vis.onPushOperator(a);
            } else if (a.equals(")")) {
                while (true) {
                    if (stack.isEmpty()) {
                        throw new IllegalArgumentException("Unbalanced parenthesis: unexpected ')'");
                    }
                    final String o = stack.pop();
                    vis.onPopOperator(o);
                    if (o.equals("(")) {
                        break;
                    }
                    output.accept(o);
                    vis.onPushOutput(o);
                }
            } else if (operators.containsKey(a)) {
                final Operator o2 = operators.get(a);
                while (!stack.isEmpty() && operators.containsKey(stack.peek())
                       && precedes(operators.get(stack.peek()), o2)) {
                    final String o = stack.pop();
                    vis.onPopOperator(o);
                    output.accept(o);
                    vis.onPushOutput(o);
                }
                stack.push(a);
                vis.onPushOperator(a);
            } else {
                output.accept(a);
                vis.onPushOutput(a);
            }
        }

        while (!stack.isEmpty()) {
            final String o = stack.pop();
            vis.onPopOperator(o);
            if (o.equals("(")) {
                throw new IllegalArgumentException("Unbalanced parenthesis: missing ')'");
            }
            output.accept(o);
            vis.onPushOutput(o);
        }
    }
}
