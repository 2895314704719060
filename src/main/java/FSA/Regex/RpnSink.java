package FSA.Regex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Consumes a postfix token stream with a value stack: an operand pushes a value, an operator pops its operands and
 * pushes the value of the operation.
 *
 * @param <T> value type
 */
public abstract class RpnSink<T> implements Consumer<String> {
    private final Map<String, Operator> operators;
    private final Deque<T> stack = new ArrayDeque<>();

    protected RpnSink(Map<String, Operator> operators) {
        this.operators = operators;
    }

    /**
     * @return the operator denoted by {@code token}, or null for an operand
     */
    protected Operator operatorOf(String token) {
        return operators.get(token);
    }

    /**
     * @param op the operator denoted by {@code token}, null for an operand
     * @return the value of an operand; for an operator, the value passed to {@link #onOperation}
     */
    protected abstract T onAppend(String token, Operator op);

    /**
     * @param operands the popped operands, in infix order
     */
    protected T onOperation(String token, Operator op, T u, List<T> operands) {
        return u;
    }

    @Override
    public void accept(String token) {
        final Operator op = operatorOf(token);
        T u = onAppend(token, op);
        if (op != null) {
            if (stack.size() < op.arity()) {
                throw new IllegalArgumentException("Missing operand for operator '" + token + "'");
            }
            final List<T> operands = new ArrayList<>(op.arity());
            for (int i = 0; i < op.arity(); i++) {
                operands.add(stack.pop());
            }
            Collections.reverse(operands);
            u = onOperation(token, op, u, operands);
        }
        stack.push(u);
    }

    /**
     * @return the value of the whole expression
     * @throws IllegalArgumentException if the stream did not reduce to exactly one value
     */
    public T result() {
        if (stack.size() != 1) {
            throw new IllegalArgumentException("Malformed expression: " + stack.size() + " values left");
        }
        return stack.peek();
    }
}
