package FSA.Regex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Abstract syntax tree: each vertex holds a token, operators have their operands as children (in order).
 */
public class Ast {
    private final List<String> symbols = new ArrayList<>();
    private final List<IntList> children = new ArrayList<>();
    private int root = -1;

    public int addVertex(String symbol) {
        symbols.add(symbol);
        children.add(new IntArrayList());
        return symbols.size() - 1;
    }

    public void addChild(int u, int v) {
        children.get(u).add(v);
    }

    public String symbol(int u) {
        return symbols.get(u);
    }

    public IntList children(int u) {
        return children.get(u);
    }

    public int numVertices() {
        return symbols.size();
    }

    public int root() {
        return root;
    }

    public void setRoot(int root) {
        this.root = root;
    }

    /**
     * Prints the tree as a fully parenthesized infix expression: a leaf is its symbol, a unary node
     * {@code (child)op}, an n-ary node {@code (c1 op c2 ...)}.
     */
    public String toExpression() {
        if (root < 0) {
            throw new IllegalStateException("The root is not set");
        }
        final Map<Integer, String> printed = new HashMap<>();
        final Deque<Integer> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final int u = stack.peek();
            boolean ready = true;
            for (int v : children(u)) {
                if (!printed.containsKey(v)) {
                    stack.push(v);
                    ready = false;
                }
            }
            if (!ready) {
                continue;
            }
            stack.pop();
            final IntList cs = children(u);
            final String a = symbol(u);
            if (cs.isEmpty()) {
                printed.put(u, a);
            } else if (cs.size() == 1) {
                printed.put(u, "(" + printed.get(cs.getInt(0)) + ")" + a);
            } else {
                final List<String> parts = new ArrayList<>(cs.size());
                for (int v : cs) {
                    parts.add(printed.get(v));
                }
                printed.put(u, "(" + String.join(a, parts) + ")");
            }
        }
        return printed.get(root);
    }
}
