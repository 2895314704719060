package FSA.Regex;

import java.util.List;
import java.util.Map;

public class AstBuilder extends RpnSink<Integer> {
    private final Ast ast;

    public AstBuilder(Map<String, Operator> operators, Ast ast) {
        super(operators);
        this.ast = ast;
    }

    /**
     * @return the syntax tree of {@code tokens}, its root set
     */
    public static Ast build(Iterable<String> tokens, Map<String, Operator> operators) {
        final Ast ast = new Ast();
        ast.setRoot(ShuntingYard.evaluate(tokens, operators, new AstBuilder(operators, ast)));
        return ast;
    }

    @Override
    protected Integer onAppend(String token, Operator op) {
        return ast.addVertex(token);
    }

    @Override
    protected Integer onOperation(String token, Operator op, Integer u, List<Integer> operands) {
        for (int v : operands) {
            ast.addChild(u, v);
        }
        return u;
    }
}
