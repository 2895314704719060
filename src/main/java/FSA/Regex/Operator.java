package FSA.Regex;

/**
 * @param arity number of operands
 * @param precedence binding strength, higher binds tighter
 */
public record Operator(int arity, int precedence, Associativity associativity) { }
