package FSA.Regex;

/**
 * Hooks of {@link ShuntingYard}. Every hook does nothing by default.
 */
public interface ShuntingYardVisitor {
    default void onPopOperator(String o) { }

    default void onPushOperator(String o) { }

    default void onPushOutput(String a) { }
}
