package FSA.Regex;

public enum Associativity {
    LEFT,
    RIGHT
}
