package FSA.Product;

/**
 * Outcome of {@link DeterministicInclusion#compare}.
 */
public enum Inclusion {
    /**
     * L(g1) is strictly included in L(g2).
     */
    SUBSET(1),
    EQUAL(0),
    /**
     * L(g2) is strictly included in L(g1).
     */
    SUPERSET(-1),
    /**
     * Neither language includes the other. Has no numeric code.
     */
    INCOMPARABLE(null);

    private final Integer code;

    Inclusion(Integer code) {
        this.code = code;
    }

    /**
     * @return 1, 0 or -1, or null for {@link #INCOMPARABLE}
     */
    public Integer code() {
        return code;
    }
}
