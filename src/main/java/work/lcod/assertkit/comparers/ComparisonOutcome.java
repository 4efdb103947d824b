package work.lcod.assertkit.comparers;

/**
 * Result of a single {@link ChainComparer}: a decision, or a request to try the next entry.
 */
public enum ComparisonOutcome {
    EQUAL,
    UNEQUAL,
    ABSTAIN;

    public static ComparisonOutcome of(boolean equal) {
        return equal ? EQUAL : UNEQUAL;
    }

    public boolean isDecided() {
        return this != ABSTAIN;
    }

    public boolean isEqual() {
        return this == EQUAL;
    }
}
