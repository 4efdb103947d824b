package work.lcod.assertkit.comparers;

/**
 * One entry of the equality chain. Implementations decide the pair or abstain so the next entry is tried.
 */
@FunctionalInterface
public interface ChainComparer {
    /**
     * @param x the actual value, never {@code null}
     * @param y the expected value, never {@code null}
     */
    ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state);
}
