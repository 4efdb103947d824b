package work.lcod.assertkit.comparers;

/**
 * Modes in which a {@link Tolerance} relaxes an equality or ordering check.
 */
public enum ToleranceMode {
    /** No tolerance was specified; floating point values fall back to the context default. */
    UNSET,
    /** Exact comparison requested explicitly. */
    NONE,
    /** Fixed amount added to and subtracted from the expected value. */
    LINEAR,
    /** Percentage of the expected value. */
    PERCENT,
    /** Units in the last place, floating point only. */
    ULPS,
    /** Time window for durations and temporal values. */
    DURATION
}
