package work.lcod.assertkit.comparers;

/**
 * Position at which two collections were found to differ.
 *
 * @param position zero-based index of the first difference
 * @param actualValue actual element, if {@code actualHasData}
 * @param expectedValue expected element, if {@code expectedHasData}
 */
public record FailurePoint(
    long position,
    Object actualValue,
    Object expectedValue,
    boolean actualHasData,
    boolean expectedHasData
) {}
