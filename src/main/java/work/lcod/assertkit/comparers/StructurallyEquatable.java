package work.lcod.assertkit.comparers;

/**
 * Implemented by types that compare their structure through a caller supplied element comparison.
 */
public interface StructurallyEquatable {
    boolean structurallyEquals(Object other, ElementComparison comparison);

    /**
     * Element-level equality handed to {@link #structurallyEquals}.
     */
    @FunctionalInterface
    interface ElementComparison {
        boolean areEqual(Object x, Object y);
    }
}
