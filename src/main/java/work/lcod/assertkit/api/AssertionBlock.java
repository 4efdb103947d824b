package work.lcod.assertkit.api;

/**
 * Body of a multiple assertion block.
 */
@FunctionalInterface
public interface AssertionBlock {
    void run();
}
