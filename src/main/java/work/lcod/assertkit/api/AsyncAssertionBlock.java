package work.lcod.assertkit.api;

import java.util.concurrent.CompletionStage;

/**
 * Body of a multiple assertion block that finishes asynchronously. The block is left only once the
 * returned stage completes.
 */
@FunctionalInterface
public interface AsyncAssertionBlock {
    CompletionStage<?> run();
}
