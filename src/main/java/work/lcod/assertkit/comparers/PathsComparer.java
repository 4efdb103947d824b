package work.lcod.assertkit.comparers;

import java.io.File;
import java.nio.file.Path;

/**
 * Compares file system locations after normalization.
 */
final class PathsComparer implements ChainComparer {
    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        var left = toPath(x);
        var right = toPath(y);
        if (left == null || right == null) {
            return ComparisonOutcome.ABSTAIN;
        }
        return ComparisonOutcome.of(left.toAbsolutePath().normalize().equals(right.toAbsolutePath().normalize()));
    }

    private static Path toPath(Object value) {
        if (value instanceof Path path) {
            return path;
        }
        if (value instanceof File file) {
            return file.toPath();
        }
        return null;
    }
}
