package work.lcod.assertkit.constraints;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Locale;
import java.util.Objects;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Base for constraints over file system paths given as strings, {@link Path} or {@link File}.
 * Paths are compared textually after canonicalization; the file system is never consulted.
 */
public abstract class PathConstraint extends AbstractConstraint {
    protected final String expected;
    private final String descriptionText;
    private boolean caseInsensitive;

    protected PathConstraint(Object expected, String descriptionText) {
        super(expected);
        this.expected = pathText(Objects.requireNonNull(expected, "expected"));
        this.descriptionText = descriptionText;
    }

    public PathConstraint ignoreCase() {
        this.caseInsensitive = true;
        invalidateDescription();
        return this;
    }

    public PathConstraint respectCase() {
        this.caseInsensitive = false;
        invalidateDescription();
        return this;
    }

    protected abstract boolean matches(String canonicalActual, String canonicalExpected);

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        if (actual == null) {
            return new ConstraintResult(this, null, false);
        }
        var actualPath = canonicalize(pathText(actual));
        var expectedPath = canonicalize(expected);
        if (caseInsensitive) {
            actualPath = actualPath.toLowerCase(Locale.ROOT);
            expectedPath = expectedPath.toLowerCase(Locale.ROOT);
        }
        return new ConstraintResult(this, actual, matches(actualPath, expectedPath));
    }

    /**
     * Unifies separators, then collapses {@code .} and {@code ..} segments and trailing separators.
     */
    static String canonicalize(String path) {
        var unified = path.replace('\\', '/');
        boolean absolute = unified.startsWith("/");
        var segments = new ArrayDeque<String>();
        for (String segment : unified.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment) && !segments.isEmpty() && !"..".equals(segments.peekLast())) {
                segments.removeLast();
            } else if (!"..".equals(segment) || !absolute) {
                segments.addLast(segment);
            }
        }
        var joined = String.join("/", segments);
        return absolute ? "/" + joined : joined;
    }

    private static String pathText(Object value) {
        if (value instanceof Path || value instanceof File || value instanceof CharSequence) {
            return value.toString();
        }
        throw new IllegalArgumentException("The value must be a path but was " + value.getClass().getName());
    }

    @Override
    protected String describe() {
        var text = descriptionText + " " + format(expected);
        return caseInsensitive ? text + ", ignoring case" : text;
    }
}
