package work.lcod.assertkit.flow;

import java.security.CodeSource;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders the caller's stack without the library's own frames.
 * <p>
 * A frame belongs to the library when its class sits under the library package and was loaded from
 * the same code source as this class. Callers sharing the package name, such as the library's tests,
 * keep their frames.
 */
final class StackFilter {
    private static final String LIBRARY_PREFIX = "work.lcod.assertkit.";
    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
    private static final String LIBRARY_LOCATION = locationOf(StackFilter.class);

    private StackFilter() {}

    static String currentStackTrace() {
        return WALKER.walk(frames -> frames
            .filter(frame -> !isLibraryClass(frame.getDeclaringClass()))
            .map(frame -> "at " + frame.toStackTraceElement())
            .collect(Collectors.joining(System.lineSeparator())));
    }

    static boolean isLibraryClass(Class<?> type) {
        if (!type.getName().startsWith(LIBRARY_PREFIX)) {
            return false;
        }
        return LIBRARY_LOCATION == null || LIBRARY_LOCATION.equals(locationOf(type));
    }

    private static String locationOf(Class<?> type) {
        CodeSource source = type.getProtectionDomain().getCodeSource();
        return source == null || source.getLocation() == null ? null : Objects.toString(source.getLocation());
    }
}
