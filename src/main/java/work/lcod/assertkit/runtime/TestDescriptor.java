package work.lcod.assertkit.runtime;

import java.util.Objects;

/**
 * Identifies the test whose assertions a context is tracking. Discovery is left to the runner.
 */
public record TestDescriptor(String id, String name) {
    public TestDescriptor {
        Objects.requireNonNull(id, "id");
        name = name == null || name.isBlank() ? id : name;
    }

    public static TestDescriptor of(String name) {
        return new TestDescriptor(name, name);
    }
}
