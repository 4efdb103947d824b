package work.lcod.assertkit.constraints;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import work.lcod.assertkit.config.AssertSettings;
import work.lcod.assertkit.runtime.TestExecutionContext;

class PathConstraintTest {
    private final TestExecutionContext context = new TestExecutionContext(AssertSettings.defaults());

    @Test
    void canonicalizesSeparatorsAndDotSegments() {
        assertEquals("/a/c", PathConstraint.canonicalize("/a/b/../c/."));
        assertEquals("/a/c", PathConstraint.canonicalize("\\a\\c\\"));
        assertEquals("../x", PathConstraint.canonicalize("a/../../x"));
        assertEquals("/", PathConstraint.canonicalize("/a/.."));
    }

    @Test
    void samePathIgnoresSpellingDifferences() {
        assertTrue(new SamePathConstraint("/usr/local/../bin").applyTo(Path.of("/usr/bin"), context).isSuccess());
        assertFalse(new SamePathConstraint("/usr/bin").applyTo("/USR/bin", context).isSuccess());
        assertTrue(new SamePathConstraint("/usr/bin").ignoreCase().applyTo("/USR/bin", context).isSuccess());
    }

    @Test
    void subPathMustLieStrictlyBelow() {
        var constraint = new SubPathConstraint("/data");
        assertTrue(constraint.applyTo("/data/logs/app.log", context).isSuccess());
        assertFalse(constraint.applyTo("/data", context).isSuccess());
        assertFalse(constraint.applyTo("/database", context).isSuccess());
        assertTrue(new SubPathConstraint("/").applyTo("/etc", context).isSuccess());
    }

    @Test
    void rejectsNonPathValues() {
        assertThrows(IllegalArgumentException.class, () -> new SamePathConstraint("/a").applyTo(42, context));
        assertFalse(new SamePathConstraint("/a").applyTo(null, context).isSuccess());
        assertEquals("Path matching \"/a\"", new SamePathConstraint("/a").getDescription());
    }
}
