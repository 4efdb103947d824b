package work.lcod.assertkit.constraints;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.assertkit.config.AssertSettings;
import work.lcod.assertkit.runtime.TestExecutionContext;

class StringConstraintTest {
    private final TestExecutionContext context = new TestExecutionContext(AssertSettings.defaults());

    @Test
    void fragmentsMatchAtTheirPositions() {
        assertTrue(new StartsWithConstraint("Hel").applyTo("Hello", context).isSuccess());
        assertFalse(new StartsWithConstraint("hel").applyTo("Hello", context).isSuccess());
        assertTrue(new EndsWithConstraint("llo").applyTo("Hello", context).isSuccess());
        assertFalse(new EndsWithConstraint("Hello!").applyTo("Hello", context).isSuccess());
        assertTrue(new SubstringConstraint("ell").applyTo(new StringBuilder("Hello"), context).isSuccess());
    }

    @Test
    void ignoreCaseRelaxesEveryForm() {
        assertTrue(new StartsWithConstraint("hel").ignoreCase().applyTo("Hello", context).isSuccess());
        assertTrue(new EndsWithConstraint("LLO").ignoreCase().applyTo("Hello", context).isSuccess());
        assertTrue(new SubstringConstraint("ELL").ignoreCase().applyTo("Hello", context).isSuccess());
        assertTrue(new RegexConstraint("^h.*O$").ignoreCase().applyTo("Hello", context).isSuccess());
    }

    @Test
    void regexFindsPatternAnywhere() {
        assertTrue(new RegexConstraint("\\d{3}").applyTo("call 555 now", context).isSuccess());
        assertFalse(new RegexConstraint("^\\d+$").applyTo("12a", context).isSuccess());
        assertThrows(IllegalArgumentException.class, () -> new RegexConstraint("(unclosed"));
    }

    @Test
    void nonStringActualIsAUsageErrorButNullFails() {
        assertThrows(IllegalArgumentException.class, () -> new StartsWithConstraint("1").applyTo(12, context));
        assertFalse(new StartsWithConstraint("1").applyTo(null, context).isSuccess());
    }

    @Test
    void describesWithQuotedExpectation() {
        assertEquals("String starting with \"ab\"", new StartsWithConstraint("ab").getDescription());
        assertEquals("String ending with \"z\", ignoring case", new EndsWithConstraint("z").ignoreCase().getDescription());
        assertEquals("String containing \"mid\"", new SubstringConstraint("mid").getDescription());
        assertEquals("String matching \"a+\"", new RegexConstraint("a+").getDescription());
    }
}
