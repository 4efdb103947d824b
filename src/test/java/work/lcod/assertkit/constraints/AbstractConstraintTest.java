package work.lcod.assertkit.constraints;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import work.lcod.assertkit.config.AssertSettings;
import work.lcod.assertkit.runtime.TestExecutionContext;

class AbstractConstraintTest {
    private final TestExecutionContext context = new TestExecutionContext(AssertSettings.defaults());

    @Test
    void descriptionIsComputedOnFirstAccessOnly() {
        var constraint = new TallyConstraint();
        assertEquals(0, constraint.describeCalls);

        assertEquals("tally 0", constraint.getDescription());
        assertEquals("tally 0", constraint.getDescription());
        assertEquals("tally 0", constraint.getDescription());
        assertEquals(1, constraint.describeCalls);
    }

    @Test
    void applyingDoesNotComputeTheDescription() {
        var constraint = new TallyConstraint();
        constraint.applyTo("x", context);
        constraint.applyTo("y", context);
        assertEquals(0, constraint.describeCalls);
    }

    @Test
    void modifierRecomputesTheDescriptionOnce() {
        var constraint = new TallyConstraint();
        constraint.getDescription();

        constraint.raise();
        assertEquals(1, constraint.describeCalls);
        assertEquals("tally 1", constraint.getDescription());
        assertEquals("tally 1", constraint.getDescription());
        assertEquals(2, constraint.describeCalls);
    }

    @Test
    void equalModifiersRefreshTheCachedDescription() {
        var constraint = new EqualConstraint("abc");
        assertEquals("\"abc\"", constraint.getDescription());
        constraint.ignoreCase();
        assertEquals("\"abc\", ignoring case", constraint.getDescription());
    }

    private static final class TallyConstraint extends AbstractConstraint {
        private int level;
        private int describeCalls;

        void raise() {
            level++;
            invalidateDescription();
        }

        @Override
        public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
            return new ConstraintResult(this, actual, true);
        }

        @Override
        protected String describe() {
            describeCalls++;
            return "tally " + level;
        }
    }
}
