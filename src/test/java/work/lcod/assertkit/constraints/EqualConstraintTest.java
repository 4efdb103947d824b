package work.lcod.assertkit.constraints;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;
import work.lcod.assertkit.comparers.Tolerance;
import work.lcod.assertkit.config.AssertSettings;
import work.lcod.assertkit.runtime.TestExecutionContext;
import work.lcod.assertkit.shared.MessageFormatting;

class EqualConstraintTest {
    private final TestExecutionContext context = new TestExecutionContext(AssertSettings.defaults());

    @Test
    void matchesDeepEqualValues() {
        assertTrue(new EqualConstraint(List.of(1, 2)).applyTo(new int[] {1, 2}, context).isSuccess());
        assertFalse(new EqualConstraint("abc").applyTo("abd", context).isSuccess());
        assertFalse(new EqualConstraint(1).applyTo(null, context).isSuccess());
    }

    @Test
    void toleranceModifiersWidenTheMatch() {
        assertTrue(new EqualConstraint(10).within(1).applyTo(11, context).isSuccess());
        assertTrue(new EqualConstraint(100.0).within(5).percent().applyTo(104.0, context).isSuccess());
        assertFalse(new EqualConstraint(100.0).within(5).percent().applyTo(106.0, context).isSuccess());

        var noon = LocalDateTime.of(2024, 5, 1, 12, 0);
        assertTrue(new EqualConstraint(noon).within(2).minutes().applyTo(noon.plusSeconds(90), context).isSuccess());
    }

    @Test
    void withinMayOnlyBeGivenOnce() {
        var constraint = new EqualConstraint(1.0).within(0.1);
        assertThrows(IllegalStateException.class, () -> constraint.within(0.2));
    }

    @Test
    void numericToleranceOnTextIsReportedAsUsageError() {
        var constraint = new EqualConstraint("abc").within(1);
        assertThrows(IllegalStateException.class, () -> constraint.applyTo("abc", context));
    }

    @Test
    void contextSuppliesDefaultFloatingPointTolerance() {
        var lenient = new TestExecutionContext(AssertSettings.defaults().withFloatingPointTolerance(Tolerance.of(0.01)));
        assertTrue(new EqualConstraint(0.3).applyTo(0.1 + 0.2, lenient).isSuccess());
        assertFalse(new EqualConstraint(0.3).applyTo(0.1 + 0.2, context).isSuccess());
    }

    @Test
    void collectionModifiersApplyToSequences() {
        assertTrue(new EqualConstraint(List.of("A", "b")).ignoreCase().applyTo(List.of("a", "B"), context).isSuccess());
        assertTrue(new EqualConstraint(List.of(3, 1, 2)).ignoringOrder().applyTo(List.of(1, 2, 3), context).isSuccess());
        assertTrue(new EqualConstraint("HeLLo").using(String.class, String.CASE_INSENSITIVE_ORDER)
            .applyTo("hello", context).isSuccess());
    }

    @Test
    void descriptionShowsToleranceAndModifiers() {
        assertEquals("5 +/- 1", new EqualConstraint(5).within(1).getDescription());
        assertEquals("\"abc\", ignoring case", new EqualConstraint("abc").ignoreCase().getDescription());
        assertEquals("2.0d +/- 3 Percent", new EqualConstraint(2.0).within(3).percent().getDescription());
    }

    @Test
    void stringFailureMessageLocatesFirstDifference() {
        var result = new EqualConstraint("hello").applyTo("help", context);
        var writer = new TextMessageWriter(MessageFormatting.defaultFormatter(), "greeting");
        result.writeMessageTo(writer);

        var message = writer.toString();
        assertTrue(message.startsWith("greeting"));
        assertTrue(message.contains("Expected string length 5 but was 4. Strings differ at index 3."));
        assertTrue(message.contains(TextMessageWriter.PFX_EXPECTED + "\"hello\""));
        assertTrue(message.contains(TextMessageWriter.PFX_ACTUAL + "\"help\""));
    }

    @Test
    void collectionFailureMessageNamesTheIndex() {
        var result = new EqualConstraint(List.of(1, 2, 3)).applyTo(List.of(1, 9, 3), context);
        var writer = new TextMessageWriter(MessageFormatting.defaultFormatter(), null);
        result.writeMessageTo(writer);

        var message = writer.toString();
        assertTrue(message.contains("Values differ at index [1]"), message);
        assertTrue(message.contains("But was:  9"), message);
        assertEquals(1, ((EqualConstraintResult) result).failurePoints().size());
    }

    @Test
    void sharedConstraintKeepsEachCallsContext() throws Exception {
        var lenient = new TestExecutionContext(new AssertSettings(Tolerance.of(0.1), 200, true));
        var strict = new TestExecutionContext(AssertSettings.defaults());
        var constraint = new EqualConstraint(1.0);
        var start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Callable<Integer> lenientRuns = () -> mismatches(start, () -> constraint.applyTo(1.05, lenient).isSuccess());
            Callable<Integer> strictRuns = () -> mismatches(start, () -> !constraint.applyTo(1.05, strict).isSuccess());
            var first = pool.submit(lenientRuns);
            var second = pool.submit(strictRuns);
            start.countDown();
            assertEquals(0, first.get(30, TimeUnit.SECONDS));
            assertEquals(0, second.get(30, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failurePointsBelongToTheirOwnResult() {
        var constraint = new EqualConstraint(List.of(1, 2, 3));
        var failed = (EqualConstraintResult) constraint.applyTo(List.of(1, 9, 3), context);
        var passed = (EqualConstraintResult) constraint.applyTo(List.of(1, 2, 3), context);

        assertEquals(1, failed.failurePoints().size());
        assertTrue(passed.failurePoints().isEmpty());
    }

    private static int mismatches(CountDownLatch start, BooleanSupplier expectedOutcome) throws InterruptedException {
        start.await();
        int wrong = 0;
        for (int i = 0; i < 2_000; i++) {
            if (!expectedOutcome.getAsBoolean()) {
                wrong++;
            }
        }
        return wrong;
    }
}
