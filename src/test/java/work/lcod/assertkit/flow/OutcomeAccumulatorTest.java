package work.lcod.assertkit.flow;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class OutcomeAccumulatorTest {
    @Test
    void passesAndWarningsFlushSilently() {
        var accumulator = new OutcomeAccumulator();
        accumulator.record(AssertionResult.of(AssertionStatus.PASSED, ""));
        accumulator.record(AssertionResult.of(AssertionStatus.WARNING, "careful"));

        assertFalse(accumulator.hasFailures());
        assertDoesNotThrow(accumulator::flush);
    }

    @Test
    void failuresAreCombinedInReportOrder() {
        var accumulator = new OutcomeAccumulator();
        accumulator.record(AssertionResult.of(AssertionStatus.FAILED, "first"));
        accumulator.record(AssertionResult.of(AssertionStatus.PASSED, ""));
        accumulator.record(AssertionResult.of(AssertionStatus.WARNING, "second"));
        accumulator.record(AssertionResult.of(AssertionStatus.IGNORED, "third"));

        assertTrue(accumulator.hasFailures());
        var error = assertThrows(MultipleAssertException.class, accumulator::flush);
        assertEquals(3, error.results().size());
        assertEquals(ResultState.FAILURE, error.resultState());
        var message = error.getMessage();
        assertTrue(message.startsWith("Multiple failures or warnings in test:"), message);
        assertTrue(message.indexOf("1) first") < message.indexOf("2) second"), message);
        assertTrue(message.contains("3) third"), message);
    }

    @Test
    void ignoreWinsOverInconclusive() {
        var accumulator = new OutcomeAccumulator();
        accumulator.record(AssertionResult.of(AssertionStatus.INCONCLUSIVE, "maybe"));
        accumulator.record(AssertionResult.of(AssertionStatus.IGNORED, "skip"));

        var signal = assertThrows(IgnoreException.class, accumulator::flush);
        assertEquals("skip", signal.getMessage());
    }

    @Test
    void inconclusiveIsRaisedAlone() {
        var accumulator = new OutcomeAccumulator();
        accumulator.record(AssertionResult.of(AssertionStatus.INCONCLUSIVE, "maybe"));
        assertEquals("maybe", assertThrows(InconclusiveException.class, accumulator::flush).getMessage());
    }

    @Test
    void multilineMessagesAreIndented() {
        var error = new MultipleAssertException(List.of(
            AssertionResult.of(AssertionStatus.FAILED, "line one" + System.lineSeparator() + "line two")));
        assertTrue(error.getMessage().contains(System.lineSeparator() + "  line two"), error.getMessage());
    }
}
