package work.lcod.assertkit.constraints;

import java.util.List;
import work.lcod.assertkit.comparers.FailurePoint;

/**
 * Result of an {@link EqualConstraint}; adds string and collection difference details to the message.
 */
public class EqualConstraintResult extends ConstraintResult {
    private final Object expected;
    private final List<FailurePoint> failurePoints;

    public EqualConstraintResult(EqualConstraint constraint, Object actual, boolean isSuccess, List<FailurePoint> failurePoints) {
        super(constraint, actual, isSuccess);
        this.expected = constraint.expected();
        this.failurePoints = List.copyOf(failurePoints);
    }

    public List<FailurePoint> failurePoints() {
        return failurePoints;
    }

    @Override
    public void writeMessageTo(TextMessageWriter writer) {
        if (expected instanceof CharSequence expectedText && actualValue() instanceof CharSequence actualText) {
            writer.writeLine(stringDifference(expectedText.toString(), actualText.toString()));
        }
        writer.displayDifferences(this);
    }

    @Override
    public void writeAdditionalLinesTo(TextMessageWriter writer) {
        if (failurePoints.isEmpty()) {
            return;
        }
        var point = failurePoints.get(0);
        if (point.actualHasData() && point.expectedHasData()) {
            writer.writeLine("Values differ at index [" + point.position() + "]");
            writer.writeLine("Expected: " + writer.formatValue(point.expectedValue()));
            writer.writeLine("But was:  " + writer.formatValue(point.actualValue()));
        } else if (point.expectedHasData()) {
            writer.writeLine("Values differ at index [" + point.position() + "]");
            writer.writeLine("Missing:  " + writer.formatValue(point.expectedValue()));
        } else {
            writer.writeLine("Values differ at index [" + point.position() + "]");
            writer.writeLine("Extra:    " + writer.formatValue(point.actualValue()));
        }
    }

    private static String stringDifference(String expected, String actual) {
        int index = 0;
        int limit = Math.min(expected.length(), actual.length());
        while (index < limit && expected.charAt(index) == actual.charAt(index)) {
            index++;
        }
        var lengths = expected.length() == actual.length()
            ? "String lengths are both " + expected.length() + "."
            : "Expected string length " + expected.length() + " but was " + actual.length() + ".";
        return lengths + " Strings differ at index " + index + ".";
    }
}
