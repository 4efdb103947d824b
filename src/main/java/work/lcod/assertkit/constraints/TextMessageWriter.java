package work.lcod.assertkit.constraints;

import java.util.Objects;
import work.lcod.assertkit.shared.ValueFormatter;

/**
 * Builds the text of a failure message.
 * <pre>
 * user message
 *   Expected: 5
 *   But was:  3
 * </pre>
 */
public final class TextMessageWriter {
    public static final String PFX_EXPECTED = "  Expected: ";
    public static final String PFX_ACTUAL = "  But was:  ";
    public static final String PFX_INDENT = "  ";

    private static final String NL = System.lineSeparator();

    private final StringBuilder out = new StringBuilder();
    private final ValueFormatter formatter;

    public TextMessageWriter(ValueFormatter formatter, String userMessage, Object... args) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        var message = formatUserMessage(userMessage, args);
        if (!message.isEmpty()) {
            out.append(message).append(NL);
        }
    }

    public static String formatUserMessage(String message, Object... args) {
        if (message == null) {
            return "";
        }
        return args == null || args.length == 0 ? message : String.format(message, args);
    }

    public void displayDifferences(ConstraintResult result) {
        writeExpectedLine(result.getDescription());
        out.append(PFX_ACTUAL);
        result.writeActualValueTo(this);
        out.append(NL);
        result.writeAdditionalLinesTo(this);
    }

    public void writeExpectedLine(String description) {
        out.append(PFX_EXPECTED).append(description).append(NL);
    }

    public void writeActualLine(Object actual) {
        out.append(PFX_ACTUAL);
        writeActualValue(actual);
        out.append(NL);
    }

    public void writeActualValue(Object actual) {
        out.append(formatter.format(actual));
    }

    public String formatValue(Object value) {
        return formatter.format(value);
    }

    public void writeLine(String line) {
        out.append(PFX_INDENT).append(line).append(NL);
    }

    public void write(String text) {
        out.append(text);
    }

    @Override
    public String toString() {
        int end = out.length();
        while (end > 0 && Character.isWhitespace(out.charAt(end - 1))) {
            end--;
        }
        return out.substring(0, end);
    }
}
