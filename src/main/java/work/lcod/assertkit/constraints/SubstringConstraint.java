package work.lcod.assertkit.constraints;

import java.util.Locale;

public class SubstringConstraint extends StringConstraint {
    public SubstringConstraint(String expected) {
        super(expected, "String containing");
    }

    @Override
    protected boolean matches(String actual) {
        if (caseInsensitive) {
            return actual.toLowerCase(Locale.ROOT).contains(expected.toLowerCase(Locale.ROOT));
        }
        return actual.contains(expected);
    }
}
