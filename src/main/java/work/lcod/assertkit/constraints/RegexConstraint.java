package work.lcod.assertkit.constraints;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Succeeds when the pattern is found anywhere in the actual string.
 */
public class RegexConstraint extends StringConstraint {
    public RegexConstraint(String pattern) {
        super(pattern, "String matching");
        compile(0);
    }

    @Override
    protected boolean matches(String actual) {
        return compile(caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0).matcher(actual).find();
    }

    private Pattern compile(int flags) {
        try {
            return Pattern.compile(expected, flags);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException("Invalid regular expression: " + expected, ex);
        }
    }
}
