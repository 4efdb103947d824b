package work.lcod.assertkit.constraints;

public class EndsWithConstraint extends StringConstraint {
    public EndsWithConstraint(String expected) {
        super(expected, "String ending with");
    }

    @Override
    protected boolean matches(String actual) {
        int offset = actual.length() - expected.length();
        return offset >= 0 && actual.regionMatches(caseInsensitive, offset, expected, 0, expected.length());
    }
}
