package work.lcod.assertkit.constraints;

public class StartsWithConstraint extends StringConstraint {
    public StartsWithConstraint(String expected) {
        super(expected, "String starting with");
    }

    @Override
    protected boolean matches(String actual) {
        return actual.regionMatches(caseInsensitive, 0, expected, 0, expected.length());
    }
}
