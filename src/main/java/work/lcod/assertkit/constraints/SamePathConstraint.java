package work.lcod.assertkit.constraints;

public class SamePathConstraint extends PathConstraint {
    public SamePathConstraint(Object expected) {
        super(expected, "Path matching");
    }

    @Override
    protected boolean matches(String canonicalActual, String canonicalExpected) {
        return canonicalActual.equals(canonicalExpected);
    }
}
