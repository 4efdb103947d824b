package work.lcod.assertkit.constraints;

/**
 * Succeeds when the actual path lies strictly below the expected one.
 */
public class SubPathConstraint extends PathConstraint {
    public SubPathConstraint(Object expected) {
        super(expected, "Subpath of");
    }

    @Override
    protected boolean matches(String canonicalActual, String canonicalExpected) {
        if (canonicalActual.length() <= canonicalExpected.length() || !canonicalActual.startsWith(canonicalExpected)) {
            return false;
        }
        return canonicalExpected.endsWith("/") || canonicalActual.charAt(canonicalExpected.length()) == '/';
    }
}
