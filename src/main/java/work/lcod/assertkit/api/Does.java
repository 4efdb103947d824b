package work.lcod.assertkit.api;

import work.lcod.assertkit.constraints.EndsWithConstraint;
import work.lcod.assertkit.constraints.RegexConstraint;
import work.lcod.assertkit.constraints.StartsWithConstraint;
import work.lcod.assertkit.constraints.StringConstraint;
import work.lcod.assertkit.constraints.SubstringConstraint;
import work.lcod.assertkit.constraints.operators.ConstraintExpression;

public final class Does {
    private Does() {}

    public static ConstraintExpression not() {
        return new ConstraintExpression().not();
    }

    public static StringConstraint startWith(String expected) {
        return new StartsWithConstraint(expected);
    }

    public static StringConstraint endWith(String expected) {
        return new EndsWithConstraint(expected);
    }

    public static StringConstraint contain(String expected) {
        return new SubstringConstraint(expected);
    }

    public static StringConstraint match(String pattern) {
        return new RegexConstraint(pattern);
    }
}
