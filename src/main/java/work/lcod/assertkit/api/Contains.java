package work.lcod.assertkit.api;

import work.lcod.assertkit.constraints.CollectionContainsConstraint;
import work.lcod.assertkit.constraints.StringConstraint;
import work.lcod.assertkit.constraints.SubstringConstraint;

public final class Contains {
    private Contains() {}

    public static CollectionContainsConstraint item(Object expected) {
        return new CollectionContainsConstraint(expected);
    }

    public static StringConstraint substring(String expected) {
        return new SubstringConstraint(expected);
    }
}
