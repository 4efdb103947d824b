package work.lcod.assertkit.constraints.operators;

import java.util.Objects;
import work.lcod.assertkit.constraints.PropertyConstraint;
import work.lcod.assertkit.constraints.PropertyExistsConstraint;

/**
 * {@code property(name)}: a property test on its own, or a constraint on the property value.
 */
public class PropertyOperator extends SelfResolvingOperator {
    private final String name;

    public PropertyOperator(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    @Override
    public void reduce(ConstraintBuilder.ConstraintStack stack) {
        if (standsAlone()) {
            stack.push(new PropertyExistsConstraint(name));
        } else {
            stack.push(new PropertyConstraint(name, stack.pop()));
        }
    }
}
