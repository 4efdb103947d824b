package work.lcod.assertkit.constraints.operators;

import java.util.Objects;
import work.lcod.assertkit.constraints.AnnotationConstraint;
import work.lcod.assertkit.constraints.AnnotationExistsConstraint;

public class AnnotationOperator extends SelfResolvingOperator {
    private final Class<?> annotationType;

    public AnnotationOperator(Class<?> annotationType) {
        this.annotationType = Objects.requireNonNull(annotationType, "annotationType");
        if (!annotationType.isAnnotation()) {
            throw new IllegalArgumentException("Type " + annotationType.getName() + " is not an annotation type");
        }
    }

    @Override
    public void reduce(ConstraintBuilder.ConstraintStack stack) {
        if (standsAlone()) {
            stack.push(new AnnotationExistsConstraint(annotationType));
        } else {
            stack.push(new AnnotationConstraint(annotationType, stack.pop()));
        }
    }
}
