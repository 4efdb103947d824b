package work.lcod.assertkit.constraints;

import java.lang.annotation.Annotation;
import work.lcod.assertkit.runtime.TestExecutionContext;

public class AnnotationExistsConstraint extends AbstractConstraint {
    private final Class<? extends Annotation> annotationType;

    public AnnotationExistsConstraint(Class<?> annotationType) {
        super(annotationType);
        this.annotationType = AnnotationSupport.requireAnnotationType(annotationType);
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        return new ConstraintResult(this, actual, AnnotationSupport.elementOf(actual).isAnnotationPresent(annotationType));
    }

    @Override
    protected String describe() {
        return "type with annotation " + format(annotationType);
    }
}
