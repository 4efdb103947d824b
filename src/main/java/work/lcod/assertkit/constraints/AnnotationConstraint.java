package work.lcod.assertkit.constraints;

import java.lang.annotation.Annotation;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Applies the base constraint to an annotation found on the actual element.
 */
public class AnnotationConstraint extends PrefixConstraint {
    private final Class<? extends Annotation> annotationType;

    /**
     * @throws IllegalArgumentException when {@code annotationType} is not an annotation type
     */
    public AnnotationConstraint(Class<?> annotationType, ResolvableConstraint baseConstraint) {
        super(baseConstraint, "annotation " + AnnotationSupport.requireAnnotationType(annotationType).getName(),
            annotationType, baseConstraint);
        this.annotationType = annotationType.asSubclass(Annotation.class);
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        var annotation = AnnotationSupport.elementOf(actual).getAnnotation(annotationType);
        if (annotation == null) {
            throw new IllegalArgumentException("Annotation " + annotationType.getName() + " was not found on " + actual);
        }
        var baseResult = baseConstraint.applyTo(annotation, context);
        return new ConstraintResult(this, baseResult.actualValue(), baseResult.isSuccess());
    }
}
