package work.lcod.assertkit.constraints;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;

final class AnnotationSupport {
    private AnnotationSupport() {}

    static Class<? extends Annotation> requireAnnotationType(Class<?> type) {
        if (type == null || !type.isAnnotation()) {
            throw new IllegalArgumentException("Type " + (type == null ? "null" : type.getName())
                + " is not an annotation type");
        }
        return type.asSubclass(Annotation.class);
    }

    /**
     * Classes, methods, fields and other reflective elements are inspected directly; any other value through its class.
     */
    static AnnotatedElement elementOf(Object actual) {
        if (actual == null) {
            throw new IllegalArgumentException("Cannot look up annotations on null");
        }
        return actual instanceof AnnotatedElement element ? element : actual.getClass();
    }
}
