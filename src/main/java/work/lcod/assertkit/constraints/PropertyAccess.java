package work.lcod.assertkit.constraints;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Optional;

/**
 * Resolves a named property through a record component, a bean getter, a no-argument accessor or a public field.
 */
final class PropertyAccess {
    private final String name;
    private final Method accessor;
    private final Field field;

    private PropertyAccess(String name, Method accessor, Field field) {
        this.name = name;
        this.accessor = accessor;
        this.field = field;
    }

    static Optional<PropertyAccess> find(Class<?> type, String name) {
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                if (component.getName().equals(name)) {
                    return Optional.of(new PropertyAccess(name, component.getAccessor(), null));
                }
            }
        }
        var capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        for (String candidate : new String[] {"get" + capitalized, "is" + capitalized, name}) {
            var method = publicMethod(type, candidate);
            if (method.isPresent()) {
                return Optional.of(new PropertyAccess(name, method.get(), null));
            }
        }
        try {
            var field = type.getField(name);
            if (!Modifier.isStatic(field.getModifiers())) {
                return Optional.of(new PropertyAccess(name, null, field));
            }
        } catch (NoSuchFieldException ex) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    private static Optional<Method> publicMethod(Class<?> type, String methodName) {
        try {
            var method = type.getMethod(methodName);
            if (Modifier.isStatic(method.getModifiers()) || method.getReturnType() == void.class
                || method.getDeclaringClass() == Object.class) {
                return Optional.empty();
            }
            return Optional.of(method);
        } catch (NoSuchMethodException ex) {
            return Optional.empty();
        }
    }

    Object read(Object target) {
        try {
            if (accessor != null) {
                accessor.setAccessible(true);
                return accessor.invoke(target);
            }
            return field.get(target);
        } catch (InvocationTargetException ex) {
            throw new IllegalStateException("Reading property " + name + " failed", ex.getCause());
        } catch (IllegalAccessException | RuntimeException ex) {
            throw new IllegalStateException("Property " + name + " is not readable on "
                + target.getClass().getName(), ex);
        }
    }
}
