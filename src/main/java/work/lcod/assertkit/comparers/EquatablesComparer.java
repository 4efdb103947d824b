package work.lcod.assertkit.comparers;

/**
 * Uses {@code equals} when the actual value's class overrides it.
 */
final class EquatablesComparer implements ChainComparer {
    private static final ClassValue<Boolean> OVERRIDES_EQUALS = new ClassValue<>() {
        @Override
        protected Boolean computeValue(Class<?> type) {
            try {
                return type.getMethod("equals", Object.class).getDeclaringClass() != Object.class;
            } catch (NoSuchMethodException ex) {
                return false;
            }
        }
    };

    static boolean overridesEquals(Class<?> type) {
        return OVERRIDES_EQUALS.get(type);
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (!overridesEquals(x.getClass())) {
            return ComparisonOutcome.ABSTAIN;
        }
        return ComparisonOutcome.of(x.equals(y));
    }
}
