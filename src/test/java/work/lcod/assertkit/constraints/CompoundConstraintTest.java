package work.lcod.assertkit.constraints;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.assertkit.config.AssertSettings;
import work.lcod.assertkit.runtime.TestExecutionContext;
import work.lcod.assertkit.shared.MessageFormatting;
import work.lcod.assertkit.support.AssertTestSupport.Person;
import work.lcod.assertkit.support.AssertTestSupport.Point;

class CompoundConstraintTest {
    private final TestExecutionContext context = new TestExecutionContext(AssertSettings.defaults());

    @Test
    void andSkipsRightOperandOnceLeftFails() {
        var left = new CountingConstraint(false);
        var right = new CountingConstraint(true);
        var result = (BinaryConstraintResult) new AndConstraint(left, right).applyTo("x", context);

        assertFalse(result.isSuccess());
        assertEquals(1, left.calls);
        assertEquals(0, right.calls);
        assertNull(result.rightResult());
        assertSame(result.leftResult(), result.failureDetail());
    }

    @Test
    void orSkipsRightOperandOnceLeftSucceeds() {
        var left = new CountingConstraint(true);
        var right = new CountingConstraint(false);

        assertTrue(new OrConstraint(left, right).applyTo("x", context).isSuccess());
        assertEquals(0, right.calls);
    }

    @Test
    void andReportsTheBranchThatFailed() {
        var range = new AndConstraint(new GreaterThanConstraint(10), new LessThanConstraint(20));
        var result = (BinaryConstraintResult) range.applyTo(25, context);

        assertFalse(result.isSuccess());
        assertTrue(result.leftResult().isSuccess());
        assertSame(result.rightResult(), result.failureDetail());
        assertEquals("greater than 10 and less than 20", range.getDescription());
    }

    @Test
    void failedOrReportsLeftBranchDetail() {
        var either = new OrConstraint(new EqualConstraint(List.of(1, 2)), new EqualConstraint(List.of(3)));
        var result = (BinaryConstraintResult) either.applyTo(List.of(1, 5), context);

        assertFalse(result.isSuccess());
        assertSame(result.leftResult(), result.failureDetail());
        var writer = new TextMessageWriter(MessageFormatting.defaultFormatter(), null);
        result.writeMessageTo(writer);
        assertTrue(writer.toString().contains("Values differ at index [1]"), writer.toString());
    }

    @Test
    void notInvertsAndDescribes() {
        var notNull = new NotConstraint(new NullConstraint());
        assertTrue(notNull.applyTo("x", context).isSuccess());
        assertFalse(notNull.applyTo(null, context).isSuccess());
        assertEquals("not null", notNull.getDescription());
    }

    @Test
    void itemConstraintsWalkCollectionsAndArrays() {
        var positive = new GreaterThanConstraint(0);
        assertTrue(new AllItemsConstraint(positive).applyTo(List.of(1, 2, 3), context).isSuccess());
        assertFalse(new AllItemsConstraint(positive).applyTo(new int[] {1, -2}, context).isSuccess());
        assertTrue(new SomeItemsConstraint(new EqualConstraint("b")).applyTo(List.of("a", "b"), context).isSuccess());
        assertTrue(new NoItemConstraint(new NullConstraint()).applyTo(List.of("a"), context).isSuccess());
        assertTrue(new AllItemsConstraint(positive).applyTo(List.of(), context).isSuccess());
        assertThrows(IllegalArgumentException.class, () -> new AllItemsConstraint(positive).applyTo("abc", context));
        assertEquals("all items greater than 0", new AllItemsConstraint(positive).getDescription());
    }

    @Test
    void propertyConstraintReadsRecordsAndBeans() {
        assertTrue(new PropertyConstraint("age", new GreaterThanConstraint(18))
            .applyTo(new Person("Ada", 36), context).isSuccess());
        assertTrue(new PropertyConstraint("x", new EqualConstraint(3)).applyTo(new Point(3, 4), context).isSuccess());
        assertThrows(IllegalArgumentException.class,
            () -> new PropertyConstraint("email", new NullConstraint()).applyTo(new Person("Ada", 36), context));
        assertEquals("property age greater than 18",
            new PropertyConstraint("age", new GreaterThanConstraint(18)).getDescription());
    }

    @Test
    void propertyExistsLooksAtTheType() {
        assertTrue(new PropertyExistsConstraint("name").applyTo(new Person("Ada", 36), context).isSuccess());
        assertTrue(new PropertyExistsConstraint("y").applyTo(Point.class, context).isSuccess());
        assertFalse(new PropertyExistsConstraint("email").applyTo(new Person("Ada", 36), context).isSuccess());
    }

    @Test
    void annotationConstraintsRequireAnAnnotationType() {
        assertThrows(IllegalArgumentException.class, () -> new AnnotationConstraint(String.class, new NullConstraint()));
        assertThrows(IllegalArgumentException.class, () -> new AnnotationExistsConstraint(List.class));
    }

    @Test
    void annotationConstraintsInspectAnnotatedElements() {
        assertTrue(new AnnotationExistsConstraint(Category.class).applyTo(Tagged.class, context).isSuccess());
        assertTrue(new AnnotationExistsConstraint(Category.class).applyTo(new Tagged(), context).isSuccess());
        assertFalse(new AnnotationExistsConstraint(Category.class).applyTo("plain", context).isSuccess());
        assertTrue(new AnnotationConstraint(Category.class, new PropertyConstraint("value", new EqualConstraint("fast")))
            .applyTo(Tagged.class, context).isSuccess());
    }

    @Test
    void simpleLeavesBehaveAsNamed() {
        var shared = new Object();
        assertTrue(new SameAsConstraint(shared).applyTo(shared, context).isSuccess());
        assertFalse(new SameAsConstraint(new Person("A", 1)).applyTo(new Person("A", 1), context).isSuccess());
        assertTrue(new InstanceOfConstraint(CharSequence.class).applyTo("s", context).isSuccess());
        assertTrue(new TrueConstraint().applyTo(true, context).isSuccess());
        assertFalse(new FalseConstraint().applyTo(null, context).isSuccess());
        assertTrue(new EmptyConstraint().applyTo(new int[0], context).isSuccess());
        assertFalse(new EmptyConstraint().applyTo("x", context).isSuccess());
        assertThrows(IllegalArgumentException.class, () -> new EmptyConstraint().applyTo(42, context));
    }

    @Test
    void collectionMembershipAndEquivalence() {
        assertTrue(new CollectionContainsConstraint(2L).applyTo(List.of(1, 2, 3), context).isSuccess());
        assertTrue(new CollectionContainsConstraint("B").ignoreCase().applyTo(new String[] {"a", "b"}, context).isSuccess());
        assertTrue(new CollectionEquivalentConstraint(List.of(3, 1, 1)).applyTo(new int[] {1, 3, 1}, context).isSuccess());
        assertFalse(new CollectionEquivalentConstraint(List.of(3, 1, 1)).applyTo(List.of(1, 3, 3), context).isSuccess());
    }

    @Test
    void displayNameDropsTheSuffix() {
        assertEquals("GreaterThan", new GreaterThanConstraint(1).getDisplayName());
        assertEquals("<equal 5>", new EqualConstraint(5).toString());
    }

    @Retention(RetentionPolicy.RUNTIME)
    @interface Category {
        String value();
    }

    @Category("fast")
    static final class Tagged {
    }

    private static final class CountingConstraint extends AbstractConstraint {
        private final boolean outcome;
        private int calls;

        private CountingConstraint(boolean outcome) {
            this.outcome = outcome;
        }

        @Override
        public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
            calls++;
            return new ConstraintResult(this, actual, outcome);
        }

        @Override
        protected String describe() {
            return outcome ? "anything" : "nothing";
        }
    }
}
