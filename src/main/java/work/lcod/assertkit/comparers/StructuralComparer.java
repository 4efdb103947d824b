package work.lcod.assertkit.comparers;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Comparator;

/**
 * Delegates to the values' own structural equality: {@link StructurallyEquatable} implementations and
 * Jackson {@link JsonNode} trees. Both directions are tried and either one agreeing is enough, since one
 * side may know about the other's type while the reverse is not true.
 */
final class StructuralComparer implements ChainComparer {
    private final DeepEqualityComparer comparer;

    StructuralComparer(DeepEqualityComparer comparer) {
        this.comparer = comparer;
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (comparer.isCompareAsCollection() && state.isTopLevel()) {
            return ComparisonOutcome.ABSTAIN;
        }
        var nested = state.push(x, y);
        if (x instanceof StructurallyEquatable xs && y instanceof StructurallyEquatable ys) {
            StructurallyEquatable.ElementComparison comparison =
                (a, b) -> comparer.areEqual(a, b, tolerance, nested);
            boolean xResult = xs.structurallyEquals(y, comparison);
            boolean yResult = ys.structurallyEquals(x, comparison);
            return ComparisonOutcome.of(xResult || yResult);
        }
        if (x instanceof JsonNode xn && y instanceof JsonNode yn) {
            Comparator<JsonNode> leaves = (a, b) -> leafEquals(a, b, tolerance, nested) ? 0 : 1;
            return ComparisonOutcome.of(xn.equals(leaves, yn) || yn.equals(leaves, xn));
        }
        return ComparisonOutcome.ABSTAIN;
    }

    private boolean leafEquals(JsonNode a, JsonNode b, Tolerance tolerance, ComparisonState state) {
        if (a.isNumber() && b.isNumber()) {
            return comparer.areEqual(a.numberValue(), b.numberValue(), tolerance, state);
        }
        if (a.isTextual() && b.isTextual()) {
            return comparer.areEqual(a.textValue(), b.textValue(), tolerance, state);
        }
        return a.equals(b);
    }
}
