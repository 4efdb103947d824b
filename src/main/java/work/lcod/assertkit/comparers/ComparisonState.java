package work.lcod.assertkit.comparers;

/**
 * Identity pairs visited on the current path of a recursive comparison.
 * Pushing never mutates the receiver, so sibling branches share their common prefix.
 */
public final class ComparisonState {
    private static final ComparisonState TOP_LEVEL = new ComparisonState(true, null);

    private final boolean topLevel;
    private final Node head;

    private ComparisonState(boolean topLevel, Node head) {
        this.topLevel = topLevel;
        this.head = head;
    }

    public static ComparisonState topLevel() {
        return TOP_LEVEL;
    }

    public boolean isTopLevel() {
        return topLevel;
    }

    public ComparisonState push(Object x, Object y) {
        return new ComparisonState(false, new Node(x, y, head));
    }

    public boolean didCompare(Object x, Object y) {
        for (var node = head; node != null; node = node.next) {
            if (node.x == x && node.y == y) {
                return true;
            }
        }
        return false;
    }

    public int depth() {
        int depth = 0;
        for (var node = head; node != null; node = node.next) {
            depth++;
        }
        return depth;
    }

    private static final class Node {
        private final Object x;
        private final Object y;
        private final Node next;

        private Node(Object x, Object y, Node next) {
            this.x = x;
            this.y = y;
            this.next = next;
        }
    }
}
