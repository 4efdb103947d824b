package work.lcod.assertkit.constraints.operators;

/**
 * Prefix operator over the items of a collection. It binds loosely on its right so that a whole
 * and/or chain that follows applies to each item.
 */
public abstract class CollectionOperator extends PrefixOperator {
    protected CollectionOperator() {
        super(1, 10);
    }
}
