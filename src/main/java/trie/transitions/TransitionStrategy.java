package trie.transitions;

import java.util.function.Supplier;

// How states store their outgoing edges. Picked once per automaton.
public enum TransitionStrategy {

    /** Ordered red-black tree; works for any alphabet. */
    SPARSE(SparseTransitionMap::new),

    /** 256-slot array indexed by byte value; characters above 0xFF cannot be inserted. */
    DENSE_BYTE(DenseByteTransitionMap::new),

    /** Two inline edges, promoted to a hash map on the third. */
    COMPACT(CompactTransitionMap::new);

    private final Supplier<TransitionMap> factory;

    TransitionStrategy(Supplier<TransitionMap> factory) {
        this.factory = factory;
    }

    public TransitionMap newMap() {
        return factory.get();
    }
}
