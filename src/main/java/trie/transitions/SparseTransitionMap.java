package trie.transitions;

import it.unimi.dsi.fastutil.chars.Char2IntRBTreeMap;

// Ordered map keyed by char; keys come back sorted for free.
public final class SparseTransitionMap implements TransitionMap {

    private final Char2IntRBTreeMap edges = new Char2IntRBTreeMap();

    public SparseTransitionMap() {
        edges.defaultReturnValue(NO_TRANSITION);
    }

    @Override
    public int get(char c) {
        return edges.get(c);
    }

    @Override
    public void put(char c, int target) {
        edges.put(c, target);
    }

    @Override
    public int size() {
        return edges.size();
    }

    @Override
    public char[] transitions() {
        return edges.keySet().toCharArray();
    }

    @Override
    public void freeze() {
        // tree nodes are allocated per entry, nothing to trim
    }
}
