package trie;

import trie.transitions.TransitionMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Node of the automaton. States live in an arena owned by the builder (later by the {@link Trie});
 * {@code id} is the arena slot, and the parent, failure and child links are arena ids, so the
 * root's fallback to itself is just {@code id == ROOT}.
 */
public final class State {

    public static final int ROOT = 0;
    public static final int NO_STATE = TransitionMap.NO_TRANSITION;

    private final int id;
    private final int depth;
    private final int parent;
    private final TransitionMap success;

    private int failure = NO_STATE;
    private int bfsIndex = -1;

    // null until the first keyword lands here
    private List<Keyword> emits;

    State(int id, int depth, int parent, TransitionMap success) {
        this.id = id;
        this.depth = depth;
        this.parent = parent;
        this.success = success;
    }

    public int id() { return id; }

    public int depth() { return depth; }

    public int parent() { return parent; }

    public int failure() { return failure; }

    // Dense breadth-first position; -1 until the automaton is built.
    public int bfsIndex() { return bfsIndex; }

    public boolean isRoot() { return id == ROOT; }

    // Goto function with the root's implicit self-loop for unmatched characters.
    public int nextState(char c) {
        return nextState(c, false);
    }

    public int nextStateIgnoreRoot(char c) {
        return nextState(c, true);
    }

    private int nextState(char c, boolean ignoreRoot) {
        int next = success.get(c);
        if (next == NO_STATE && !ignoreRoot && isRoot()) {
            return ROOT;
        }
        return next;
    }

    public int transitionCount() {
        return success.size();
    }

    public char[] transitions() {
        return success.transitions();
    }

    public List<Keyword> emits() {
        return emits == null ? Collections.emptyList() : Collections.unmodifiableList(emits);
    }

    public boolean hasEmits() {
        return emits != null && !emits.isEmpty();
    }

    @Override
    public String toString() {
        return "State{id=" + id + ", depth=" + depth + ", failure=" + failure + ", emits=" + emits() + "}";
    }

    // ---- mutation, only reachable while the automaton is being built ----

    TransitionMap success() {
        return success;
    }

    void addEmit(Keyword keyword) {
        if (emits == null) {
            emits = new ArrayList<>(1);
        }
        emits.add(keyword);
    }

    void addEmits(Collection<Keyword> keywords) {
        if (keywords.isEmpty()) {
            return;
        }
        if (emits == null) {
            emits = new ArrayList<>(keywords.size());
        }
        emits.addAll(keywords);
    }

    void clearEmits() {
        emits = null;
    }

    void setFailure(int failure) {
        this.failure = failure;
    }

    void setBfsIndex(int bfsIndex) {
        this.bfsIndex = bfsIndex;
    }

    void freeze() {
        success.freeze();
        if (emits != null) {
            emits = List.copyOf(emits);
        }
    }
}
