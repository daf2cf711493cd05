package trie.transitions;

import java.util.Arrays;

/**
 * Fixed-size table for byte alphabets. The table is allocated on the first edge so leaves, which
 * are most of the states, stay empty.
 */
public final class DenseByteTransitionMap implements TransitionMap {

    public static final int ALPHABET_SIZE = 256;

    private int[] targets;
    private int size;

    @Override
    public int get(char c) {
        if (targets == null || c >= ALPHABET_SIZE) {
            return NO_TRANSITION;
        }
        return targets[c];
    }

    @Override
    public boolean supports(char c) {
        return c < ALPHABET_SIZE;
    }

    @Override
    public void put(char c, int target) {
        if (!supports(c)) {
            throw new IllegalArgumentException(String.format(
                    "character U+%04X is outside the byte alphabet of the dense transition map", (int) c));
        }
        if (targets == null) {
            targets = new int[ALPHABET_SIZE];
            Arrays.fill(targets, NO_TRANSITION);
        }
        if (targets[c] == NO_TRANSITION) {
            size++;
        }
        targets[c] = target;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public char[] transitions() {
        char[] out = new char[size];
        if (targets == null) {
            return out;
        }
        int n = 0;
        for (int c = 0; c < ALPHABET_SIZE; c++) {
            if (targets[c] != NO_TRANSITION) {
                out[n++] = (char) c;
            }
        }
        return out;
    }

    @Override
    public void freeze() {
        // the table is already exact
    }
}
