package trie.transitions;

import it.unimi.dsi.fastutil.chars.Char2IntOpenHashMap;

import java.util.Arrays;

/**
 * Adaptive edge storage.
 *
 *   - Up to two children are kept as (key, target) pairs directly in fields, no map allocated.
 *   - On the third distinct child the state is promoted to a {@link Char2IntOpenHashMap} and
 *     the inline pairs move into it once.
 *
 * Most trie states have one child or none, so this avoids a map per state.
 */
public final class CompactTransitionMap implements TransitionMap {

    private char keyA;
    private int targetA = NO_TRANSITION;

    private char keyB;
    private int targetB = NO_TRANSITION;

    private Char2IntOpenHashMap edgeMap;

    @Override
    public int get(char c) {
        if (edgeMap != null) {
            return edgeMap.get(c);
        }
        if (targetA != NO_TRANSITION && keyA == c) {
            return targetA;
        }
        if (targetB != NO_TRANSITION && keyB == c) {
            return targetB;
        }
        return NO_TRANSITION;
    }

    @Override
    public void put(char c, int target) {
        if (edgeMap != null) {
            edgeMap.put(c, target);
            return;
        }
        if (targetA == NO_TRANSITION || keyA == c) {
            keyA = c;
            targetA = target;
            return;
        }
        if (targetB == NO_TRANSITION || keyB == c) {
            keyB = c;
            targetB = target;
            return;
        }
        edgeMap = new Char2IntOpenHashMap(4);
        edgeMap.defaultReturnValue(NO_TRANSITION);
        edgeMap.put(keyA, targetA);
        edgeMap.put(keyB, targetB);
        edgeMap.put(c, target);
        targetA = NO_TRANSITION;
        targetB = NO_TRANSITION;
    }

    @Override
    public int size() {
        if (edgeMap != null) {
            return edgeMap.size();
        }
        return (targetA != NO_TRANSITION ? 1 : 0) + (targetB != NO_TRANSITION ? 1 : 0);
    }

    @Override
    public char[] transitions() {
        char[] keys;
        if (edgeMap != null) {
            keys = edgeMap.keySet().toCharArray();
        } else if (targetA != NO_TRANSITION && targetB != NO_TRANSITION) {
            keys = new char[] {keyA, keyB};
        } else if (targetA != NO_TRANSITION) {
            keys = new char[] {keyA};
        } else {
            keys = new char[0];
        }
        Arrays.sort(keys);
        return keys;
    }

    @Override
    public void freeze() {
        if (edgeMap != null) {
            edgeMap.trim();
        }
    }
}
