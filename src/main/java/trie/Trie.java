package trie;

import interval.IntervalTree;
import search.Emit;
import search.Token;
import search.Tokenizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Finished Aho-Corasick automaton produced by {@link TrieBuilder#build()}. Nothing mutates it after
 * construction, so any number of threads may query one instance concurrently.
 *
 * A query walks the text once, following goto edges and falling back along failure links, and
 * reports every keyword ending at each position. The whole-word filter and the overlap reduction
 * of the {@link TrieConfiguration} are applied to that raw list afterwards.
 */
public final class Trie {

    private static final Comparator<Emit> BY_START = Comparator.comparingInt(Emit::getStart);

    private final TrieConfiguration config;
    private final State[] states;
    private final int numKeywords;
    private final List<State> statesInBfsOrder;
    private final List<State> finalStatesInBfsOrder;

    Trie(TrieConfiguration config,
         State[] states,
         int numKeywords,
         List<State> statesInBfsOrder,
         List<State> finalStatesInBfsOrder) {
        this.config = config;
        this.states = states;
        this.numKeywords = numKeywords;
        this.statesInBfsOrder = Collections.unmodifiableList(statesInBfsOrder);
        this.finalStatesInBfsOrder = Collections.unmodifiableList(finalStatesInBfsOrder);
    }

    public static TrieBuilder builder() {
        return new TrieBuilder();
    }

    public static TrieBuilder builder(TrieConfiguration config) {
        return new TrieBuilder(config);
    }

    public TrieConfiguration configuration() {
        return config;
    }

    public int numKeywords() {
        return numKeywords;
    }

    public int numStates() {
        return states.length;
    }

    public State root() {
        return states[State.ROOT];
    }

    public State state(int id) {
        return states[id];
    }

    // Empty unless the configuration asked for the states to be kept in BFS order.
    public List<State> statesInBfsOrder() {
        return statesInBfsOrder;
    }

    public List<State> finalStatesInBfsOrder() {
        return finalStatesInBfsOrder;
    }

    /**
     * All keyword occurrences in {@code text} that survive the configured filters, ascending by
     * start position. Matches sharing a start keep ascending end order.
     */
    public List<Emit> parseText(CharSequence text) {
        Objects.requireNonNull(text, "text");
        List<Emit> collected = new ArrayList<>();
        int current = State.ROOT;
        for (int pos = 0; pos < text.length(); pos++) {
            current = nextState(current, charAt(text, pos));
            storeEmits(pos, states[current], collected);
        }

        if (config.onlyWholeWords()) {
            removePartialMatches(text, collected);
        }
        collected.sort(BY_START);
        if (!config.allowOverlaps() && collected.size() > 1) {
            collected = new IntervalTree<>(collected).removeOverlaps(collected);
        }
        return collected;
    }

    // Fragment and match tokens covering the whole text.
    public List<Token> tokenize(CharSequence text) {
        return Tokenizer.tokenize(text, parseText(text));
    }

    /**
     * Whether {@link #parseText} would report anything. Stops at the first keyword when no
     * whole-word filter applies; overlap removal never empties a non-empty result.
     */
    public boolean containsMatch(CharSequence text) {
        Objects.requireNonNull(text, "text");
        if (config.onlyWholeWords()) {
            return !parseText(text).isEmpty();
        }
        int current = State.ROOT;
        for (int pos = 0; pos < text.length(); pos++) {
            current = nextState(current, charAt(text, pos));
            if (states[current].hasEmits()) {
                return true;
            }
        }
        return false;
    }

    // First match of parseText(text), or null.
    public Emit firstMatch(CharSequence text) {
        List<Emit> emits = parseText(text);
        return emits.isEmpty() ? null : emits.get(0);
    }

    private char charAt(CharSequence text, int pos) {
        char c = text.charAt(pos);
        return config.caseInsensitive() ? Character.toLowerCase(c) : c;
    }

    // Goto with failure fallback; the root accepts every character, so this terminates.
    private int nextState(int current, char c) {
        int next = states[current].nextState(c);
        while (next == State.NO_STATE) {
            current = states[current].failure();
            next = states[current].nextState(c);
        }
        return next;
    }

    private static void storeEmits(int pos, State state, List<Emit> out) {
        for (Keyword keyword : state.emits()) {
            out.add(new Emit(pos - keyword.length() + 1, pos, keyword.text(), keyword.index()));
        }
    }

    // Drops matches glued to a letter on either side.
    private static void removePartialMatches(CharSequence text, List<Emit> emits) {
        int size = text.length();
        emits.removeIf(e ->
                (e.getStart() > 0 && Character.isLetter(text.charAt(e.getStart() - 1)))
                        || (e.getEnd() + 1 < size && Character.isLetter(text.charAt(e.getEnd() + 1))));
    }

    static String fold(String keyword) {
        char[] chars = keyword.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = Character.toLowerCase(chars[i]);
        }
        return new String(chars);
    }
}
