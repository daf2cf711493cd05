package trie;

import trie.transitions.TransitionStrategy;

import java.util.Objects;

// Immutable matching policy for one automaton. Fixed before the first keyword is inserted.
public final class TrieConfiguration {

    private static final TrieConfiguration DEFAULTS = builder().build();

    private final boolean allowOverlaps;
    private final boolean onlyWholeWords;
    private final boolean caseInsensitive;
    private final boolean allowSubstrings;
    private final boolean storeStatesInBfsOrder;
    private final TransitionStrategy transitionStrategy;

    private TrieConfiguration(Builder builder) {
        this.allowOverlaps = builder.allowOverlaps;
        this.onlyWholeWords = builder.onlyWholeWords;
        this.caseInsensitive = builder.caseInsensitive;
        this.allowSubstrings = builder.allowSubstrings;
        this.storeStatesInBfsOrder = builder.storeStatesInBfsOrder;
        this.transitionStrategy = Objects.requireNonNull(builder.transitionStrategy, "transitionStrategy");
    }

    public static Builder builder() { return new Builder(); }

    // Overlaps and substrings allowed, case-sensitive, no whole-word filter.
    public static TrieConfiguration defaults() { return DEFAULTS; }

    public boolean allowOverlaps() { return allowOverlaps; }
    public boolean onlyWholeWords() { return onlyWholeWords; }
    public boolean caseInsensitive() { return caseInsensitive; }
    public boolean allowSubstrings() { return allowSubstrings; }
    public boolean storeStatesInBfsOrder() { return storeStatesInBfsOrder; }
    public TransitionStrategy transitionStrategy() { return transitionStrategy; }

    public Builder toBuilder() {
        return new Builder()
                .allowOverlaps(allowOverlaps)
                .onlyWholeWords(onlyWholeWords)
                .caseInsensitive(caseInsensitive)
                .allowSubstrings(allowSubstrings)
                .storeStatesInBfsOrder(storeStatesInBfsOrder)
                .transitionStrategy(transitionStrategy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrieConfiguration)) return false;
        TrieConfiguration that = (TrieConfiguration) o;
        return allowOverlaps == that.allowOverlaps
                && onlyWholeWords == that.onlyWholeWords
                && caseInsensitive == that.caseInsensitive
                && allowSubstrings == that.allowSubstrings
                && storeStatesInBfsOrder == that.storeStatesInBfsOrder
                && transitionStrategy == that.transitionStrategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(allowOverlaps, onlyWholeWords, caseInsensitive, allowSubstrings,
                storeStatesInBfsOrder, transitionStrategy);
    }

    @Override
    public String toString() {
        return "TrieConfiguration{allowOverlaps=" + allowOverlaps
                + ", onlyWholeWords=" + onlyWholeWords
                + ", caseInsensitive=" + caseInsensitive
                + ", allowSubstrings=" + allowSubstrings
                + ", storeStatesInBfsOrder=" + storeStatesInBfsOrder
                + ", transitionStrategy=" + transitionStrategy + '}';
    }

    public static final class Builder {
        private boolean allowOverlaps = true;
        private boolean onlyWholeWords;
        private boolean caseInsensitive;
        private boolean allowSubstrings = true;
        private boolean storeStatesInBfsOrder;
        private TransitionStrategy transitionStrategy = TransitionStrategy.SPARSE;

        private Builder() {
        }

        public Builder allowOverlaps(boolean allowOverlaps) {
            this.allowOverlaps = allowOverlaps;
            return this;
        }

        public Builder onlyWholeWords(boolean onlyWholeWords) {
            this.onlyWholeWords = onlyWholeWords;
            return this;
        }

        public Builder caseInsensitive(boolean caseInsensitive) {
            this.caseInsensitive = caseInsensitive;
            return this;
        }

        public Builder allowSubstrings(boolean allowSubstrings) {
            this.allowSubstrings = allowSubstrings;
            return this;
        }

        public Builder storeStatesInBfsOrder(boolean storeStatesInBfsOrder) {
            this.storeStatesInBfsOrder = storeStatesInBfsOrder;
            return this;
        }

        public Builder transitionStrategy(TransitionStrategy transitionStrategy) {
            this.transitionStrategy = (transitionStrategy == null) ? TransitionStrategy.SPARSE : transitionStrategy;
            return this;
        }

        // Shorthands for the common switches.

        public Builder caseInsensitive() { return caseInsensitive(true); }

        public Builder removeOverlaps() { return allowOverlaps(false); }

        public Builder onlyWholeWords() { return onlyWholeWords(true); }

        public Builder removeSubstrings() { return allowSubstrings(false); }

        public Builder storeStatesInBfsOrder() { return storeStatesInBfsOrder(true); }

        public TrieConfiguration build() {
            return new TrieConfiguration(this);
        }
    }
}
