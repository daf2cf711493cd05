package PMIndex;

import search.Emit;
import search.Token;
import trie.Trie;
import trie.TrieBuilder;
import trie.TrieConfiguration;
import utilities.MatcherLogger;

import java.util.List;
import java.util.Locale;

/**
 * Insert-then-query facade over {@link TrieBuilder} and {@link Trie}. The automaton is built on the
 * first query, exactly once even when several threads query at the same time; inserting after
 * that point is an error.
 */
public class AhoCorasickIndex implements IMultiPatternIndex {

    private final TrieBuilder builder;
    private volatile Trie trie;

    public AhoCorasickIndex() {
        this(TrieConfiguration.defaults());
    }

    public AhoCorasickIndex(TrieConfiguration configuration) {
        this.builder = new TrieBuilder(configuration);
    }

    /**
     * @throws IllegalStateException once a query has built the automaton
     */
    @Override
    public synchronized boolean insert(String keyword) {
        if (trie != null) {
            throw new IllegalStateException("keywords cannot be added after the first query");
        }
        return builder.insert(keyword);
    }

    @Override
    public List<Emit> report(CharSequence text) {
        return trie().parseText(text);
    }

    public List<Token> tokenize(CharSequence text) {
        return trie().tokenize(text);
    }

    public boolean containsMatch(CharSequence text) {
        return trie().containsMatch(text);
    }

    @Override
    public int numKeywords() {
        Trie built = trie;
        if (built != null) {
            return built.numKeywords();
        }
        synchronized (this) {
            return trie != null ? trie.numKeywords() : builder.numKeywords();
        }
    }

    public boolean isBuilt() {
        return trie != null;
    }

    // Builds the automaton if no query has done so yet.
    public Trie trie() {
        Trie built = trie;
        if (built == null) {
            synchronized (this) {
                built = trie;
                if (built == null) {
                    long startNanos = System.nanoTime();
                    built = builder.build();
                    trie = built;
                    MatcherLogger.info(String.format(Locale.ROOT,
                            "Aho-Corasick index ready: %d keywords, %d states, built in %.3f ms",
                            built.numKeywords(), built.numStates(), (System.nanoTime() - startNanos) / 1e6));
                }
            }
        }
        return built;
    }
}
