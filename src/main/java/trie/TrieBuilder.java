package trie;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import trie.transitions.TransitionMap;
import utilities.MatcherLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Insert-only phase of the automaton. Keywords are added to a plain trie; {@link #build()} then
 * assigns breadth-first indices, strips prefix keywords when substrings are disallowed, wires the
 * failure links and hands the states over to an immutable {@link Trie}. A builder builds once.
 *
 * <pre>{@code
 * TrieBuilder builder = new TrieBuilder(TrieConfiguration.builder().removeOverlaps().build());
 * builder.insertAll(List.of("he", "she", "hers", "his"));
 * Trie trie = builder.build();
 * List<Emit> emits = trie.parseText("ushers");
 * }</pre>
 */
public final class TrieBuilder {

    private final TrieConfiguration config;
    private final List<State> states = new ArrayList<>();
    private int numKeywords;
    private boolean built;

    public TrieBuilder() {
        this(TrieConfiguration.defaults());
    }

    public TrieBuilder(TrieConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
        states.add(new State(State.ROOT, 0, State.NO_STATE, newTransitionMap()));
    }

    public TrieConfiguration configuration() {
        return config;
    }

    /**
     * Registers a keyword.
     *
     * @return true when the keyword was added; false for the empty keyword and for a keyword
     *         already registered (after case folding, if enabled)
     * @throws IllegalArgumentException if the transition strategy cannot store one of its characters
     * @throws IllegalStateException    if the automaton has already been built
     */
    public boolean insert(String keyword) {
        Objects.requireNonNull(keyword, "keyword");
        ensureNotBuilt();
        if (keyword.isEmpty()) {
            return false;
        }
        String path = config.caseInsensitive() ? Trie.fold(keyword) : keyword;
        checkAlphabet(path);

        State current = root();
        for (int i = 0; i < path.length(); i++) {
            current = addState(current, path.charAt(i));
        }
        if (current.hasEmits()) {
            MatcherLogger.debug("Rejected duplicate keyword '" + keyword + "'");
            return false;
        }
        current.addEmit(new Keyword(keyword, numKeywords++));
        return true;
    }

    // Returns how many of the keywords were accepted.
    public int insertAll(Iterable<String> keywords) {
        Objects.requireNonNull(keywords, "keywords");
        int accepted = 0;
        for (String keyword : keywords) {
            if (insert(keyword)) {
                accepted++;
            }
        }
        return accepted;
    }

    public int numKeywords() {
        return numKeywords;
    }

    public int numStates() {
        return states.size();
    }

    /**
     * Finishes the automaton. The builder cannot be used afterwards.
     *
     * @throws IllegalStateException if called twice, or if the trie breaks the single-keyword
     *                               invariant of a substring-free automaton
     */
    public Trie build() {
        ensureNotBuilt();
        built = true;
        long startNanos = System.nanoTime();

        State[] arena = states.toArray(new State[0]);
        int[] bfsOrder = assignIndices(arena);
        if (!config.allowSubstrings()) {
            removePrefixes(arena, bfsOrder);
        }
        constructFailureStates(arena);
        for (State state : arena) {
            state.freeze();
        }

        List<State> inBfsOrder = new ArrayList<>();
        List<State> finalInBfsOrder = new ArrayList<>();
        // failure construction may clear emits, so final states are collected last
        if (config.storeStatesInBfsOrder()) {
            for (int id : bfsOrder) {
                inBfsOrder.add(arena[id]);
                if (arena[id].hasEmits()) {
                    finalInBfsOrder.add(arena[id]);
                }
            }
        }

        MatcherLogger.debug(String.format(Locale.ROOT,
                "Built automaton: %d keywords, %d states in %.3f ms",
                numKeywords, arena.length, (System.nanoTime() - startNanos) / 1e6));
        states.clear();
        return new Trie(config, arena, numKeywords, inBfsOrder, finalInBfsOrder);
    }

    private State root() {
        return states.get(State.ROOT);
    }

    private State addState(State from, char c) {
        int next = from.nextStateIgnoreRoot(c);
        if (next != State.NO_STATE) {
            return states.get(next);
        }
        State child = new State(states.size(), from.depth() + 1, from.id(), newTransitionMap());
        states.add(child);
        from.success().put(c, child.id());
        return child;
    }

    private TransitionMap newTransitionMap() {
        return config.transitionStrategy().newMap();
    }

    // Fails before any state is created so a rejected keyword leaves no dangling path.
    private void checkAlphabet(String path) {
        TransitionMap probe = root().success();
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (!probe.supports(c)) {
                throw new IllegalArgumentException(String.format(Locale.ROOT,
                        "keyword contains U+%04X which the %s transition strategy cannot store",
                        (int) c, config.transitionStrategy()));
            }
        }
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException("automaton already built; start a new TrieBuilder to add keywords");
        }
    }

    // Breadth-first numbering from the root. Returns the visiting order as arena ids.
    private static int[] assignIndices(State[] arena) {
        int[] order = new int[arena.length];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(State.ROOT);
        int i = 0;
        while (!queue.isEmpty()) {
            State current = arena[queue.dequeueInt()];
            current.setBfsIndex(i);
            order[i++] = current.id();
            for (char c : current.transitions()) {
                queue.enqueue(current.nextStateIgnoreRoot(c));
            }
        }
        return order;
    }

    // A final state with outgoing edges spells a prefix of a longer keyword.
    private static void removePrefixes(State[] arena, int[] bfsOrder) {
        for (int id : bfsOrder) {
            State state = arena[id];
            int emitCount = state.emits().size();
            if (emitCount > 1) {
                throw new IllegalStateException("substring-free state " + id + " carries " + emitCount + " keywords");
            }
            if (emitCount == 1 && state.transitionCount() > 0) {
                state.clearEmits();
            }
        }
    }

    private void constructFailureStates(State[] arena) {
        State root = arena[State.ROOT];
        root.setFailure(State.ROOT);

        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        for (char c : root.transitions()) {
            State depthOne = arena[root.nextStateIgnoreRoot(c)];
            depthOne.setFailure(State.ROOT);
            queue.enqueue(depthOne.id());
        }

        while (!queue.isEmpty()) {
            State current = arena[queue.dequeueInt()];
            for (char c : current.transitions()) {
                State target = arena[current.nextStateIgnoreRoot(c)];
                queue.enqueue(target.id());

                State trace = arena[current.failure()];
                while (true) {
                    int next = trace.nextState(c);
                    while (next == State.NO_STATE) {
                        trace = arena[trace.failure()];
                        next = trace.nextState(c);
                    }
                    State candidate = arena[next];

                    // Without substrings a keyword reached through a failure link is a suffix of
                    // a longer one: make it non-final and keep looking further up the chain.
                    if (!config.allowSubstrings() && candidate.hasEmits()) {
                        candidate.clearEmits();
                        trace = arena[trace.failure()];
                        continue;
                    }

                    target.setFailure(candidate.id());
                    target.addEmits(candidate.emits());
                    break;
                }
            }
        }
    }
}
