package trie.transitions;

/**
 * Goto function of a single automaton state: maps a character to the arena id of the child state.
 * Implementations only differ in how they store the edges; enumeration is always in ascending
 * character order.
 */
public interface TransitionMap {

    int NO_TRANSITION = -1;

    // Child id for c, or NO_TRANSITION.
    int get(char c);

    void put(char c, int target);

    // Whether put(c, ...) can ever succeed for this kind of map.
    default boolean supports(char c) {
        return true;
    }

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    // Outgoing characters, ascending.
    char[] transitions();

    // Release slack once the automaton stops growing.
    void freeze();
}
