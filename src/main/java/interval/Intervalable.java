package interval;

/**
 * Closed range [start, end] of text positions.
 *
 * Natural order compares the span only, so it is not consistent with {@code equals} for
 * implementations that carry more state (an {@code Emit} also compares keyword and index). Sorted
 * sets and maps keyed by natural order would merge distinct values on the same span.
 */
public interface Intervalable extends Comparable<Intervalable> {

    int getStart();

    int getEnd();

    default int size() {
        return getEnd() - getStart() + 1;
    }

    default boolean overlapsWith(Intervalable other) {
        return getStart() <= other.getEnd() && getEnd() >= other.getStart();
    }

    default boolean overlapsWith(int point) {
        return getStart() <= point && point <= getEnd();
    }

    // Same span, whatever else the implementations carry.
    default boolean sameSpan(Intervalable other) {
        return getStart() == other.getStart() && getEnd() == other.getEnd();
    }

    @Override
    default int compareTo(Intervalable other) {
        int c = Integer.compare(getStart(), other.getStart());
        return c != 0 ? c : Integer.compare(getEnd(), other.getEnd());
    }
}
