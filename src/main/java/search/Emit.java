package search;

import interval.Intervalable;

/**
 * One keyword occurrence: the closed interval it covers in the scanned text, the keyword as it
 * was registered, and its insertion index.
 */
public record Emit(int start, int end, String keyword, int index) implements Intervalable {

    public Emit {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid match span [" + start + ", " + end + "] for '" + keyword + "'");
        }
    }

    @Override
    public int getStart() { return start; }

    @Override
    public int getEnd() { return end; }

    @Override
    public String toString() {
        return start + ":" + end + "=" + keyword;
    }
}
