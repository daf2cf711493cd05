package interval;

public record Interval(int start, int end) implements Intervalable {

    public Interval {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid interval [" + start + ", " + end + "]");
        }
    }

    @Override
    public int getStart() { return start; }

    @Override
    public int getEnd() { return end; }

    @Override
    public String toString() {
        return start + ":" + end;
    }
}
