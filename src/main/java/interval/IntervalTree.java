package interval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static centered interval tree. Built once from a fixed set of intervals; every node keeps the
 * intervals that straddle its pivot and hands the rest to the left or right subtree.
 *
 * The pivot is the midpoint of the smallest start and the largest end of the node's intervals, so
 * the covered coordinate range halves on every level and the recursion depth stays logarithmic in
 * the text length rather than in the number of intervals.
 */
public final class IntervalTree<T extends Intervalable> {

    // Longest first; equal lengths prefer the interval that starts later.
    private static final Comparator<Intervalable> BY_SIZE_THEN_LATER_START =
            Comparator.comparingInt(Intervalable::size).reversed()
                    .thenComparing(Comparator.comparingInt(Intervalable::getStart).reversed());

    private final Node<T> root;
    private final int size;

    public IntervalTree(Collection<? extends T> intervals) {
        Objects.requireNonNull(intervals, "intervals");
        this.size = intervals.size();
        this.root = intervals.isEmpty() ? null : new Node<>(new ArrayList<T>(intervals));
    }

    public int size() {
        return size;
    }

    /** Every stored interval overlapping {@code interval}, except those with the very same span. */
    public List<T> findOverlaps(Intervalable interval) {
        Objects.requireNonNull(interval, "interval");
        if (root == null) {
            return Collections.emptyList();
        }
        List<T> overlaps = new ArrayList<>();
        root.findOverlaps(interval, overlaps);
        return overlaps;
    }

    /**
     * Greedy reduction to a non-overlapping subset: walk the intervals longest first and drop
     * everything that overlaps an interval still standing. Result is sorted by start.
     */
    public List<T> removeOverlaps(Collection<? extends T> intervals) {
        List<T> ordered = new ArrayList<>(intervals);
        ordered.sort(BY_SIZE_THEN_LATER_START);

        Set<T> removed = new HashSet<>();
        for (T current : ordered) {
            if (removed.contains(current)) {
                continue;
            }
            removed.addAll(findOverlaps(current));
        }

        List<T> result = new ArrayList<>(ordered.size() - Math.min(ordered.size(), removed.size()));
        for (T current : ordered) {
            if (!removed.contains(current)) {
                result.add(current);
            }
        }
        result.sort(Comparator.naturalOrder());
        return result;
    }

    private static final class Node<T extends Intervalable> {

        private final int point;
        private final Node<T> left;
        private final Node<T> right;
        private final List<T> intervals = new ArrayList<>();

        private Node(List<T> source) {
            this.point = median(source);
            List<T> toLeft = new ArrayList<>();
            List<T> toRight = new ArrayList<>();
            for (T interval : source) {
                if (interval.getEnd() < point) {
                    toLeft.add(interval);
                } else if (interval.getStart() > point) {
                    toRight.add(interval);
                } else {
                    intervals.add(interval);
                }
            }
            this.left = toLeft.isEmpty() ? null : new Node<>(toLeft);
            this.right = toRight.isEmpty() ? null : new Node<>(toRight);
        }

        private static int median(List<? extends Intervalable> source) {
            int start = Integer.MAX_VALUE;
            int end = Integer.MIN_VALUE;
            for (Intervalable interval : source) {
                start = Math.min(start, interval.getStart());
                end = Math.max(end, interval.getEnd());
            }
            // unsigned shift keeps the midpoint correct near Integer.MAX_VALUE
            return (start + end) >>> 1;
        }

        private void findOverlaps(Intervalable query, List<T> out) {
            if (point < query.getStart()) {
                if (right != null) {
                    right.findOverlaps(query, out);
                }
                // straddlers all start at or before point, so only their end matters
                for (T interval : intervals) {
                    if (interval.getEnd() >= query.getStart()) {
                        addUnlessSame(query, interval, out);
                    }
                }
            } else if (point > query.getEnd()) {
                if (left != null) {
                    left.findOverlaps(query, out);
                }
                for (T interval : intervals) {
                    if (interval.getStart() <= query.getEnd()) {
                        addUnlessSame(query, interval, out);
                    }
                }
            } else {
                for (T interval : intervals) {
                    addUnlessSame(query, interval, out);
                }
                if (left != null) {
                    left.findOverlaps(query, out);
                }
                if (right != null) {
                    right.findOverlaps(query, out);
                }
            }
        }

        private static <T extends Intervalable> void addUnlessSame(Intervalable query, T candidate, List<T> out) {
            if (!candidate.sameSpan(query)) {
                out.add(candidate);
            }
        }
    }
}
