package utilities;

import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;
import trie.Trie;

import java.util.Locale;

// JOL footprint reports for a built automaton.
public class MemUtil {

    private static final double MIB = 1024.0 * 1024.0;

    // Detailed report, optionally with the class-by-class histogram.
    public String jolMemoryReport(boolean includeFootprintTable, Trie trie) {
        StringBuilder sb = new StringBuilder(4_096);

        // VM details (alignment, header sizes, compressed oops)
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout total = GraphLayout.parseInstance(trie);
        sb.append("\n=== Trie total (trie as root) ===\n");
        sb.append(String.format(Locale.ROOT, "Keywords          : %d%n", trie.numKeywords()));
        sb.append(String.format(Locale.ROOT, "States            : %d%n", trie.numStates()));
        sb.append("Total bytes       : ").append(total.totalSize()).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", total.totalSize() / MIB))
                .append(" MiB\n");

        if (includeFootprintTable) {
            sb.append("\n--- Class footprint (Trie root) ---\n");
            sb.append(total.toFootprint()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Three lines: Total, States (state objects with their transitions and keyword lists) and
     * Other (arena array, breadth-first lists, configuration).
     */
    public String jolMemoryReportPartitioned(Trie trie) {
        Object[] states = new Object[trie.numStates()];
        for (int id = 0; id < states.length; id++) {
            states[id] = trie.state(id);
        }
        long totalBytes = GraphLayout.parseInstance(trie).totalSize();
        long statesBytes = GraphLayout.parseInstance(states).totalSize();
        long otherBytes = Math.max(0L, totalBytes - statesBytes);

        Locale l = Locale.ROOT;
        String totalLine = String.format(l, "Total: %d B (%.3f MiB)", totalBytes, totalBytes / MIB);
        String statesLine = String.format(l, "States: %d B (%.3f MiB)", statesBytes, statesBytes / MIB);
        String otherLine = String.format(l, "Other: %d B (%.3f MiB)", otherBytes, otherBytes / MIB);
        return totalLine + "\n" + statesLine + "\n" + otherLine;
    }
}
