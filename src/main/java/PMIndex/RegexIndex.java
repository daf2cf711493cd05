package PMIndex;

import search.Emit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Baseline that scans the text once per keyword with a literal java.util.regex pattern. Reports
 * every occurrence, overlapping ones included; no whole-word or overlap filtering.
 */
public class RegexIndex implements IMultiPatternIndex {

    private static final Comparator<Emit> BY_POSITION =
            Comparator.comparingInt(Emit::getStart).thenComparingInt(Emit::getEnd);

    private final boolean caseInsensitive;
    // folded keyword -> compiled pattern, in insertion order
    private final Map<String, Entry> patterns = new LinkedHashMap<>();

    public RegexIndex() {
        this(false);
    }

    public RegexIndex(boolean caseInsensitive) {
        this.caseInsensitive = caseInsensitive;
    }

    @Override
    public boolean insert(String keyword) {
        Objects.requireNonNull(keyword, "keyword");
        if (keyword.isEmpty()) {
            return false;
        }
        String key = fold(keyword);
        if (patterns.containsKey(key)) {
            return false;
        }
        patterns.put(key, new Entry(keyword, patterns.size(), Pattern.compile(key, Pattern.LITERAL)));
        return true;
    }

    @Override
    public List<Emit> report(CharSequence text) {
        Objects.requireNonNull(text, "text");
        String haystack = fold(text);
        List<Emit> emits = new ArrayList<>();
        for (Entry entry : patterns.values()) {
            Matcher matcher = entry.pattern.matcher(haystack);
            int from = 0;
            // restart one past each hit so overlapping occurrences are found too
            while (from < haystack.length() && matcher.find(from)) {
                emits.add(new Emit(matcher.start(), matcher.end() - 1, entry.keyword, entry.index));
                from = matcher.start() + 1;
            }
        }
        emits.sort(BY_POSITION);
        return emits;
    }

    @Override
    public int numKeywords() {
        return patterns.size();
    }

    private String fold(CharSequence s) {
        if (!caseInsensitive) {
            return s.toString();
        }
        char[] chars = new char[s.length()];
        for (int i = 0; i < chars.length; i++) {
            chars[i] = Character.toLowerCase(s.charAt(i));
        }
        return new String(chars);
    }

    private record Entry(String keyword, int index, Pattern pattern) {
    }
}
