package PMIndex;

import search.Emit;

import java.util.List;

// Keyword set that can be scanned against texts.
public interface IMultiPatternIndex {

    // False when the keyword is empty or already registered.
    boolean insert(String keyword);

    // Occurrences ascending by start position.
    List<Emit> report(CharSequence text);

    int numKeywords();
}
