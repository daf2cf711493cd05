package search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a text into alternating fragment and match tokens. Concatenating the fragments of the
 * returned tokens gives back the text.
 */
public final class Tokenizer {

    private Tokenizer() {
    }

    /**
     * @param text  the scanned text
     * @param emits matches in ascending start order, as returned by a query on the same text
     */
    public static List<Token> tokenize(CharSequence text, List<Emit> emits) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(emits, "emits");

        List<Token> tokens = new ArrayList<>(emits.size() * 2 + 1);
        int lastEnd = -1; // no previous match
        for (Emit emit : emits) {
            if (emit.getStart() <= lastEnd) {
                // overlaps the match already emitted; keeping it would repeat text
                continue;
            }
            if (emit.getEnd() >= text.length()) {
                throw new IllegalArgumentException("match " + emit + " lies outside a text of length " + text.length());
            }
            if (emit.getStart() > lastEnd + 1) {
                tokens.add(new FragmentToken(text.subSequence(lastEnd + 1, emit.getStart()).toString()));
            }
            tokens.add(new MatchToken(text.subSequence(emit.getStart(), emit.getEnd() + 1).toString(), emit));
            lastEnd = emit.getEnd();
        }
        if (text.length() > lastEnd + 1) {
            tokens.add(new FragmentToken(text.subSequence(lastEnd + 1, text.length()).toString()));
        }
        return tokens;
    }
}
