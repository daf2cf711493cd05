package search;

// Piece of a tokenized text: either a plain fragment or a keyword match.
public interface Token {

    String getFragment();

    boolean isMatch();

    // The originating match, or null for a fragment.
    Emit getEmit();
}
