package trie;

// A registered keyword and the order in which it was accepted.
public record Keyword(String text, int index) {

    public int length() {
        return text.length();
    }
}
