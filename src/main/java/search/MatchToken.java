package search;

public record MatchToken(String fragment, Emit emit) implements Token {

    @Override
    public String getFragment() { return fragment; }

    @Override
    public boolean isMatch() { return true; }

    @Override
    public Emit getEmit() { return emit; }
}
