package search;

public record FragmentToken(String fragment) implements Token {

    @Override
    public String getFragment() { return fragment; }

    @Override
    public boolean isMatch() { return false; }

    @Override
    public Emit getEmit() { return null; }
}
