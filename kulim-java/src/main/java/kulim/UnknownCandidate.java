package kulim;

/**
 * A span proposed by the {@link UnknownWordModel}, ending at {@code end}.
 */
public final class UnknownCandidate {

    private final int end;
    private final DictionaryEntry entry;

    UnknownCandidate(int end, DictionaryEntry entry) {
        this.end = end;
        this.entry = entry;
    }

    public int end() {
        return end;
    }

    /**
     * Synthetic entry carrying the guessed tag and the class cost; never registered.
     */
    public DictionaryEntry entry() {
        return entry;
    }

    @Override
    public String toString() {
        return entry + "@" + end;
    }
}
