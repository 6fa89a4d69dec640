package kulim;

import java.util.List;

/**
 * Dictionary entries whose surface spans {@code [start, end)} of a query text.
 */
public final class PrefixMatch {

    private final int end;
    private final List<DictionaryEntry> entries;

    PrefixMatch(int end, List<DictionaryEntry> entries) {
        this.end = end;
        this.entries = entries;
    }

    public int end() {
        return end;
    }

    public List<DictionaryEntry> entries() {
        return entries;
    }
}
