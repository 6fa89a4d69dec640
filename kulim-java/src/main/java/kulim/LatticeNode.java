package kulim;

/**
 * One candidate morpheme over {@code [start, end)} of the lattice text.
 *
 * The cost is the entry's cost at the moment the lattice was built; later
 * learning does not change an existing lattice.
 */
public final class LatticeNode {

    /** Synthetic entries rank after every dictionary id, shorter spans first. */
    static final long SYNTHETIC_RANK_BASE = 1L << 32;

    private final int index;
    private final int start;
    private final int end;
    private final DictionaryEntry entry;
    private final int cost;
    private final long rank;

    LatticeNode(int index, int start, int end, DictionaryEntry entry, int cost) {
        this.index = index;
        this.start = start;
        this.end = end;
        this.entry = entry;
        this.cost = cost;
        this.rank = entry.isRegistered() ? entry.id() : SYNTHETIC_RANK_BASE + (end - start);
    }

    /**
     * Position in {@link Lattice#nodes()}; -1 for the virtual BOS and EOS nodes.
     */
    public int index() {
        return index;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public DictionaryEntry entry() {
        return entry;
    }

    public String surface() {
        return entry.surface();
    }

    public String pos() {
        return entry.pos();
    }

    public int cost() {
        return cost;
    }

    public boolean isUnknown() {
        return !entry.isRegistered();
    }

    /**
     * Tie-break key: among equal path costs the predecessor with the lower rank is kept.
     */
    public long rank() {
        return rank;
    }

    /**
     * Whether this node wins a cost tie against {@code other}.
     */
    boolean precedes(LatticeNode other) {
        if (rank != other.rank) return rank < other.rank;
        return index < other.index;
    }

    @Override
    public String toString() {
        return entry.surface() + "/" + entry.pos() + "[" + start + "," + end + ")=" + cost;
    }
}
