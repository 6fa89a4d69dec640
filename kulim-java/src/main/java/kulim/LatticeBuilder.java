package kulim;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expands a text into every candidate segmentation the dictionary and the
 * unknown-word model allow.
 *
 * Only positions reachable from the start are expanded. Candidates are never
 * pruned by cost. The build runs under the dictionary's read lock, so a
 * lattice reflects exactly one dictionary state.
 */
public final class LatticeBuilder {

    private final DictionaryStore store;
    private final UnknownWordModel unknownModel;

    public LatticeBuilder(DictionaryStore store, UnknownWordModel unknownModel) {
        this.store = Objects.requireNonNull(store, "store");
        this.unknownModel = Objects.requireNonNull(unknownModel, "unknownModel");
    }

    /**
     * @throws NoCoverageException if a reachable position has no candidate or the end is unreachable
     */
    public Lattice build(String text) {
        Objects.requireNonNull(text, "text");
        return store.read(s -> buildLocked(s, text));
    }

    private Lattice buildLocked(DictionaryStore s, String text) {
        int n = text.length();
        List<LatticeNode> nodes = new ArrayList<>(n * 3);
        boolean[] reachable = new boolean[n + 1];
        reachable[0] = true;

        for (int p = 0; p < n; p++) {
            if (!reachable[p]) continue;
            int before = nodes.size();

            for (PrefixMatch match : s.lookupPrefixes(text, p)) {
                for (DictionaryEntry entry : match.entries()) {
                    nodes.add(new LatticeNode(nodes.size(), p, match.end(), entry, entry.cost()));
                }
                reachable[match.end()] = true;
            }
            for (UnknownCandidate candidate : unknownModel.candidates(text, p)) {
                DictionaryEntry entry = candidate.entry();
                nodes.add(new LatticeNode(nodes.size(), p, candidate.end(), entry, entry.cost()));
                reachable[candidate.end()] = true;
            }

            if (nodes.size() == before) {
                throw new NoCoverageException(text, p);
            }
        }
        if (!reachable[n]) {
            throw new NoCoverageException(text, n);
        }
        return new Lattice(text, nodes);
    }
}
