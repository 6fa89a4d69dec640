package kulim;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decoder working on primitive arrays.
 *
 * DP buffers are allocated once per thread and grown on demand. Tags are
 * interned per lattice into small ids and transition costs are memoized in a
 * dense matrix, so each distinct tag pair is looked up at most once.
 */
public final class BufferedViterbiDecoder implements Decoder {

    private static final long UNREACHED = Long.MAX_VALUE;
    private static final int NO_PREV = -2;
    private static final int FROM_BOS = -1;

    private static final ThreadLocal<Buffers> BUFFERS = ThreadLocal.withInitial(Buffers::new);

    @Override
    public LatticePath decode(Lattice lattice, TransitionCostTable transitions, ExternalScorer scorer, double scorerWeight) {
        Objects.requireNonNull(lattice, "lattice");
        Objects.requireNonNull(transitions, "transitions");
        int m = lattice.size();
        Buffers b = BUFFERS.get();
        b.ensureNodes(m);

        // Intern tags: 0..t-1 for lattice tags, then BOS and EOS
        Map<String, Integer> ids = b.tagIds;
        ids.clear();
        int[] tagOf = b.tagOf;
        for (int i = 0; i < m; i++) {
            tagOf[i] = ids.computeIfAbsent(lattice.node(i).pos(), k -> ids.size());
        }
        int bosId = ids.size();
        int eosId = bosId + 1;
        int width = bosId + 2;
        String[] names = new String[width];
        for (Map.Entry<String, Integer> e : ids.entrySet()) {
            names[e.getValue()] = e.getKey();
        }
        names[bosId] = PosTags.BOS;
        names[eosId] = PosTags.EOS;
        b.ensureMatrix(width * width);
        TransitionMatrix matrix = new TransitionMatrix(transitions, names, width, b.matrix, b.known);

        long[] best = b.best;
        long[] emission = b.emission;
        int[] back = b.back;

        for (int i = 0; i < m; i++) {
            LatticeNode v = lattice.node(i);
            best[i] = UNREACHED;
            back[i] = NO_PREV;
            int prev = NO_PREV;
            long bestCost = UNREACHED;
            if (v.start() == 0) {
                prev = FROM_BOS;
                bestCost = matrix.cost(bosId, tagOf[i]);
            } else {
                for (int u : lattice.endingAt(v.start())) {
                    if (best[u] == UNREACHED) continue;
                    long cost = best[u] + matrix.cost(tagOf[u], tagOf[i]);
                    if (prev == NO_PREV || cost < bestCost
                            || (cost == bestCost && lattice.node(u).precedes(lattice.node(prev)))) {
                        bestCost = cost;
                        prev = u;
                    }
                }
            }
            if (prev == NO_PREV) continue;
            emission[i] = Decoder.emissionCost(v, scorer, scorerWeight);
            best[i] = bestCost + emission[i];
            back[i] = prev;
        }

        int n = lattice.length();
        int last = NO_PREV;
        if (n == 0) {
            last = FROM_BOS;
        } else {
            long bestCost = UNREACHED;
            for (int u : lattice.endingAt(n)) {
                if (best[u] == UNREACHED) continue;
                long cost = best[u] + matrix.cost(tagOf[u], eosId);
                if (last == NO_PREV || cost < bestCost
                        || (cost == bestCost && lattice.node(u).precedes(lattice.node(last)))) {
                    bestCost = cost;
                    last = u;
                }
            }
        }
        if (last == NO_PREV) {
            throw new DecodeFailureException("No path reaches the end of " + lattice);
        }

        int length = 0;
        for (int node = last; node != FROM_BOS; node = back[node]) {
            length++;
        }
        LatticeNode[] reversed = new LatticeNode[length];
        long[] pathEmissions = new long[length];
        int k = length;
        for (int node = last; node != FROM_BOS; node = back[node]) {
            k--;
            reversed[k] = lattice.node(node);
            pathEmissions[k] = emission[node];
        }
        List<LatticeNode> path = new ArrayList<>(Arrays.asList(reversed));
        return LatticePath.of(lattice, path, pathEmissions, transitions);
    }

    private static final class TransitionMatrix {
        private final TransitionCostTable transitions;
        private final String[] names;
        private final int width;
        private final int[] costs;
        private final boolean[] known;

        TransitionMatrix(TransitionCostTable transitions, String[] names, int width, int[] costs, boolean[] known) {
            this.transitions = transitions;
            this.names = names;
            this.width = width;
            this.costs = costs;
            this.known = known;
            Arrays.fill(known, 0, width * width, false);
        }

        int cost(int prev, int next) {
            int slot = prev * width + next;
            if (!known[slot]) {
                costs[slot] = transitions.cost(names[prev], names[next]);
                known[slot] = true;
            }
            return costs[slot];
        }
    }

    private static final class Buffers {
        long[] best = new long[1024];
        long[] emission = new long[1024];
        int[] back = new int[1024];
        int[] tagOf = new int[1024];
        int[] matrix = new int[1024];
        boolean[] known = new boolean[1024];
        final Map<String, Integer> tagIds = new HashMap<>();

        void ensureNodes(int m) {
            if (best.length < m) {
                int size = m + 128;
                best = new long[size];
                emission = new long[size];
                back = new int[size];
                tagOf = new int[size];
            }
        }

        void ensureMatrix(int cells) {
            if (matrix.length < cells) {
                matrix = new int[cells];
                known = new boolean[cells];
            }
        }
    }
}
