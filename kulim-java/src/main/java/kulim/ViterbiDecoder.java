package kulim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reference decoder: plain dynamic program over the node objects.
 */
public final class ViterbiDecoder implements Decoder {

    private static final long UNREACHED = Long.MAX_VALUE;

    @Override
    public LatticePath decode(Lattice lattice, TransitionCostTable transitions, ExternalScorer scorer, double scorerWeight) {
        Objects.requireNonNull(lattice, "lattice");
        Objects.requireNonNull(transitions, "transitions");
        List<LatticeNode> nodes = lattice.nodes();
        int m = nodes.size();
        long[] best = new long[m];
        long[] emission = new long[m];
        LatticeNode[] back = new LatticeNode[m];
        LatticeNode bos = lattice.bos();

        for (LatticeNode v : nodes) {
            int i = v.index();
            best[i] = UNREACHED;
            LatticeNode bestPrev = null;
            long bestCost = UNREACHED;
            if (v.start() == 0) {
                bestPrev = bos;
                bestCost = transitions.cost(PosTags.BOS, v.pos());
            } else {
                for (LatticeNode u : lattice.nodesEndingAt(v.start())) {
                    if (best[u.index()] == UNREACHED) continue;
                    long cost = best[u.index()] + transitions.cost(u.pos(), v.pos());
                    if (bestPrev == null || cost < bestCost || (cost == bestCost && u.precedes(bestPrev))) {
                        bestCost = cost;
                        bestPrev = u;
                    }
                }
            }
            if (bestPrev == null) continue;
            emission[i] = Decoder.emissionCost(v, scorer, scorerWeight);
            best[i] = bestCost + emission[i];
            back[i] = bestPrev;
        }

        int n = lattice.length();
        LatticeNode last = null;
        if (n == 0) {
            last = bos;
        } else {
            long bestCost = UNREACHED;
            for (LatticeNode u : lattice.nodesEndingAt(n)) {
                if (best[u.index()] == UNREACHED) continue;
                long cost = best[u.index()] + transitions.cost(u.pos(), PosTags.EOS);
                if (last == null || cost < bestCost || (cost == bestCost && u.precedes(last))) {
                    bestCost = cost;
                    last = u;
                }
            }
        }
        if (last == null) {
            throw new DecodeFailureException("No path reaches the end of " + lattice);
        }

        List<LatticeNode> path = new ArrayList<>();
        for (LatticeNode node = last; node != bos; node = back[node.index()]) {
            path.add(node);
        }
        Collections.reverse(path);
        long[] pathEmissions = new long[path.size()];
        for (int i = 0; i < path.size(); i++) {
            pathEmissions[i] = emission[path.get(i).index()];
        }
        return LatticePath.of(lattice, path, pathEmissions, transitions);
    }
}
