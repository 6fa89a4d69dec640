package kulim;

/**
 * Finds the minimum-cost path through a lattice.
 *
 * Implementations must agree exactly, ties included: lower total cost wins, and
 * among equal totals the predecessor with the lower tie rank is kept.
 */
public interface Decoder {

    /**
     * Bound on a single blended emission. Leaves headroom for summing one
     * emission per code unit of any realistic text without overflowing a long.
     */
    long MAX_EMISSION = 1L << 40;

    /**
     * @param scorer optional emission override; {@code null} means dictionary costs only
     * @param scorerWeight factor applied to the scorer output before it is added to the node cost
     * @throws DecodeFailureException if no path reaches the end of the lattice
     */
    LatticePath decode(Lattice lattice, TransitionCostTable transitions, ExternalScorer scorer, double scorerWeight);

    default LatticePath decode(Lattice lattice, TransitionCostTable transitions) {
        return decode(lattice, transitions, null, 0.0);
    }

    /**
     * Node cost, blended with the scorer output when one is given.
     *
     * The blended value is clamped to {@code [-MAX_EMISSION, MAX_EMISSION]}, so an
     * infinite delta acts as a veto (or a forced pick) without wrapping around.
     * A NaN delta is ignored.
     */
    static long emissionCost(LatticeNode node, ExternalScorer scorer, double scorerWeight) {
        if (scorer == null || scorerWeight == 0.0) {
            return node.cost();
        }
        double delta = scorerWeight * scorer.score(node.surface(), node.pos());
        if (Double.isNaN(delta)) {
            return node.cost();
        }
        double blended = node.cost() + delta;
        if (blended >= MAX_EMISSION) {
            return MAX_EMISSION;
        }
        if (blended <= -MAX_EMISSION) {
            return -MAX_EMISSION;
        }
        return node.cost() + Math.round(delta);
    }
}
