package kulim;

/**
 * Pluggable emission-cost source, e.g. a neural model served elsewhere.
 *
 * Consulted once per lattice node. The returned delta is scaled by the
 * configured weight, rounded and added to the dictionary cost.
 */
@FunctionalInterface
public interface ExternalScorer {

    double score(String span, String pos);
}
