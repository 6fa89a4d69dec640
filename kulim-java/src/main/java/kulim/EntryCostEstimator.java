package kulim;

/**
 * Base costs for entries whose lexicon line carries none.
 *
 * Length priors favour longer morphemes; single-syllable predicates and
 * interjections are penalized, multi-syllable nouns and adverbs get a bonus.
 * Counts from a frequency file become {@code -log10(p)} scaled to integers.
 */
public final class EntryCostEstimator {

    static final int COST_LONG_WORD = -40;
    static final int COST_MEDIUM_WORD = -30;
    static final int COST_SHORT_WORD = -5;
    static final int PENALTY_SINGLE_VERB_IC = 20;
    static final int BONUS_NOUN_2PLUS = 5;
    static final int BONUS_ADVERB_2PLUS = 10;

    /** Counts below this are raised to it before computing a probability. */
    static final double MIN_FREQ_FLOOR = 5.0;
    static final double FREQUENCY_SCALE = 10.0;

    public int estimate(String surface, String pos) {
        int length = surface.codePointCount(0, surface.length());
        int cost;
        if (length >= 3) {
            cost = COST_LONG_WORD;
        } else if (length == 2) {
            cost = COST_MEDIUM_WORD;
        } else {
            cost = COST_SHORT_WORD;
        }
        if (length == 1 && (pos.startsWith("V") || PosTags.IC.equals(pos))) {
            cost += PENALTY_SINGLE_VERB_IC;
        }
        if (length >= 2 && pos.startsWith("N") && !PosTags.NA.equals(pos)) {
            cost -= BONUS_NOUN_2PLUS;
        }
        if (length >= 2 && PosTags.MAG.equals(pos)) {
            cost -= BONUS_ADVERB_2PLUS;
        }
        return cost;
    }

    /**
     * Cost of a morpheme seen {@code count} times out of {@code total}.
     */
    public int fromFrequency(double count, double total) {
        if (total <= 0) {
            throw new IllegalArgumentException("Total count must be positive: " + total);
        }
        double effective = Math.max(count, MIN_FREQ_FLOOR);
        double probability = Math.min(1.0, effective / total);
        return (int) Math.round(-Math.log10(probability) * FREQUENCY_SCALE);
    }
}
