package kulim;

import java.util.List;

/**
 * Outcome of a learning call.
 */
public final class LearningResult {

    public enum Status {
        /** The analysis already matched; nothing was changed. */
        UNCHANGED,
        /** Costs were nudged toward the confirmed analysis. */
        UPDATED,
        /** Forced learning reproduced the confirmed analysis. */
        CONVERGED,
        /** Forced learning gave up; the best round was kept. */
        DIVERGED
    }

    private final Status status;
    private final int rounds;
    private final List<Morph> analysis;
    private final LearningJournal journal;
    private final boolean rolledBack;

    LearningResult(Status status, int rounds, List<Morph> analysis, LearningJournal journal, boolean rolledBack) {
        this.status = status;
        this.rounds = rounds;
        this.analysis = List.copyOf(analysis);
        this.journal = journal;
        this.rolledBack = rolledBack;
    }

    public Status status() {
        return status;
    }

    public int rounds() {
        return rounds;
    }

    /**
     * Analysis of the learned text after the call.
     */
    public List<Morph> analysis() {
        return analysis;
    }

    public LearningJournal journal() {
        return journal;
    }

    /**
     * True when the changes were undone because a batch diverged.
     */
    public boolean rolledBack() {
        return rolledBack;
    }

    LearningResult asRolledBack(List<Morph> restoredAnalysis) {
        return new LearningResult(status, rounds, restoredAnalysis, journal, true);
    }

    @Override
    public String toString() {
        return status + " after " + rounds + " round(s), " + journal.size() + " change(s)"
            + (rolledBack ? ", rolled back" : "");
    }
}
