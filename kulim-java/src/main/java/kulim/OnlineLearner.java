package kulim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Corrects dictionary costs from confirmed analyses.
 *
 * A learning round registers the confirmed morphs the dictionary lacks,
 * penalizes every dictionary entry on the current best path that the
 * confirmation does not have at the same span, and rewards every confirmed
 * entry (never below the configured minimum cost). Transition costs are not
 * touched.
 *
 * Learners are serialized by their own lock. Decoding runs under that lock
 * only; the dictionary write lock is held while a round's insertions and cost
 * changes are applied, and while a rollback is applied. Concurrent analyses
 * therefore see the dictionary between rounds, never in the middle of one.
 */
public final class OnlineLearner {

    private static final Logger log = LoggerFactory.getLogger(OnlineLearner.class);

    private final DictionaryStore store;
    private final LatticeBuilder builder;
    private final Decoder decoder;
    private final Supplier<TransitionCostTable> transitions;
    private final ExternalScorer scorer;
    private final AnalyzerConfig config;
    private final ReentrantLock lock = new ReentrantLock();

    public OnlineLearner(DictionaryStore store, LatticeBuilder builder, Decoder decoder,
                         Supplier<TransitionCostTable> transitions, ExternalScorer scorer, AnalyzerConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.transitions = Objects.requireNonNull(transitions, "transitions");
        this.scorer = scorer;
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * One learning round on {@code text}, unless it already analyzes to {@code confirmed}.
     * Whitespace between the confirmed morphs may be omitted.
     *
     * @throws IllegalArgumentException if the confirmed surfaces do not spell out {@code text}
     */
    public LearningResult learn(String text, List<Morph> confirmed) {
        Objects.requireNonNull(text, "text");
        List<Morph> target = tile(text, confirmed);
        return locked(() -> learnLocked(text, target));
    }

    /**
     * Repeats learning rounds on a single eojeol until it analyzes exactly to {@code morphs}.
     *
     * If the morph surfaces do not spell out the eojeol (irregular conjugation,
     * contraction), the eojeol is registered as one compound entry whose tag and
     * lemma join the components with {@code '+'}. The components themselves are
     * registered too.
     */
    public LearningResult forceLearn(String surface, List<Morph> morphs) {
        Objects.requireNonNull(surface, "surface");
        List<Morph> target = forceTarget(surface, morphs);
        return locked(() -> forceLearnLocked(surface, target));
    }

    /**
     * Force-learns several examples in order. If one diverges and
     * {@code rollbackOnDivergence} is set, every change of the batch is undone
     * in a single write.
     */
    public List<LearningResult> learnBatch(List<LearningExample> examples, boolean rollbackOnDivergence) {
        List<List<Morph>> targets = new ArrayList<>(examples.size());
        for (LearningExample example : examples) {
            targets.add(forceTarget(example.surface(), example.morphs()));
        }
        return locked(() -> {
            LearningJournal batch = new LearningJournal();
            List<LearningResult> results = new ArrayList<>(examples.size());
            boolean diverged = false;
            for (int i = 0; i < examples.size(); i++) {
                LearningResult result = forceLearnLocked(examples.get(i).surface(), targets.get(i));
                batch.append(result.journal());
                results.add(result);
                diverged |= result.status() == LearningResult.Status.DIVERGED;
            }
            if (!diverged || !rollbackOnDivergence) {
                return results;
            }
            store.write(s -> {
                batch.rollback(s);
                return null;
            });
            log.warn("Rolled back learning batch of {} example(s) after divergence", examples.size());
            List<LearningResult> restored = new ArrayList<>(results.size());
            for (int i = 0; i < results.size(); i++) {
                restored.add(results.get(i).asRolledBack(decode(examples.get(i).surface()).morphs()));
            }
            return restored;
        });
    }

    /**
     * Restores the dictionary state recorded in a result's journal.
     */
    public void undo(LearningResult result) {
        if (result.rolledBack()) return;
        locked(() -> store.write(s -> {
            result.journal().rollback(s);
            return null;
        }));
    }

    private LearningResult learnLocked(String text, List<Morph> target) {
        LearningJournal journal = new LearningJournal();
        LatticePath path = decode(text);
        if (matches(path, target)) {
            log.debug("Already learned: {}", target);
            return new LearningResult(LearningResult.Status.UNCHANGED, 0, path.morphs(), journal, false);
        }
        apply(target, path, journal);
        LatticePath after = decode(text);
        log.debug("Learned {}: {} change(s), now {}", target, journal.size(), after.nodes());
        return new LearningResult(LearningResult.Status.UPDATED, 1, after.morphs(), journal, false);
    }

    private LearningResult forceLearnLocked(String surface, List<Morph> target) {
        LearningJournal journal = new LearningJournal();
        LatticePath path = decode(surface);
        if (matches(path, target)) {
            return new LearningResult(LearningResult.Status.UNCHANGED, 0, path.morphs(), journal, false);
        }
        int maxRounds = config.forceLearnMaxRounds();
        long bestGap = Long.MAX_VALUE;
        int bestMark = 0;
        int bestRound = 0;
        for (int round = 1; round <= maxRounds; round++) {
            apply(target, path, journal);
            path = decode(surface);
            if (matches(path, target)) {
                log.debug("Force-learned {} in {} round(s)", target, round);
                return new LearningResult(LearningResult.Status.CONVERGED, round, path.morphs(), journal, false);
            }
            long gap = costGap(path, target);
            if (gap < bestGap) {
                bestGap = gap;
                bestMark = journal.size();
                bestRound = round;
            }
        }
        int mark = bestMark;
        store.write(s -> {
            journal.rollbackTo(s, mark);
            return null;
        });
        LatticePath kept = decode(surface);
        log.warn("Forced learning of '{}' did not converge in {} rounds; keeping round {} (cost gap {}), analysis {}",
            surface, maxRounds, bestRound, bestGap, kept.nodes());
        return new LearningResult(LearningResult.Status.DIVERGED, maxRounds, kept.morphs(), journal, false);
    }

    private void apply(List<Morph> target, LatticePath path, LearningJournal journal) {
        store.write(s -> {
            applyRound(target, path, journal);
            return null;
        });
    }

    private void applyRound(List<Morph> target, LatticePath path, LearningJournal journal) {
        for (Morph m : target) {
            if (!m.components().isEmpty()) {
                for (Morph part : m.components()) {
                    insertMissing(part, null, journal);
                }
            }
            insertMissing(m, m.components(), journal);
        }

        Set<String> confirmedSpans = new HashSet<>();
        for (Morph m : target) {
            confirmedSpans.add(spanKey(m.start(), m.end(), m.surface(), m.pos()));
        }
        if (config.learnPenalty() != 0) {
            for (LatticeNode node : path.nodes()) {
                DictionaryEntry entry = node.entry();
                if (!entry.isRegistered()
                        || confirmedSpans.contains(spanKey(node.start(), node.end(), node.surface(), node.pos()))
                        || store.entry(entry.id()) != entry) {
                    continue;
                }
                journal.recordCost(entry, store.adjustCost(entry.id(), config.learnPenalty()));
            }
        }

        if (config.learnReward() != 0) {
            for (Morph m : target) {
                if (PosTags.isBoundary(m.pos())) continue;
                DictionaryEntry entry = store.find(m.surface(), m.pos());
                int previous = store.adjustCost(entry.id(), -config.learnReward(), config.minimumCost());
                journal.recordCost(entry, previous);
            }
        }
    }

    private void insertMissing(Morph m, List<Morph> components, LearningJournal journal) {
        if (PosTags.isBoundary(m.pos()) || store.find(m.surface(), m.pos()) != null) return;
        journal.recordInsert(store.getOrCreate(m.surface(), m.pos(), m.lemma(), config.learnDefaultCost(), components));
    }

    /**
     * Cost of the confirmed path through the same lattice minus the cost of the best path.
     */
    private long costGap(LatticePath path, List<Morph> target) {
        Lattice lattice = path.lattice();
        TransitionCostTable table = transitions.get();
        long total = 0;
        String previous = PosTags.BOS;
        for (Morph m : target) {
            LatticeNode match = null;
            for (LatticeNode node : lattice.nodesStartingAt(m.start())) {
                if (node.end() == m.end() && node.surface().equals(m.surface()) && node.pos().equals(m.pos())
                        && (match == null || node.precedes(match))) {
                    match = node;
                }
            }
            if (match == null) {
                return Long.MAX_VALUE;
            }
            total += table.cost(previous, m.pos()) + Decoder.emissionCost(match, scorer, config.scorerWeight());
            previous = m.pos();
        }
        total += table.cost(previous, PosTags.EOS);
        return total - path.totalCost();
    }

    private LatticePath decode(String text) {
        return decoder.decode(builder.build(text), transitions.get(), scorer, config.scorerWeight());
    }

    private static boolean matches(LatticePath path, List<Morph> target) {
        List<LatticeNode> nodes = path.nodes();
        if (nodes.size() != target.size()) return false;
        for (int i = 0; i < nodes.size(); i++) {
            LatticeNode node = nodes.get(i);
            Morph m = target.get(i);
            if (node.start() != m.start() || node.end() != m.end()
                    || !node.surface().equals(m.surface()) || !node.pos().equals(m.pos())) {
                return false;
            }
        }
        return true;
    }

    private static String spanKey(int start, int end, String surface, String pos) {
        return start + ":" + end + ":" + surface + "\t" + pos;
    }

    /**
     * Assigns consecutive spans to the confirmed morphs, filling skipped whitespace with SPACE morphs.
     */
    static List<Morph> tile(String text, List<Morph> confirmed) {
        Objects.requireNonNull(confirmed, "confirmed");
        List<Morph> tiled = new ArrayList<>(confirmed.size());
        int offset = 0;
        for (Morph m : confirmed) {
            Objects.requireNonNull(m, "morph");
            if (m.surface().isEmpty()) {
                throw new IllegalArgumentException("Confirmed morph with empty surface: " + m);
            }
            if (!text.startsWith(m.surface(), offset)) {
                int spaceEnd = offset;
                while (spaceEnd < text.length() && Constants.isWhitespace(text.charAt(spaceEnd))) {
                    spaceEnd++;
                }
                if (spaceEnd > offset && !PosTags.SPACE.equals(m.pos()) && text.startsWith(m.surface(), spaceEnd)) {
                    tiled.add(new Morph(text.substring(offset, spaceEnd), PosTags.SPACE, null, 0, offset, spaceEnd));
                    offset = spaceEnd;
                } else {
                    throw new IllegalArgumentException("Morph " + m + " does not continue \"" + text + "\" at " + offset);
                }
            }
            int end = offset + m.surface().length();
            if (m.start() >= 0 && (m.start() != offset || m.end() != end)) {
                throw new IllegalArgumentException("Morph " + m + " claims [" + m.start() + "," + m.end()
                    + ") but lies at [" + offset + "," + end + ")");
            }
            tiled.add(m.withSpan(offset, end));
            offset = end;
        }
        if (offset < text.length() && text.substring(offset).isBlank()) {
            tiled.add(new Morph(text.substring(offset), PosTags.SPACE, null, 0, offset, text.length()));
            offset = text.length();
        }
        if (offset != text.length()) {
            throw new IllegalArgumentException("Confirmed morphs cover " + offset + " of " + text.length()
                + " characters of \"" + text + "\"");
        }
        return tiled;
    }

    static List<Morph> forceTarget(String surface, List<Morph> morphs) {
        Objects.requireNonNull(morphs, "morphs");
        if (morphs.isEmpty() || surface.isEmpty()) {
            throw new IllegalArgumentException("Nothing to learn for \"" + surface + "\"");
        }
        StringBuilder joined = new StringBuilder();
        for (Morph m : morphs) {
            joined.append(m.surface());
        }
        if (joined.toString().equals(surface)) {
            return tile(surface, morphs);
        }
        StringBuilder pos = new StringBuilder();
        StringBuilder lemma = new StringBuilder();
        for (Morph m : morphs) {
            if (pos.length() > 0) {
                pos.append(PosTags.COMPOUND_SEPARATOR);
                lemma.append(PosTags.COMPOUND_SEPARATOR);
            }
            pos.append(m.pos());
            lemma.append(m.lemma());
        }
        Morph compound = new Morph(surface, pos.toString(), lemma.toString(), 0, 0, surface.length(), morphs);
        return List.of(compound);
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
