package kulim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Morphological analyzer: segments text into tagged morphs and learns from corrections.
 *
 * Thread-safe. Any number of threads may analyze concurrently while one
 * learns; an analysis sees the dictionary either before or after a learning
 * call. Each analyzer owns its dictionary, so several independently updated
 * analyzers can live in one process.
 *
 * <pre>
 * MorphAnalyzer analyzer = MorphAnalyzer.withBaseLexicon(AnalyzerConfig.defaults());
 * List&lt;Morph&gt; morphs = analyzer.analyze("학교에 갔다");
 * </pre>
 */
public final class MorphAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(MorphAnalyzer.class);

    private final AnalyzerConfig config;
    private final Decoder decoder;
    private final UnknownWordModel unknownModel;
    private final ExternalScorer scorer;
    private final AnalysisCache cache;
    private final Object swapLock = new Object();

    private volatile Model model;

    private MorphAnalyzer(DictionaryStore store, TransitionCostTable transitions,
                          AnalyzerConfig config, ExternalScorer scorer) {
        this.config = Objects.requireNonNull(config, "config");
        this.decoder = config.decoder().create();
        this.unknownModel = new UnknownWordModel(config);
        this.scorer = scorer;
        this.cache = config.cacheCapacity() > 0 ? new AnalysisCache(config.cacheCapacity()) : null;
        this.model = newModel(Objects.requireNonNull(store, "store"), Objects.requireNonNull(transitions, "transitions"));
    }

    public static MorphAnalyzer create(DictionaryStore store, TransitionCostTable transitions, AnalyzerConfig config) {
        return new MorphAnalyzer(store, transitions, config, null);
    }

    /**
     * @param scorer emission override consulted for every lattice node, or {@code null}
     */
    public static MorphAnalyzer create(DictionaryStore store, TransitionCostTable transitions,
                                       AnalyzerConfig config, ExternalScorer scorer) {
        return new MorphAnalyzer(store, transitions, config, scorer);
    }

    /**
     * Analyzer over the bundled base lexicon and transition priors.
     */
    public static MorphAnalyzer withBaseLexicon(AnalyzerConfig config) throws IOException {
        DictionaryStore store = new DictionaryStore();
        new LexiconLoader(store).loadBaseLexicon();
        return create(store, TransitionCostTable.bundled(config), config);
    }

    /**
     * Analyzer over a dictionary container.
     */
    public static MorphAnalyzer load(Path container, AnalyzerConfig config) throws IOException {
        DictionaryContainer.Contents contents = DictionaryContainer.read(container);
        return create(contents.store(), contents.transitions(), config);
    }

    /**
     * Morphs covering the whole text in order, without gaps or overlaps.
     * Whitespace runs come out as {@code SPACE} morphs.
     */
    public List<Morph> analyze(String text) {
        Objects.requireNonNull(text, "text");
        Model m = model;
        long version = m.store.version();
        if (cache != null) {
            List<Morph> cached = cache.get(text, m, version);
            if (cached != null) return cached;
        }
        List<Morph> morphs = Collections.unmodifiableList(decode(m, text).morphs());
        if (cache != null) {
            cache.put(text, m, version, morphs);
        }
        return morphs;
    }

    /**
     * Best path with its cost breakdown; bypasses the cache.
     */
    public LatticePath analyzePath(String text) {
        Objects.requireNonNull(text, "text");
        return decode(model, text);
    }

    /**
     * Every candidate the analyzer considers for {@code text}.
     */
    public Lattice lattice(String text) {
        return model.builder.build(text);
    }

    /**
     * The analysis grouped by whitespace-delimited word.
     */
    public List<Eojeol> analyzeEojeols(String text) {
        List<Morph> morphs = analyze(text);
        List<Eojeol> eojeols = new ArrayList<>();
        List<Morph> current = new ArrayList<>();
        for (Morph m : morphs) {
            if (PosTags.SPACE.equals(m.pos())) {
                flush(text, current, eojeols);
            } else {
                current.add(m);
            }
        }
        flush(text, current, eojeols);
        return eojeols;
    }

    public LearningResult learn(String text, List<Morph> confirmed) {
        return model.learner.learn(text, confirmed);
    }

    public LearningResult forceLearn(String surface, List<Morph> morphs) {
        return model.learner.forceLearn(surface, morphs);
    }

    public List<LearningResult> learnBatch(List<LearningExample> examples, boolean rollbackOnDivergence) {
        return model.learner.learnBatch(examples, rollbackOnDivergence);
    }

    public void undo(LearningResult result) {
        model.learner.undo(result);
    }

    /**
     * Replaces one transition cost; analyses started earlier keep the previous table.
     */
    public void setTransition(String prev, String next, int cost) {
        synchronized (swapLock) {
            Model m = model;
            model = new Model(m.store, m.transitions.with(prev, next, cost), m.builder, m.learner);
        }
    }

    public TransitionCostTable transitions() {
        return model.transitions;
    }

    public DictionaryStore store() {
        return model.store;
    }

    public AnalyzerConfig config() {
        return config;
    }

    public DictionaryStore.Stats stats() {
        return model.store.stats();
    }

    /**
     * Fraction of {@link #analyze} calls served from the cache.
     */
    public double cacheHitRate() {
        return cache == null ? 0.0 : cache.hitRate();
    }

    public void save(Path container, Map<String, String> metadata) throws IOException {
        Model m = model;
        DictionaryContainer.write(container, m.store, m.transitions, metadata);
    }

    /**
     * Swaps in the dictionary of {@code container}. On any error the current
     * dictionary stays in place.
     */
    public void reload(Path container) throws IOException {
        DictionaryContainer.Contents contents = DictionaryContainer.read(container);
        synchronized (swapLock) {
            model = newModel(contents.store(), contents.transitions());
        }
        if (cache != null) {
            cache.clear();
        }
        log.info("Reloaded dictionary from {} ({} entries)", container, contents.store().size());
    }

    private LatticePath decode(Model m, String text) {
        return decoder.decode(m.builder.build(text), m.transitions, scorer, config.scorerWeight());
    }

    private Model newModel(DictionaryStore store, TransitionCostTable transitions) {
        LatticeBuilder builder = new LatticeBuilder(store, unknownModel);
        OnlineLearner learner = new OnlineLearner(store, builder, decoder, () -> model.transitions, scorer, config);
        return new Model(store, transitions, builder, learner);
    }

    private static void flush(String text, List<Morph> current, List<Eojeol> eojeols) {
        if (current.isEmpty()) return;
        int start = current.get(0).start();
        int end = current.get(current.size() - 1).end();
        eojeols.add(new Eojeol(text.substring(start, end), start, end, current));
        current.clear();
    }

    private static final class Model {
        final DictionaryStore store;
        final TransitionCostTable transitions;
        final LatticeBuilder builder;
        final OnlineLearner learner;

        Model(DictionaryStore store, TransitionCostTable transitions, LatticeBuilder builder, OnlineLearner learner) {
            this.store = store;
            this.transitions = transitions;
            this.builder = builder;
            this.learner = learner;
        }
    }
}
