package kulim;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests over the bundled lexicon and transition priors.
 * The shared cases in test_cases.json must match exactly with either decoder.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class MorphAnalyzerTest {

    private MorphAnalyzer analyzer;
    private MorphAnalyzer reference;
    private List<TestCase> testCases;

    static class TestCase {
        int id;
        String input;
        String description;
        List<String> expected;
    }

    @BeforeAll
    void setUp() throws IOException {
        analyzer = MorphAnalyzer.withBaseLexicon(AnalyzerConfig.defaults());
        reference = MorphAnalyzer.withBaseLexicon(AnalyzerConfig.builder()
            .decoder(DecoderKind.REFERENCE)
            .cacheCapacity(0)
            .build());

        Gson gson = new Gson();
        Type listType = new TypeToken<List<TestCase>>() {}.getType();
        try (InputStream in = MorphAnalyzerTest.class.getResourceAsStream("/test_cases.json");
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            testCases = gson.fromJson(reader, listType);
        }
    }

    private static List<String> tags(List<Morph> morphs) {
        List<String> result = new ArrayList<>();
        for (Morph m : morphs) {
            result.add(m.toString());
        }
        return result;
    }

    @Test
    void testAllCasesMatchExpected() {
        StringBuilder failures = new StringBuilder();
        int failCount = 0;

        for (TestCase tc : testCases) {
            for (MorphAnalyzer a : new MorphAnalyzer[] {analyzer, reference}) {
                List<String> result = tags(a.analyze(tc.input));
                if (!result.equals(tc.expected)) {
                    failCount++;
                    failures.append(String.format("[%d] %s (%s)%n", tc.id, tc.description, a.config().decoder()));
                    failures.append(String.format("  Input: %s%n", tc.input));
                    failures.append(String.format("  Expected: %s%n", tc.expected));
                    failures.append(String.format("  Actual: %s%n", result));
                }
            }
        }

        if (failCount > 0) {
            fail(String.format("%d/%d test cases failed:%n%s", failCount, testCases.size() * 2, failures));
        }
    }

    @Test
    void testPathCosts() {
        assertEquals(-60, analyzer.analyzePath("친구가").totalCost());
        assertEquals(-85, analyzer.analyzePath("학교에서").totalCost());

        LatticePath path = analyzer.analyzePath("먹었다");
        assertEquals(-20, path.totalCost());
        assertEquals(5, path.emissionCost());
        assertEquals(-25, path.transitionCost());
    }

    @Test
    void testMorphSpansAndLemmas() {
        List<Morph> morphs = analyzer.analyze("친구가 먹었다");
        assertEquals(new Morph("친구", "NNG", "친구", 0, 0, 2), morphs.get(0));
        assertEquals(" ", morphs.get(2).surface());
        assertEquals("먹다", morphs.get(3).lemma());
        assertEquals(4, morphs.get(3).start());
        assertTrue(morphs.get(0).isFree());
        assertTrue(morphs.get(1).isFunctional());
        assertTrue(morphs.get(3).isLexical());
        assertTrue(morphs.get(3).isBound());
    }

    @Test
    void testEojeols() {
        List<Eojeol> eojeols = analyzer.analyzeEojeols("  책을 읽었다 ");
        assertEquals(2, eojeols.size());
        assertEquals("책을", eojeols.get(0).surface());
        assertEquals(2, eojeols.get(0).start());
        assertEquals(2, eojeols.get(0).morphs().size());
        assertEquals("읽었다", eojeols.get(1).surface());
        assertEquals(8, eojeols.get(1).end());
        assertEquals(3, eojeols.get(1).morphs().size());
        assertTrue(analyzer.analyzeEojeols("   ").isEmpty());
    }

    @Test
    void testAnalysisCoversEveryInput() {
        int[] pool = "친구가학교에서먹었다책을갔 .,!?()\"abcXYZ0123漢字ㅋ\t😀𝔸-".codePoints().toArray();
        Random random = new Random(7L);
        for (int iteration = 0; iteration < 500; iteration++) {
            StringBuilder sb = new StringBuilder();
            int length = random.nextInt(24);
            for (int i = 0; i < length; i++) {
                sb.appendCodePoint(pool[random.nextInt(pool.length)]);
            }
            String text = sb.toString();
            List<Morph> morphs = reference.analyze(text);

            int position = 0;
            StringBuilder joined = new StringBuilder();
            for (Morph m : morphs) {
                assertEquals(position, m.start(), text);
                assertTrue(m.end() > m.start(), text);
                assertEquals(text.substring(m.start(), m.end()), m.surface());
                joined.append(m.surface());
                position = m.end();
            }
            assertEquals(text, joined.toString());
            assertEquals(tags(morphs), tags(analyzer.analyze(text)), text);
        }
    }

    @Test
    void testDeterministic() {
        String text = "오늘 날씨가 정말 좋네요. xyz123";
        List<Morph> first = reference.analyze(text);
        List<Morph> second = reference.analyze(text);
        assertNotSame(first, second);
        assertEquals(first, second);
    }

    @Test
    void testCachedResultsAreShared() {
        List<Morph> first = analyzer.analyze("친구가 학교에서");
        List<Morph> second = analyzer.analyze("친구가 학교에서");
        assertSame(first, second);
        assertTrue(analyzer.cacheHitRate() > 0.0);
        assertThrows(UnsupportedOperationException.class, () -> first.add(Morph.of("x", "SL")));
        assertEquals(0.0, reference.cacheHitRate());
    }

    @Test
    void testLatticeExposesCandidates() {
        Lattice lattice = analyzer.lattice("가");
        List<String> candidates = new ArrayList<>();
        for (LatticeNode node : lattice.nodesStartingAt(0)) {
            candidates.add(node.pos());
        }
        assertEquals(List.of("VV", "JKS", "NNG"), candidates);
        assertTrue(lattice.node(2).isUnknown());
    }

    @Test
    void testNullTextRejected() {
        assertThrows(NullPointerException.class, () -> analyzer.analyze(null));
    }

    @Test
    void testStats() {
        DictionaryStore.Stats stats = analyzer.stats();
        assertEquals(analyzer.store().size(), stats.entries());
        assertTrue(stats.entries() > 100);
        assertTrue(stats.posDistribution().containsKey("NNG"));
    }

    @Test
    void testSetTransitionInvalidatesCache() {
        DictionaryStore store = new DictionaryStore();
        store.getOrCreate("abc", "NOUN", null, 5);
        store.getOrCreate("ab", "NOUN", null, 3);
        store.getOrCreate("c", "PART", null, 2);
        MorphAnalyzer scenario = MorphAnalyzer.create(store, TransitionCostTable.of(10, 0), AnalyzerConfig.defaults());

        assertEquals(List.of("abc/NOUN"), tags(scenario.analyze("abc")));
        scenario.setTransition("NOUN", "PART", -5);
        assertEquals(-5, scenario.transitions().cost("NOUN", "PART"));
        assertEquals(List.of("ab/NOUN", "c/PART"), tags(scenario.analyze("abc")));

        scenario.setTransition("PART", PosTags.EOS, 100);
        assertEquals(100, scenario.transitions().cost("PART", PosTags.EOS));
        assertEquals(List.of("abc/NOUN"), tags(scenario.analyze("abc")));
    }

    @Test
    void testScorerOverridesDictionary() {
        DictionaryStore store = new DictionaryStore();
        store.getOrCreate("abc", "NOUN", null, 5);
        store.getOrCreate("ab", "NOUN", null, 3);
        store.getOrCreate("c", "PART", null, 2);
        ExternalScorer scorer = (span, pos) -> "abc".equals(span) ? 10.0 : 0.0;
        MorphAnalyzer scored = MorphAnalyzer.create(store, TransitionCostTable.of(10, 0).with("NOUN", "PART", 1),
            AnalyzerConfig.builder().scorerWeight(0.5).build(), scorer);

        // abc: 5 + 0.5 * 10 = 10 against ab + c = 6
        assertEquals(List.of("ab/NOUN", "c/PART"), tags(scored.analyze("abc")));
    }

    @Test
    void testConcurrentAnalysisDuringLearning() throws Exception {
        DictionaryStore store = new DictionaryStore();
        store.getOrCreate("abc", "NOUN", null, 5);
        store.getOrCreate("ab", "NOUN", null, 3);
        store.getOrCreate("c", "PART", null, 2);
        MorphAnalyzer shared = MorphAnalyzer.create(store, TransitionCostTable.of(10, 0).with("NOUN", "PART", 1),
            AnalyzerConfig.defaults());
        List<String> before = List.of("abc/NOUN");
        List<String> after = List.of("ab/NOUN", "c/PART");

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    int seen = 0;
                    for (int i = 0; i < 500; i++) {
                        List<String> result = tags(shared.analyzePath("abc").morphs());
                        if (!result.equals(before) && !result.equals(after)) {
                            throw new AssertionError("Unexpected analysis " + result);
                        }
                        seen++;
                    }
                    return seen;
                }));
            }
            LearningResult result = shared.forceLearn("abc", List.of(Morph.of("ab", "NOUN"), Morph.of("c", "PART")));
            assertEquals(LearningResult.Status.CONVERGED, result.status());
            for (Future<Integer> f : futures) {
                assertEquals(500, f.get());
            }
        } finally {
            pool.shutdown();
        }
        assertEquals(after, tags(shared.analyze("abc")));
    }

    @Test
    void testAnalysisProceedsWhileLearnerDecodes() throws Exception {
        DictionaryStore store = new DictionaryStore();
        store.getOrCreate("abc", "NOUN", null, 5);
        CountDownLatch decoding = new CountDownLatch(1);
        CountDownLatch analyzed = new CountDownLatch(1);
        AtomicBoolean released = new AtomicBoolean();
        AtomicBoolean first = new AtomicBoolean(true);
        ExternalScorer scorer = (span, pos) -> {
            if (span.equals("zz") && first.compareAndSet(true, false)) {
                decoding.countDown();
                try {
                    released.set(analyzed.await(10, TimeUnit.SECONDS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return 0.0;
        };
        MorphAnalyzer shared = MorphAnalyzer.create(store, TransitionCostTable.of(10, 0),
            AnalyzerConfig.defaults(), scorer);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<LearningResult> learning = pool.submit(() -> shared.learn("zz", List.of(Morph.of("zz", "NOUN"))));
            assertTrue(decoding.await(10, TimeUnit.SECONDS));
            // the learner is in the middle of a decode; the dictionary must stay readable
            assertEquals(List.of("abc/NOUN"), tags(shared.analyzePath("abc").morphs()));
            analyzed.countDown();

            assertEquals(LearningResult.Status.UPDATED, learning.get(10, TimeUnit.SECONDS).status());
            assertTrue(released.get());
        } finally {
            pool.shutdown();
        }
        assertEquals(List.of("zz/NOUN"), tags(shared.analyze("zz")));
    }
}
