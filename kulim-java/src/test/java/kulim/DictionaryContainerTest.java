package kulim;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class DictionaryContainerTest {

    private static final List<String> SENTENCES = List.of(
        "친구가 학교에서 책을 읽었다.", "오늘 날씨가 정말 좋네요.", "갔다", "xyz123");

    @TempDir
    Path dir;

    private MorphAnalyzer analyzer;

    @BeforeEach
    void setUp() throws IOException {
        analyzer = MorphAnalyzer.withBaseLexicon(AnalyzerConfig.defaults());
        analyzer.forceLearn("갔다", List.of(Morph.of("가", "VV", "가다"), Morph.of("았", "EP"), Morph.of("다", "EF")));
        analyzer.store().remove("늘", "MAG");
        analyzer.setTransition("NNG", "JKO", -22);
    }

    private Path save() throws IOException {
        Path path = dir.resolve("dict.klgm");
        analyzer.save(path, Map.of("source", "unit-test"));
        return path;
    }

    @Test
    void testRoundTrip() throws IOException {
        Path path = save();
        MorphAnalyzer loaded = MorphAnalyzer.load(path, AnalyzerConfig.defaults());

        for (String sentence : SENTENCES) {
            assertEquals(analyzer.analyze(sentence), loaded.analyze(sentence), sentence);
            assertEquals(analyzer.analyzePath(sentence).totalCost(), loaded.analyzePath(sentence).totalCost());
        }
        assertEquals(analyzer.store().size(), loaded.store().size());
        assertEquals(analyzer.stats().posDistribution(), loaded.stats().posDistribution());
        assertEquals(-22, loaded.transitions().cost("NNG", "JKO"));
        assertEquals(1000, loaded.transitions().cost("EF", "EF"));

        for (DictionaryEntry entry : analyzer.store().entries()) {
            DictionaryEntry copy = loaded.store().entry(entry.id());
            assertNotNull(copy, entry.toString());
            assertEquals(entry.surface(), copy.surface());
            assertEquals(entry.pos(), copy.pos());
            assertEquals(entry.lemma(), copy.lemma());
            assertEquals(entry.cost(), copy.cost());
        }
        loaded.store().verifyIntegrity();
    }

    @Test
    void testRetiredIdsAndCompoundsSurvive() throws IOException {
        assertNull(analyzer.store().find("늘", "MAG"));
        Path path = save();
        DictionaryStore store = DictionaryContainer.read(path).store();

        assertNull(store.find("늘", "MAG"));
        DictionaryEntry compound = store.find("갔다", "VV+EP+EF");
        assertNotNull(compound);
        assertEquals(3, compound.components().size());
        assertEquals("가다", compound.components().get(0).lemma());

        // ids keep their slots, so the next registration does not reuse the retired one
        DictionaryEntry added = store.getOrCreate("새말", "NNG", null, 0);
        assertEquals(analyzer.store().getOrCreate("새말", "NNG", null, 0).id(), added.id());
    }

    @Test
    void testMetadata() throws IOException {
        Map<String, String> metadata = DictionaryContainer.read(save()).metadata();
        assertEquals("1.0", metadata.get("format"));
        assertEquals("unit-test", metadata.get("source"));
        assertEquals(Integer.toString(analyzer.store().size()), metadata.get("entries"));
    }

    @Test
    void testNoTemporaryFilesLeft() throws IOException {
        save();
        save();
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void testCorruptPayloadRejected() throws IOException {
        Path path = save();
        byte[] bytes = Files.readAllBytes(path);
        bytes[bytes.length - 3] ^= 0x5A;
        Files.write(path, bytes);

        DictionaryFormatException e = assertThrows(DictionaryFormatException.class, () -> DictionaryContainer.read(path));
        assertTrue(e.getMessage().contains("Checksum"), e.getMessage());
    }

    @Test
    void testBadMagicRejected() throws IOException {
        Path path = save();
        byte[] bytes = Files.readAllBytes(path);
        bytes[0] = 'X';
        Files.write(path, bytes);
        assertThrows(DictionaryFormatException.class, () -> DictionaryContainer.read(path));
    }

    @Test
    void testNewerVersionRejected() throws IOException {
        Path path = save();
        byte[] bytes = Files.readAllBytes(path);
        bytes[4] = 2;
        Files.write(path, bytes);
        assertThrows(DictionaryFormatException.class, () -> DictionaryContainer.read(path));

        bytes[4] = 1;
        bytes[5] = 1;
        Files.write(path, bytes);
        assertThrows(DictionaryFormatException.class, () -> DictionaryContainer.read(path));
    }

    @Test
    void testTruncatedFileRejected() throws IOException {
        Path path = save();
        byte[] bytes = Files.readAllBytes(path);
        Files.write(path, Arrays.copyOf(bytes, bytes.length - 10));
        assertThrows(DictionaryFormatException.class, () -> DictionaryContainer.read(path));

        Files.write(path, Arrays.copyOf(bytes, 10));
        assertThrows(DictionaryFormatException.class, () -> DictionaryContainer.read(path));
    }

    @Test
    void testTrailingBytesRejectedEvenWithValidChecksums() throws IOException {
        Path path = save();
        byte[][] payloads = DictionaryContainer.sections(Files.readAllBytes(path));
        payloads[1] = Arrays.copyOf(payloads[1], payloads[1].length + 1);
        Files.write(path, DictionaryContainer.assemble(payloads));

        DictionaryFormatException e = assertThrows(DictionaryFormatException.class, () -> DictionaryContainer.read(path));
        assertTrue(e.getMessage().contains("trailing"), e.getMessage());
    }

    @Test
    void testFailedReloadKeepsCurrentDictionary() throws IOException {
        Path path = save();
        byte[] bytes = Files.readAllBytes(path);
        bytes[bytes.length / 2] ^= 0x01;
        Files.write(path, bytes);

        DictionaryStore before = analyzer.store();
        List<Morph> analysis = analyzer.analyze("친구가 학교에서");
        assertThrows(DictionaryFormatException.class, () -> analyzer.reload(path));
        assertSame(before, analyzer.store());
        assertEquals(analysis, analyzer.analyze("친구가 학교에서"));
    }

    @Test
    void testReloadSwapsDictionary() throws IOException {
        Path path = save();
        MorphAnalyzer empty = MorphAnalyzer.create(new DictionaryStore(), TransitionCostTable.of(10, 0),
            AnalyzerConfig.defaults());
        List<Morph> unknown = empty.analyze("친구가");
        assertEquals(1, unknown.size());

        empty.reload(path);
        assertEquals(analyzer.analyze("친구가"), empty.analyze("친구가"));
        assertEquals(analyzer.store().size(), empty.store().size());

        // learning continues against the reloaded dictionary
        empty.learn("친구가", List.of(Morph.of("친", "NNG"), Morph.of("구가", "NNG")));
        assertNotNull(empty.store().find("구가", "NNG"));
        assertNull(analyzer.store().find("구가", "NNG"));
    }
}
