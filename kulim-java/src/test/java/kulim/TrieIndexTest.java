package kulim;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the prefix tree.
 */
public class TrieIndexTest {

    private static DictionaryEntry entry(int id, String surface, String pos) {
        return new DictionaryEntry(id, surface, pos, surface, 0, null);
    }

    @Test
    void testLookupPrefixesShortestFirst() {
        TrieIndex trie = new TrieIndex();
        trie.insert(entry(0, "학교", "NNG"));
        trie.insert(entry(1, "학", "XPN"));
        trie.insert(entry(2, "학교에서", "NNG"));

        List<PrefixMatch> matches = trie.lookupPrefixes("학교에서는", 0);
        assertEquals(3, matches.size());
        assertEquals(1, matches.get(0).end());
        assertEquals(2, matches.get(1).end());
        assertEquals(4, matches.get(2).end());
        assertEquals("학교에서", matches.get(2).entries().get(0).surface());
    }

    @Test
    void testLookupFromOffset() {
        TrieIndex trie = new TrieIndex();
        trie.insert(entry(0, "가", "JKS"));

        List<PrefixMatch> matches = trie.lookupPrefixes("친구가", 2);
        assertEquals(1, matches.size());
        assertEquals(3, matches.get(0).end());
        assertTrue(trie.lookupPrefixes("친구가", 0).isEmpty());
    }

    @Test
    void testHomographsKeepRegistrationOrder() {
        TrieIndex trie = new TrieIndex();
        trie.insert(entry(0, "가", "VV"));
        trie.insert(entry(1, "가", "JKS"));

        List<DictionaryEntry> homographs = trie.entriesAt("가");
        assertEquals(2, homographs.size());
        assertEquals("VV", homographs.get(0).pos());
        assertEquals("JKS", homographs.get(1).pos());
        assertEquals(2, trie.lookupPrefixes("가", 0).get(0).entries().size());
    }

    @Test
    void testDuplicateInsertRejected() {
        TrieIndex trie = new TrieIndex();
        trie.insert(entry(0, "책", "NNG"));
        assertThrows(EntryConflictException.class, () -> trie.insert(entry(1, "책", "NNG")));
        assertEquals(1, trie.entryCount());
    }

    @Test
    void testRemoveKeepsLongerWords() {
        TrieIndex trie = new TrieIndex();
        trie.insert(entry(0, "ab", "X"));
        trie.insert(entry(1, "abc", "X"));
        int nodes = trie.nodeCount();

        assertNotNull(trie.remove("ab", "X"));
        assertNull(trie.remove("ab", "X"));
        assertTrue(trie.entriesAt("ab").isEmpty());

        List<PrefixMatch> matches = trie.lookupPrefixes("abc", 0);
        assertEquals(1, matches.size());
        assertEquals(3, matches.get(0).end());
        assertEquals(nodes, trie.nodeCount());
        assertEquals(1, trie.entryCount());
    }

    @Test
    void testLookupResultsUnaffectedByLaterInsert() {
        TrieIndex trie = new TrieIndex();
        trie.insert(entry(0, "가", "VV"));
        List<DictionaryEntry> before = trie.entriesAt("가");
        trie.insert(entry(1, "가", "JKS"));
        assertEquals(1, before.size());
        assertEquals(2, trie.entriesAt("가").size());
    }

    @Test
    void testWideFanOut() {
        TrieIndex trie = new TrieIndex();
        List<String> words = new ArrayList<>();
        for (int i = 0; i < TrieIndex.DENSE_THRESHOLD + 12; i++) {
            // every third ideograph, so the dense table has holes
            String word = String.valueOf((char) (0x4E00 + i * 3));
            words.add(word);
            trie.insert(entry(i, word, "SH"));
        }
        for (String word : words) {
            assertEquals(1, trie.lookupPrefixes(word, 0).size(), word);
        }
        assertTrue(trie.lookupPrefixes(String.valueOf((char) 0x4E01), 0).isEmpty());
        assertTrue(trie.lookupPrefixes("a", 0).isEmpty());
        assertTrue(trie.lookupPrefixes(String.valueOf((char) 0x9FFF), 0).isEmpty());
    }

    @Test
    void testSerializedTrieAnswersSameQueries() throws IOException {
        List<DictionaryEntry> entries = new ArrayList<>();
        entries.add(entry(0, "학교", "NNG"));
        entries.add(entry(1, "학", "XPN"));
        entries.add(entry(2, "가", "VV"));
        entries.add(entry(3, "가", "JKS"));
        TrieIndex trie = new TrieIndex();
        for (DictionaryEntry e : entries) {
            trie.insert(e);
        }

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        trie.writeTo(new DataOutputStream(bytes));
        TrieIndex copy = TrieIndex.readFrom(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())), entries);

        assertEquals(trie.nodeCount(), copy.nodeCount());
        assertEquals(4, copy.entryCount());
        assertEquals(2, copy.lookupPrefixes("학교", 0).size());
        assertSame(entries.get(3), copy.entriesAt("가").get(1));
    }

    @Test
    void testReadRejectsUnknownEntryId() throws IOException {
        List<DictionaryEntry> entries = new ArrayList<>();
        entries.add(entry(0, "가", "VV"));
        TrieIndex trie = new TrieIndex();
        trie.insert(entries.get(0));

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        trie.writeTo(new DataOutputStream(bytes));
        List<DictionaryEntry> retired = new ArrayList<>();
        retired.add(null);

        assertThrows(DictionaryFormatException.class, () ->
            TrieIndex.readFrom(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())), retired));
    }
}
