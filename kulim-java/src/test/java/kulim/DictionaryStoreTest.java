package kulim;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class DictionaryStoreTest {

    @Test
    void testGetOrCreateAssignsDenseIds() {
        DictionaryStore store = new DictionaryStore();
        DictionaryEntry a = store.getOrCreate("친구", "NNG", null, -35);
        DictionaryEntry b = store.getOrCreate("가", "JKS", "가", -5);
        DictionaryEntry again = store.getOrCreate("친구", "NNG", null, 99);

        assertEquals(0, a.id());
        assertEquals(1, b.id());
        assertSame(a, again);
        assertEquals(-35, again.cost());
        assertEquals("친구", a.lemma());
        assertEquals(2, store.size());
        assertEquals(2, store.maxSurfaceLength());
    }

    @Test
    void testEmptySurfaceRejected() {
        DictionaryStore store = new DictionaryStore();
        assertThrows(IllegalArgumentException.class, () -> store.getOrCreate("", "NNG", null, 0));
    }

    @Test
    void testHomographs() {
        DictionaryStore store = new DictionaryStore();
        store.getOrCreate("가", "VV", "가다", 15);
        store.getOrCreate("가", "JKS", "가", -5);

        assertEquals(2, store.entriesAt("가").size());
        assertEquals("가다", store.find("가", "VV").lemma());
        assertNull(store.find("가", "NNG"));
    }

    @Test
    void testAdjustCostReturnsPreviousAndRespectsFloor() {
        DictionaryStore store = new DictionaryStore();
        DictionaryEntry e = store.getOrCreate("책", "NNG", null, 5);

        assertEquals(5, store.adjustCost(e.id(), 3));
        assertEquals(8, e.cost());
        assertEquals(8, store.adjustCost(e.id(), -20, 0));
        assertEquals(0, e.cost());
        assertEquals(0, store.setCost(e.id(), -5));
        // already below the floor: a decrease does not push further down
        store.adjustCost(e.id(), -1, 0);
        assertEquals(-5, e.cost());
        store.adjustCost(e.id(), 2, 0);
        assertEquals(-3, e.cost());
    }

    @Test
    void testAdjustUnknownIdRejected() {
        DictionaryStore store = new DictionaryStore();
        assertThrows(IllegalArgumentException.class, () -> store.adjustCost(3, 1));
    }

    @Test
    void testRemoveRetiresId() {
        DictionaryStore store = new DictionaryStore();
        DictionaryEntry a = store.getOrCreate("ab", "X", null, 1);
        store.getOrCreate("abc", "X", null, 1);

        assertSame(a, store.remove("ab", "X"));
        assertNull(store.entry(a.id()));
        assertEquals(1, store.size());
        assertEquals(1, store.entries().size());
        store.verifyIntegrity();

        DictionaryEntry readded = store.getOrCreate("ab", "X", null, 7);
        assertEquals(2, readded.id());
        assertEquals(7, readded.cost());
        store.verifyIntegrity();
    }

    @Test
    void testDiscardReleasesTrailingIds() {
        DictionaryStore store = new DictionaryStore();
        DictionaryEntry a = store.getOrCreate("a", "X", null, 1);
        DictionaryEntry b = store.getOrCreate("b", "X", null, 1);
        DictionaryEntry c = store.getOrCreate("c", "X", null, 1);

        // not the last id: retired like a removal
        store.discard(a);
        assertNull(store.find("a", "X"));
        assertEquals(3, store.getOrCreate("d", "X", null, 1).id());

        store.discard(store.find("d", "X"));
        store.discard(c);
        store.discard(b);
        assertEquals(0, store.size());
        store.verifyIntegrity();
        assertEquals(1, store.getOrCreate("e", "X", null, 1).id());

        assertThrows(EntryConflictException.class, () -> store.discard(b));
    }

    @Test
    void testVersionAdvancesOnEveryMutation() {
        DictionaryStore store = new DictionaryStore();
        long v0 = store.version();
        DictionaryEntry e = store.getOrCreate("책", "NNG", null, 5);
        long v1 = store.version();
        store.getOrCreate("책", "NNG", null, 5);
        assertEquals(v1, store.version());
        store.adjustCost(e.id(), 1);
        long v2 = store.version();
        store.remove("책", "NNG");

        assertTrue(v0 < v1);
        assertTrue(v1 < v2);
        assertTrue(v2 < store.version());
    }

    @Test
    void testStats() {
        DictionaryStore store = new DictionaryStore();
        store.getOrCreate("친구", "NNG", null, 0);
        store.getOrCreate("학교", "NNG", null, 0);
        store.getOrCreate("가", "JKS", null, 0);
        store.getOrCreate("선생님", "NNG", null, 0);

        DictionaryStore.Stats stats = store.stats();
        assertEquals(4, stats.entries());
        assertEquals(3, stats.maxSurfaceLength());
        assertEquals(Integer.valueOf(3), stats.posDistribution().get("NNG"));
        assertEquals(Integer.valueOf(1), stats.posDistribution().get("JKS"));
        assertTrue(stats.nodes() > 4);
    }

    @Test
    void testConcurrentCostUpdatesAreNotLost() throws Exception {
        DictionaryStore store = new DictionaryStore();
        DictionaryEntry e = store.getOrCreate("책", "NNG", null, 0);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1000; i++) {
                        store.adjustCost(e.id(), 1);
                        store.lookupPrefixes("책을", 0);
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdown();
        }
        assertEquals(8000, e.cost());
    }

    @Test
    void testWriteBatchSeesItsOwnChanges() {
        DictionaryStore store = new DictionaryStore();
        int cost = store.write(s -> {
            DictionaryEntry e = s.getOrCreate("책", "NNG", null, 5);
            s.adjustCost(e.id(), 2);
            return s.find("책", "NNG").cost();
        });
        assertEquals(7, cost);
    }
}
