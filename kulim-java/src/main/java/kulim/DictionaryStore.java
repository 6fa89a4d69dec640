package kulim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Morpheme dictionary: a {@link TrieIndex} for prefix queries plus an id-indexed
 * entry table for cost updates without a trie walk.
 *
 * Many readers, one writer. A lattice is built inside {@link #read} so it sees
 * one consistent state; a learning batch runs inside {@link #write} so readers
 * observe it either entirely or not at all. Single cost adjustments are atomic
 * on their own (see {@link DictionaryEntry}).
 */
public final class DictionaryStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong version = new AtomicLong();

    private final List<DictionaryEntry> entries;
    private TrieIndex trie;
    private int maxSurfaceLength;

    public DictionaryStore() {
        this(new ArrayList<>(), new TrieIndex());
    }

    private DictionaryStore(List<DictionaryEntry> entries, TrieIndex trie) {
        this.entries = entries;
        this.trie = trie;
        for (DictionaryEntry entry : entries) {
            if (entry != null) {
                maxSurfaceLength = Math.max(maxSurfaceLength, entry.surface().length());
            }
        }
    }

    /**
     * Assembles a store from a deserialized entry table and trie.
     */
    static DictionaryStore restore(List<DictionaryEntry> entries, TrieIndex trie) {
        DictionaryStore store = new DictionaryStore(new ArrayList<>(entries), trie);
        store.verifyIntegrity();
        return store;
    }

    /**
     * Runs {@code action} under the read lock.
     */
    public <T> T read(Function<? super DictionaryStore, T> action) {
        lock.readLock().lock();
        try {
            return action.apply(this);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs {@code action} under the write lock; concurrent readers see all of its changes or none.
     */
    public <T> T write(Function<? super DictionaryStore, T> action) {
        lock.writeLock().lock();
        try {
            return action.apply(this);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the entry for {@code (surface, pos)}, registering it with
     * {@code defaultCost} if absent.
     */
    public DictionaryEntry getOrCreate(String surface, String pos, String lemma, int defaultCost) {
        return getOrCreate(surface, pos, lemma, defaultCost, null);
    }

    DictionaryEntry getOrCreate(String surface, String pos, String lemma, int defaultCost, List<Morph> components) {
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(pos, "pos");
        if (surface.isEmpty()) {
            throw new IllegalArgumentException("Empty surface form");
        }
        lock.writeLock().lock();
        try {
            DictionaryEntry existing = findEntry(surface, pos);
            if (existing != null) {
                return existing;
            }
            DictionaryEntry entry = new DictionaryEntry(entries.size(), surface, pos, lemma, defaultCost, components);
            trie.insert(entry);
            entries.add(entry);
            maxSurfaceLength = Math.max(maxSurfaceLength, surface.length());
            version.incrementAndGet();
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public DictionaryEntry find(String surface, String pos) {
        lock.readLock().lock();
        try {
            return findEntry(surface, pos);
        } finally {
            lock.readLock().unlock();
        }
    }

    public DictionaryEntry entry(int id) {
        lock.readLock().lock();
        try {
            return id >= 0 && id < entries.size() ? entries.get(id) : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All homographs of {@code surface}, in registration order.
     */
    public List<DictionaryEntry> entriesAt(String surface) {
        lock.readLock().lock();
        try {
            return trie.entriesAt(surface);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<PrefixMatch> lookupPrefixes(CharSequence text, int start) {
        lock.readLock().lock();
        try {
            return trie.lookupPrefixes(text, start);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Adds {@code delta} to an entry's cost. Returns the previous cost.
     */
    public int adjustCost(int id, int delta) {
        return adjustCost(id, delta, Integer.MIN_VALUE);
    }

    /**
     * Adds {@code delta} to an entry's cost; decreases stop at {@code floor}. Returns the previous cost.
     */
    public int adjustCost(int id, int delta, int floor) {
        lock.writeLock().lock();
        try {
            int previous = requireEntry(id).adjustCost(delta, floor);
            version.incrementAndGet();
            return previous;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces an entry's cost. Returns the previous cost.
     */
    public int setCost(int id, int cost) {
        lock.writeLock().lock();
        try {
            int previous = requireEntry(id).setCost(cost);
            version.incrementAndGet();
            return previous;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes {@code (surface, pos)}. Its id is retired, never reused.
     */
    public DictionaryEntry remove(String surface, String pos) {
        lock.writeLock().lock();
        try {
            DictionaryEntry removed = trie.remove(surface, pos);
            if (removed == null) {
                return null;
            }
            if (entries.get(removed.id()) != removed) {
                throw new EntryConflictException("Entry table slot " + removed.id() + " does not hold " + removed);
            }
            entries.set(removed.id(), null);
            version.incrementAndGet();
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Undoes the registration of {@code entry}. When it holds the last id that
     * slot is released, so undoing the newest insertions first leaves the id
     * table as it was. Any other id is retired as in {@link #remove}.
     */
    void discard(DictionaryEntry entry) {
        lock.writeLock().lock();
        try {
            if (remove(entry.surface(), entry.pos()) != entry) {
                throw new EntryConflictException("Cannot discard " + entry + ", it is not registered");
            }
            if (entry.id() == entries.size() - 1) {
                entries.remove(entries.size() - 1);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Live entries in id order.
     */
    public List<DictionaryEntry> entries() {
        lock.readLock().lock();
        try {
            List<DictionaryEntry> live = new ArrayList<>(entries.size());
            for (DictionaryEntry entry : entries) {
                if (entry != null) live.add(entry);
            }
            return Collections.unmodifiableList(live);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return trie.entryCount();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Length of the longest registered surface form, in UTF-16 units.
     */
    public int maxSurfaceLength() {
        lock.readLock().lock();
        try {
            return maxSurfaceLength;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Incremented by every mutation; lets caches detect stale results.
     */
    public long version() {
        return version.get();
    }

    public Stats stats() {
        lock.readLock().lock();
        try {
            Map<String, Integer> byPos = new TreeMap<>();
            int live = 0;
            for (DictionaryEntry entry : entries) {
                if (entry == null) continue;
                live++;
                byPos.merge(entry.pos(), 1, Integer::sum);
            }
            return new Stats(live, trie.nodeCount(), maxSurfaceLength, byPos);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Cross-checks the id table against the trie.
     *
     * @throws EntryConflictException if the two views disagree
     */
    public void verifyIntegrity() {
        lock.readLock().lock();
        try {
            int live = 0;
            for (int id = 0; id < entries.size(); id++) {
                DictionaryEntry entry = entries.get(id);
                if (entry == null) continue;
                live++;
                if (entry.id() != id) {
                    throw new EntryConflictException("Entry " + entry + " stored at slot " + id + " but has id " + entry.id());
                }
                int found = 0;
                for (DictionaryEntry candidate : trie.entriesAt(entry.surface())) {
                    if (candidate.matches(entry.surface(), entry.pos())) {
                        found++;
                        if (candidate != entry) {
                            throw new EntryConflictException("Trie and id table hold different objects for " + entry);
                        }
                    }
                }
                if (found != 1) {
                    throw new EntryConflictException("Entry " + entry + " found " + found + " times in the trie");
                }
            }
            if (live != trie.entryCount()) {
                throw new EntryConflictException("Id table has " + live + " entries, trie has " + trie.entryCount());
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    TrieIndex trie() {
        return trie;
    }

    /**
     * Raw id table including retired (null) slots, for serialization.
     */
    List<DictionaryEntry> slots() {
        return Collections.unmodifiableList(entries);
    }

    private DictionaryEntry findEntry(String surface, String pos) {
        for (DictionaryEntry entry : trie.entriesAt(surface)) {
            if (entry.pos().equals(pos)) {
                return entry;
            }
        }
        return null;
    }

    private DictionaryEntry requireEntry(int id) {
        DictionaryEntry entry = id >= 0 && id < entries.size() ? entries.get(id) : null;
        if (entry == null) {
            throw new IllegalArgumentException("No dictionary entry with id " + id);
        }
        return entry;
    }

    /**
     * Dictionary statistics: entry and node counts and the POS distribution.
     */
    public static final class Stats {
        private final int entries;
        private final int nodes;
        private final int maxSurfaceLength;
        private final Map<String, Integer> posDistribution;

        Stats(int entries, int nodes, int maxSurfaceLength, Map<String, Integer> posDistribution) {
            this.entries = entries;
            this.nodes = nodes;
            this.maxSurfaceLength = maxSurfaceLength;
            this.posDistribution = Collections.unmodifiableMap(posDistribution);
        }

        public int entries() {
            return entries;
        }

        public int nodes() {
            return nodes;
        }

        public int maxSurfaceLength() {
            return maxSurfaceLength;
        }

        public Map<String, Integer> posDistribution() {
            return posDistribution;
        }
    }
}
