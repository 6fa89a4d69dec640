package kulim;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded LRU cache of analyses.
 *
 * Each result is stamped with the model it came from and the dictionary
 * version at the time; a lookup under any other stamp misses, so learning,
 * transition updates and reloads never serve stale analyses.
 */
final class AnalysisCache {

    private final int capacity;
    private final Map<String, Cached> entries;
    private long hits;
    private long misses;

    AnalysisCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Cached> eldest) {
                return size() > AnalysisCache.this.capacity;
            }
        };
    }

    synchronized List<Morph> get(String text, Object model, long version) {
        Cached cached = entries.get(text);
        if (cached == null || cached.model != model || cached.version != version) {
            misses++;
            return null;
        }
        hits++;
        return cached.morphs;
    }

    synchronized void put(String text, Object model, long version, List<Morph> morphs) {
        entries.put(text, new Cached(model, version, morphs));
    }

    synchronized void clear() {
        entries.clear();
    }

    synchronized int size() {
        return entries.size();
    }

    synchronized double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    private static final class Cached {
        final Object model;
        final long version;
        final List<Morph> morphs;

        Cached(Object model, long version, List<Morph> morphs) {
            this.model = model;
            this.version = version;
            this.morphs = morphs;
        }
    }
}
