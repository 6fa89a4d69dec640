package kulim;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Prefix tree over surface forms.
 *
 * Nodes live in a growable pool and are addressed by int id (the root is 0).
 * Children are kept as sorted label/target arrays searched by binary search;
 * once a node's fan-out reaches {@link #DENSE_THRESHOLD} it also gets a dense
 * table indexed by {@code label - denseBase}, so a character step never costs
 * more than a binary search over the alphabet.
 *
 * Positions are UTF-16 offsets, like {@link String#substring}.
 * Not thread-safe: {@link DictionaryStore} guards it with its read/write lock.
 */
final class TrieIndex {

    static final int DENSE_THRESHOLD = 48;

    private static final int ROOT = 0;
    private static final int INITIAL_POOL_SIZE = 1024;
    private static final char[] NO_LABELS = new char[0];
    private static final int[] NO_TARGETS = new int[0];
    private static final DictionaryEntry[] NO_ENTRIES = new DictionaryEntry[0];

    private Node[] pool;
    private int size;
    private int entryCount;

    TrieIndex() {
        this(INITIAL_POOL_SIZE);
    }

    TrieIndex(int capacity) {
        this.pool = new Node[Math.max(capacity, 1)];
        this.pool[ROOT] = new Node();
        this.size = 1;
    }

    /**
     * Adds the entry's surface path if absent and appends the entry to the terminal node.
     *
     * @throws EntryConflictException if an entry with the same (surface, pos) already terminates there
     */
    void insert(DictionaryEntry entry) {
        String surface = entry.surface();
        int node = ROOT;
        for (int i = 0; i < surface.length(); i++) {
            node = getOrCreateChild(node, surface.charAt(i));
        }
        Node terminal = pool[node];
        for (DictionaryEntry existing : terminal.entries) {
            if (existing.matches(surface, entry.pos())) {
                throw new EntryConflictException("Duplicate trie entry " + surface + "/" + entry.pos());
            }
        }
        // Copy-on-write: arrays handed out by lookups are never mutated
        DictionaryEntry[] grown = Arrays.copyOf(terminal.entries, terminal.entries.length + 1);
        grown[grown.length - 1] = entry;
        terminal.entries = grown;
        entryCount++;
    }

    /**
     * Removes the entry; the path stays even if no entry terminates there any more.
     */
    DictionaryEntry remove(String surface, String pos) {
        int node = find(surface);
        if (node < 0) return null;
        Node terminal = pool[node];
        for (int i = 0; i < terminal.entries.length; i++) {
            DictionaryEntry candidate = terminal.entries[i];
            if (candidate.matches(surface, pos)) {
                DictionaryEntry[] shrunk = new DictionaryEntry[terminal.entries.length - 1];
                System.arraycopy(terminal.entries, 0, shrunk, 0, i);
                System.arraycopy(terminal.entries, i + 1, shrunk, i, shrunk.length - i);
                terminal.entries = shrunk.length == 0 ? NO_ENTRIES : shrunk;
                entryCount--;
                return candidate;
            }
        }
        return null;
    }

    /**
     * All homographs stored under exactly this surface form.
     */
    List<DictionaryEntry> entriesAt(String surface) {
        int node = find(surface);
        if (node < 0) return Collections.emptyList();
        return asList(pool[node].entries);
    }

    /**
     * Every match starting at {@code start}, shortest first. Nothing is truncated:
     * the caller decides which spans to keep.
     */
    List<PrefixMatch> lookupPrefixes(CharSequence text, int start) {
        List<PrefixMatch> matches = new ArrayList<>();
        int node = ROOT;
        int n = text.length();
        for (int i = start; i < n; i++) {
            node = child(node, text.charAt(i));
            if (node < 0) break;
            DictionaryEntry[] entries = pool[node].entries;
            if (entries.length > 0) {
                matches.add(new PrefixMatch(i + 1, asList(entries)));
            }
        }
        return matches;
    }

    int nodeCount() {
        return size;
    }

    int entryCount() {
        return entryCount;
    }

    private int find(String surface) {
        int node = ROOT;
        for (int i = 0; i < surface.length() && node >= 0; i++) {
            node = child(node, surface.charAt(i));
        }
        return node;
    }

    private int child(int node, char c) {
        Node n = pool[node];
        if (n.dense != null) {
            int slot = c - n.denseBase;
            return slot >= 0 && slot < n.dense.length ? n.dense[slot] - 1 : -1;
        }
        int i = Arrays.binarySearch(n.labels, 0, n.childCount, c);
        return i >= 0 ? n.targets[i] : -1;
    }

    private int getOrCreateChild(int node, char c) {
        int existing = child(node, c);
        if (existing >= 0) return existing;
        int created = allocate();
        link(node, c, created);
        return created;
    }

    private int allocate() {
        if (size == pool.length) {
            pool = Arrays.copyOf(pool, pool.length * 2);
        }
        pool[size] = new Node();
        return size++;
    }

    private void link(int parent, char c, int target) {
        Node n = pool[parent];
        int i = -(Arrays.binarySearch(n.labels, 0, n.childCount, c) + 1);
        if (n.childCount == n.labels.length) {
            int capacity = Math.max(2, n.labels.length * 2);
            n.labels = Arrays.copyOf(n.labels, capacity);
            n.targets = Arrays.copyOf(n.targets, capacity);
        }
        System.arraycopy(n.labels, i, n.labels, i + 1, n.childCount - i);
        System.arraycopy(n.targets, i, n.targets, i + 1, n.childCount - i);
        n.labels[i] = c;
        n.targets[i] = target;
        n.childCount++;
        if (n.childCount >= DENSE_THRESHOLD) {
            rebuildDense(n);
        }
    }

    private static void rebuildDense(Node n) {
        char lo = n.labels[0];
        char hi = n.labels[n.childCount - 1];
        int[] dense = new int[hi - lo + 1];
        for (int i = 0; i < n.childCount; i++) {
            // stored +1 so that 0 means "no child"
            dense[n.labels[i] - lo] = n.targets[i] + 1;
        }
        n.denseBase = lo;
        n.dense = dense;
    }

    private static List<DictionaryEntry> asList(DictionaryEntry[] entries) {
        return entries.length == 0 ? Collections.emptyList() : Collections.unmodifiableList(Arrays.asList(entries));
    }

    // --- Serialization (used by DictionaryContainer) ---

    /**
     * Writes the node pool: for every node its children (label, target) and the ids of its entries.
     */
    void writeTo(DataOutputStream out) throws IOException {
        out.writeInt(size);
        for (int id = 0; id < size; id++) {
            Node n = pool[id];
            out.writeInt(n.childCount);
            for (int i = 0; i < n.childCount; i++) {
                out.writeChar(n.labels[i]);
                out.writeInt(n.targets[i]);
            }
            out.writeInt(n.entries.length);
            for (DictionaryEntry entry : n.entries) {
                out.writeInt(entry.id());
            }
        }
    }

    /**
     * Rebuilds a trie from {@link #writeTo} output, resolving entry ids against {@code entries}.
     * Structural problems are reported as {@link DictionaryFormatException}.
     */
    static TrieIndex readFrom(DataInputStream in, List<DictionaryEntry> entries) throws IOException {
        int nodeCount = in.readInt();
        if (nodeCount < 1) {
            throw new DictionaryFormatException("Trie section has " + nodeCount + " nodes");
        }
        TrieIndex trie = new TrieIndex(nodeCount);
        for (int id = 1; id < nodeCount; id++) {
            trie.pool[id] = new Node();
        }
        trie.size = nodeCount;
        boolean[] referenced = new boolean[nodeCount];
        for (int id = 0; id < nodeCount; id++) {
            Node n = trie.pool[id];
            int childCount = in.readInt();
            if (childCount < 0 || childCount > nodeCount) {
                throw new DictionaryFormatException("Trie node " + id + " has " + childCount + " children");
            }
            n.labels = childCount == 0 ? NO_LABELS : new char[childCount];
            n.targets = childCount == 0 ? NO_TARGETS : new int[childCount];
            for (int i = 0; i < childCount; i++) {
                char label = in.readChar();
                int target = in.readInt();
                if (target <= 0 || target >= nodeCount || referenced[target]) {
                    throw new DictionaryFormatException("Trie node " + id + " has invalid child " + target);
                }
                if (i > 0 && label <= n.labels[i - 1]) {
                    throw new DictionaryFormatException("Trie node " + id + " children are not sorted");
                }
                referenced[target] = true;
                n.labels[i] = label;
                n.targets[i] = target;
            }
            n.childCount = childCount;
            if (childCount >= DENSE_THRESHOLD) {
                rebuildDense(n);
            }
            int terminalCount = in.readInt();
            if (terminalCount < 0 || terminalCount > entries.size()) {
                throw new DictionaryFormatException("Trie node " + id + " has " + terminalCount + " entries");
            }
            DictionaryEntry[] terminal = terminalCount == 0 ? NO_ENTRIES : new DictionaryEntry[terminalCount];
            for (int i = 0; i < terminalCount; i++) {
                int entryId = in.readInt();
                if (entryId < 0 || entryId >= entries.size() || entries.get(entryId) == null) {
                    throw new DictionaryFormatException("Trie node " + id + " references unknown entry " + entryId);
                }
                terminal[i] = entries.get(entryId);
            }
            n.entries = terminal;
            trie.entryCount += terminalCount;
        }
        return trie;
    }

    private static final class Node {
        char[] labels = NO_LABELS;
        int[] targets = NO_TARGETS;
        int childCount;
        int[] dense;
        char denseBase;
        DictionaryEntry[] entries = NO_ENTRIES;
    }
}
