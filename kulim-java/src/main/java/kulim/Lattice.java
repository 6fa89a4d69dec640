package kulim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Candidate morphemes of one text, as a DAG with implicit edges: a node ending
 * at {@code p} connects to every node starting at {@code p}.
 *
 * Nodes are ordered by start position, so every predecessor of a node comes
 * before it.
 */
public final class Lattice {

    private static final int[] NONE = new int[0];

    private final String text;
    private final List<LatticeNode> nodes;
    private final LatticeNode bos;
    private final LatticeNode eos;
    private final int[][] startsAt;
    private final int[][] endsAt;

    Lattice(String text, List<LatticeNode> nodes) {
        this.text = text;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        int n = text.length();
        this.bos = new LatticeNode(-1, 0, 0, DictionaryEntry.synthetic("", PosTags.BOS, 0), 0);
        this.eos = new LatticeNode(-1, n, n, DictionaryEntry.synthetic("", PosTags.EOS, 0), 0);

        int[] startCounts = new int[n + 1];
        int[] endCounts = new int[n + 1];
        int previousStart = 0;
        for (int i = 0; i < nodes.size(); i++) {
            LatticeNode node = nodes.get(i);
            if (node.index() != i) {
                throw new IllegalArgumentException("Node " + node + " has index " + node.index() + ", expected " + i);
            }
            if (node.start() < previousStart || node.start() >= node.end() || node.end() > n) {
                throw new IllegalArgumentException("Node " + node + " is out of order or out of bounds");
            }
            previousStart = node.start();
            startCounts[node.start()]++;
            endCounts[node.end()]++;
        }
        this.startsAt = new int[n + 1][];
        this.endsAt = new int[n + 1][];
        for (int p = 0; p <= n; p++) {
            startsAt[p] = startCounts[p] == 0 ? NONE : new int[startCounts[p]];
            endsAt[p] = endCounts[p] == 0 ? NONE : new int[endCounts[p]];
            startCounts[p] = 0;
            endCounts[p] = 0;
        }
        for (LatticeNode node : nodes) {
            startsAt[node.start()][startCounts[node.start()]++] = node.index();
            endsAt[node.end()][endCounts[node.end()]++] = node.index();
        }
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public List<LatticeNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public LatticeNode node(int index) {
        return nodes.get(index);
    }

    /**
     * Virtual start node: position 0, tag {@code BOS}.
     */
    public LatticeNode bos() {
        return bos;
    }

    /**
     * Virtual end node: position {@link #length()}, tag {@code EOS}.
     */
    public LatticeNode eos() {
        return eos;
    }

    public List<LatticeNode> nodesStartingAt(int position) {
        return resolve(startsAt[position]);
    }

    public List<LatticeNode> nodesEndingAt(int position) {
        return resolve(endsAt[position]);
    }

    /**
     * Indices of the nodes ending at {@code position}; the returned array must not be modified.
     */
    int[] endingAt(int position) {
        return endsAt[position];
    }

    private List<LatticeNode> resolve(int[] indices) {
        List<LatticeNode> resolved = new ArrayList<>(indices.length);
        for (int index : indices) {
            resolved.add(nodes.get(index));
        }
        return resolved;
    }

    @Override
    public String toString() {
        return "Lattice(" + text.length() + " chars, " + nodes.size() + " nodes)";
    }
}
