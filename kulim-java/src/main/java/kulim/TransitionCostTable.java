package kulim;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cost of placing a morpheme tagged {@code next} right after one tagged {@code prev}.
 *
 * Lookup order: the exact pair; then, when either side is {@code BOS},
 * {@code EOS} or {@code SPACE}, the boundary cost; then the most specific class
 * rule ({@code N*} matches every tag starting with {@code N}, {@code *} matches
 * everything); then the default cost. Class rules never apply to boundary tags. Compound tags such as {@code VV+EP+EF}
 * are joined through their last component on the left and their first on the
 * right.
 *
 * Instances are immutable; {@link #with} returns an updated copy.
 */
public final class TransitionCostTable {

    public static final String RESOURCE = "/kulim/transitions.json";

    private static final char WILDCARD = '*';

    private final int defaultCost;
    private final int boundaryCost;
    private final Map<String, Map<String, Integer>> pairs;
    private final List<Rule> rules;

    private TransitionCostTable(int defaultCost, int boundaryCost,
                                Map<String, Map<String, Integer>> pairs, List<Rule> rules) {
        this.defaultCost = defaultCost;
        this.boundaryCost = boundaryCost;
        this.pairs = pairs;
        this.rules = rules;
    }

    public static TransitionCostTable of(int defaultCost, int boundaryCost) {
        return new TransitionCostTable(defaultCost, boundaryCost, Collections.emptyMap(), Collections.emptyList());
    }

    public static TransitionCostTable of(AnalyzerConfig config) {
        return of(config.defaultTransitionCost(), config.boundaryCost());
    }

    /**
     * Loads transitions from JSON of the form
     * {@code {"transitions": [{"prev": "N*", "next": "J*", "cost": -20}, ...]}}.
     */
    public static TransitionCostTable load(Reader reader, int defaultCost, int boundaryCost) throws IOException {
        TransitionFile file;
        try {
            file = new Gson().fromJson(reader, TransitionFile.class);
        } catch (JsonParseException e) {
            throw new IOException("Invalid transition table: " + e.getMessage(), e);
        }
        Builder builder = new Builder(of(defaultCost, boundaryCost));
        if (file != null && file.transitions != null) {
            for (TransitionFile.Transition t : file.transitions) {
                if (t.prev == null || t.next == null || t.cost == null) {
                    throw new IOException("Transition entry needs prev, next and cost");
                }
                builder.put(t.prev, t.next, t.cost);
            }
        }
        return builder.build();
    }

    /**
     * The bundled grammatical adjacency priors.
     */
    public static TransitionCostTable bundled(AnalyzerConfig config) throws IOException {
        try (InputStream in = TransitionCostTable.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing resource " + RESOURCE);
            }
            return load(new InputStreamReader(in, StandardCharsets.UTF_8),
                config.defaultTransitionCost(), config.boundaryCost());
        }
    }

    public int cost(String prev, String next) {
        String left = lastComponent(prev);
        String right = firstComponent(next);
        Map<String, Integer> row = pairs.get(left);
        if (row != null) {
            Integer exact = row.get(right);
            if (exact != null) return exact;
        }
        if (PosTags.isBoundary(left) || PosTags.isBoundary(right)) {
            return boundaryCost;
        }
        for (Rule rule : rules) {
            if (rule.matches(left, right)) return rule.cost;
        }
        return defaultCost;
    }

    /**
     * Copy of this table with {@code prev -> next} set to {@code cost}. Patterns
     * ending in {@code *} set a class rule.
     */
    public TransitionCostTable with(String prev, String next, int cost) {
        return new Builder(this).put(prev, next, cost).build();
    }

    public int defaultCost() {
        return defaultCost;
    }

    public int boundaryCost() {
        return boundaryCost;
    }

    /**
     * Number of exact pairs plus class rules.
     */
    public int size() {
        int n = rules.size();
        for (Map<String, Integer> row : pairs.values()) {
            n += row.size();
        }
        return n;
    }

    private static String lastComponent(String pos) {
        int i = pos.lastIndexOf(PosTags.COMPOUND_SEPARATOR);
        return i < 0 ? pos : pos.substring(i + 1);
    }

    private static String firstComponent(String pos) {
        int i = pos.indexOf(PosTags.COMPOUND_SEPARATOR);
        return i < 0 ? pos : pos.substring(0, i);
    }

    private static boolean isPattern(String tag) {
        return tag.indexOf(WILDCARD) >= 0;
    }

    // --- Serialization (used by DictionaryContainer) ---

    void writeTo(DataOutputStream out) throws IOException {
        out.writeInt(defaultCost);
        out.writeInt(boundaryCost);
        List<String[]> flat = new ArrayList<>();
        for (Map.Entry<String, Map<String, Integer>> row : pairs.entrySet()) {
            for (Map.Entry<String, Integer> cell : row.getValue().entrySet()) {
                flat.add(new String[] {row.getKey(), cell.getKey(), Integer.toString(cell.getValue())});
            }
        }
        // stable output for identical tables
        flat.sort((a, b) -> a[0].equals(b[0]) ? a[1].compareTo(b[1]) : a[0].compareTo(b[0]));
        out.writeInt(flat.size());
        for (String[] pair : flat) {
            out.writeUTF(pair[0]);
            out.writeUTF(pair[1]);
            out.writeInt(Integer.parseInt(pair[2]));
        }
        out.writeInt(rules.size());
        for (Rule rule : rules) {
            out.writeUTF(rule.prev);
            out.writeUTF(rule.next);
            out.writeInt(rule.cost);
        }
    }

    static TransitionCostTable readFrom(DataInputStream in) throws IOException {
        int defaultCost = in.readInt();
        int boundaryCost = in.readInt();
        Builder builder = new Builder(of(defaultCost, boundaryCost));
        int pairCount = in.readInt();
        if (pairCount < 0) {
            throw new DictionaryFormatException("Negative transition pair count " + pairCount);
        }
        for (int i = 0; i < pairCount; i++) {
            String prev = in.readUTF();
            String next = in.readUTF();
            int cost = in.readInt();
            if (isPattern(prev) || isPattern(next)) {
                throw new DictionaryFormatException("Transition pair " + prev + "->" + next + " is a pattern");
            }
            builder.put(prev, next, cost);
        }
        int ruleCount = in.readInt();
        if (ruleCount < 0) {
            throw new DictionaryFormatException("Negative transition rule count " + ruleCount);
        }
        for (int i = 0; i < ruleCount; i++) {
            String prev = in.readUTF();
            String next = in.readUTF();
            int cost = in.readInt();
            if (!isPattern(prev) && !isPattern(next)) {
                throw new DictionaryFormatException("Transition rule " + prev + "->" + next + " has no pattern");
            }
            builder.put(prev, next, cost);
        }
        return builder.build();
    }

    private static final class Builder {
        private final int defaultCost;
        private final int boundaryCost;
        private final Map<String, Map<String, Integer>> pairs = new HashMap<>();
        private final List<Rule> rules;

        Builder(TransitionCostTable base) {
            this.defaultCost = base.defaultCost;
            this.boundaryCost = base.boundaryCost;
            for (Map.Entry<String, Map<String, Integer>> row : base.pairs.entrySet()) {
                pairs.put(row.getKey(), new HashMap<>(row.getValue()));
            }
            this.rules = new ArrayList<>(base.rules);
        }

        Builder put(String prev, String next, int cost) {
            Objects.requireNonNull(prev, "prev");
            Objects.requireNonNull(next, "next");
            if (isPattern(prev) || isPattern(next)) {
                Rule rule = new Rule(prev, next, cost);
                rules.removeIf(r -> r.prev.equals(prev) && r.next.equals(next));
                rules.add(rule);
            } else {
                pairs.computeIfAbsent(prev, k -> new HashMap<>()).put(next, cost);
            }
            return this;
        }

        TransitionCostTable build() {
            Map<String, Map<String, Integer>> frozen = new HashMap<>();
            for (Map.Entry<String, Map<String, Integer>> row : pairs.entrySet()) {
                frozen.put(row.getKey(), Collections.unmodifiableMap(new HashMap<>(row.getValue())));
            }
            List<Rule> sorted = new ArrayList<>(rules);
            // most specific first; List.sort is stable, so equal specificity keeps insertion order
            sorted.sort((a, b) -> Integer.compare(b.specificity(), a.specificity()));
            return new TransitionCostTable(defaultCost, boundaryCost,
                Collections.unmodifiableMap(frozen), Collections.unmodifiableList(sorted));
        }
    }

    private static final class Rule {
        final String prev;
        final String next;
        final int cost;

        Rule(String prev, String next, int cost) {
            this.prev = prev;
            this.next = next;
            this.cost = cost;
        }

        boolean matches(String left, String right) {
            return matchesTag(prev, left) && matchesTag(next, right);
        }

        int specificity() {
            return prefixLength(prev) + prefixLength(next);
        }

        private static boolean matchesTag(String pattern, String tag) {
            int star = pattern.indexOf(WILDCARD);
            if (star < 0) return pattern.equals(tag);
            return tag.startsWith(pattern.substring(0, star));
        }

        private static int prefixLength(String pattern) {
            int star = pattern.indexOf(WILDCARD);
            // an exact side is more specific than any prefix
            return star < 0 ? pattern.length() + 1000 : star;
        }
    }

    private static final class TransitionFile {
        List<Transition> transitions;

        static final class Transition {
            String prev;
            String next;
            Integer cost;
        }
    }
}
