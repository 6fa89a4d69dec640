package kulim;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One morpheme entry: surface form, POS tag, lemma and a mutable cost.
 *
 * Identity is {@code (surface, pos)}. Everything except the cost is immutable.
 * Entries registered in a {@link DictionaryStore} carry a dense id in
 * registration order; synthetic entries made by the unknown-word model have
 * id {@link #UNREGISTERED}.
 */
public final class DictionaryEntry {

    public static final int UNREGISTERED = -1;

    private final int id;
    private final String surface;
    private final String pos;
    private final String lemma;
    private final AtomicInteger cost;
    private final List<Morph> components;

    DictionaryEntry(int id, String surface, String pos, String lemma, int cost, List<Morph> components) {
        this.id = id;
        this.surface = Objects.requireNonNull(surface, "surface");
        this.pos = Objects.requireNonNull(pos, "pos");
        this.lemma = lemma == null ? surface : lemma;
        this.cost = new AtomicInteger(cost);
        this.components = components == null || components.isEmpty()
            ? Collections.emptyList()
            : List.copyOf(components);
    }

    static DictionaryEntry synthetic(String surface, String pos, int cost) {
        return new DictionaryEntry(UNREGISTERED, surface, pos, surface, cost, null);
    }

    public int id() {
        return id;
    }

    public boolean isRegistered() {
        return id != UNREGISTERED;
    }

    public String surface() {
        return surface;
    }

    public String pos() {
        return pos;
    }

    public String lemma() {
        return lemma;
    }

    public int cost() {
        return cost.get();
    }

    /**
     * Morphs a compound entry expands to; empty for ordinary entries.
     */
    public List<Morph> components() {
        return components;
    }

    public boolean isCompound() {
        return !components.isEmpty();
    }

    public boolean matches(String surface, String pos) {
        return this.surface.equals(surface) && this.pos.equals(pos);
    }

    /**
     * Adds {@code delta} to the cost. A decrease never goes below {@code floor}
     * (nor below the current cost, if that is already under the floor).
     * Returns the previous cost.
     */
    int adjustCost(int delta, int floor) {
        while (true) {
            int previous = cost.get();
            long target = (long) previous + delta;
            if (delta < 0) {
                target = Math.max(target, Math.min(previous, floor));
            }
            int next = (int) Math.max(Math.min(target, Integer.MAX_VALUE), Integer.MIN_VALUE);
            if (cost.compareAndSet(previous, next)) {
                return previous;
            }
        }
    }

    /**
     * Replaces the cost. Returns the previous cost.
     */
    int setCost(int value) {
        return cost.getAndSet(value);
    }

    @Override
    public String toString() {
        return surface + "/" + pos + "(" + cost.get() + ")";
    }
}
