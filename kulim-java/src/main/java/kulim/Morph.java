package kulim;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One analyzed morpheme with its span in the input.
 *
 * Equality covers surface, tag, lemma and span, not the cost, so that
 * analyses can be compared across cost updates.
 */
public final class Morph {

    private final String surface;
    private final String pos;
    private final String lemma;
    private final int cost;
    private final int start;
    private final int end;
    private final List<Morph> components;

    public Morph(String surface, String pos, String lemma, int cost, int start, int end) {
        this(surface, pos, lemma, cost, start, end, null);
    }

    Morph(String surface, String pos, String lemma, int cost, int start, int end, List<Morph> components) {
        this.surface = Objects.requireNonNull(surface, "surface");
        this.pos = Objects.requireNonNull(pos, "pos");
        this.lemma = lemma == null ? surface : lemma;
        this.cost = cost;
        this.start = start;
        this.end = end;
        this.components = components == null ? Collections.emptyList() : List.copyOf(components);
    }

    /**
     * A confirmed morpheme for learning; its span is resolved against the text.
     */
    public static Morph of(String surface, String pos) {
        return new Morph(surface, pos, surface, 0, -1, -1);
    }

    public static Morph of(String surface, String pos, String lemma) {
        return new Morph(surface, pos, lemma, 0, -1, -1);
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
        return cost;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    /**
     * Parts of an irregular form this morph was expanded from, empty otherwise.
     */
    public List<Morph> components() {
        return components;
    }

    public boolean isLexical() {
        return PosTags.isLexical(pos);
    }

    public boolean isFunctional() {
        return PosTags.isFunctional(pos);
    }

    public boolean isFree() {
        return PosTags.isFree(pos);
    }

    public boolean isBound() {
        return PosTags.isBound(pos);
    }

    Morph withSpan(int start, int end) {
        return new Morph(surface, pos, lemma, cost, start, end, components);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Morph)) return false;
        Morph other = (Morph) o;
        return start == other.start && end == other.end
            && surface.equals(other.surface) && pos.equals(other.pos) && lemma.equals(other.lemma);
    }

    @Override
    public int hashCode() {
        return Objects.hash(surface, pos, lemma, start, end);
    }

    @Override
    public String toString() {
        return surface + "/" + pos;
    }
}
