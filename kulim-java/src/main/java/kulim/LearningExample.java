package kulim;

import java.util.List;
import java.util.Objects;

/**
 * An eojeol and the morphs it should analyze to.
 */
public final class LearningExample {

    private final String surface;
    private final List<Morph> morphs;

    public LearningExample(String surface, List<Morph> morphs) {
        this.surface = Objects.requireNonNull(surface, "surface");
        this.morphs = List.copyOf(morphs);
    }

    public String surface() {
        return surface;
    }

    public List<Morph> morphs() {
        return morphs;
    }

    @Override
    public String toString() {
        return surface + " -> " + morphs;
    }
}
