package kulim;

import java.util.List;

/**
 * A whitespace-delimited word and the morphs it was analyzed into.
 */
public final class Eojeol {

    private final String surface;
    private final int start;
    private final int end;
    private final List<Morph> morphs;

    Eojeol(String surface, int start, int end, List<Morph> morphs) {
        this.surface = surface;
        this.start = start;
        this.end = end;
        this.morphs = List.copyOf(morphs);
    }

    public String surface() {
        return surface;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public List<Morph> morphs() {
        return morphs;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(surface).append(" = ");
        for (int i = 0; i < morphs.size(); i++) {
            if (i > 0) sb.append(" + ");
            sb.append(morphs.get(i));
        }
        return sb.toString();
    }
}
