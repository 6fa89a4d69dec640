package kulim;

/**
 * Thrown when the lattice builder finds a reachable position without any candidate.
 */
public class NoCoverageException extends AnalysisException {

    private final int position;

    public NoCoverageException(String text, int position) {
        super("No candidate covers position " + position + " of \"" + text + "\"");
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
