package kulim;

/**
 * Base class for violated analyzer invariants.
 *
 * These indicate a bug in the dictionary, lattice builder or decoder and are
 * always propagated to the caller, never recovered.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
