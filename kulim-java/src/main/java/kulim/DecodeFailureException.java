package kulim;

/**
 * Thrown when the decoder cannot reach the end of a lattice.
 */
public class DecodeFailureException extends AnalysisException {

    public DecodeFailureException(String message) {
        super(message);
    }
}
