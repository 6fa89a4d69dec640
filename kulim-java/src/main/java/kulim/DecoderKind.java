package kulim;

/**
 * Decoder implementations selectable from the configuration.
 */
public enum DecoderKind {
    /** Straightforward object-based dynamic program. */
    REFERENCE,
    /** Reused primitive buffers and an interned transition matrix. */
    BUFFERED;

    public Decoder create() {
        switch (this) {
            case REFERENCE:
                return new ViterbiDecoder();
            case BUFFERED:
                return new BufferedViterbiDecoder();
            default:
                throw new IllegalStateException("Unhandled decoder " + this);
        }
    }
}
