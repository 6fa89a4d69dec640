package kulim;

import java.io.IOException;

/**
 * Thrown when a dictionary container is corrupt, truncated or of an unsupported version.
 */
public class DictionaryFormatException extends IOException {

    public DictionaryFormatException(String message) {
        super(message);
    }

    public DictionaryFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
