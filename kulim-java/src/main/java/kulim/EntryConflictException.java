package kulim;

/**
 * Thrown when the id-indexed and trie-indexed views of the dictionary disagree.
 */
public class EntryConflictException extends AnalysisException {

    public EntryConflictException(String message) {
        super(message);
    }
}
