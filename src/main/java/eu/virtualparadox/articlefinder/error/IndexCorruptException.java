package eu.virtualparadox.articlefinder.error;

/**
 * Corpus or index data is malformed or inconsistent (bad record, dimension mismatch).
 * <p>Fatal: at load time the index is refused, at query time the request fails.</p>
 */
public class IndexCorruptException extends IllegalStateException {

    public IndexCorruptException(final String message) {
        super(message);
    }

    public IndexCorruptException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
