package eu.virtualparadox.articlefinder.error;

public class RetrievalTimeoutException extends RuntimeException {

    public RetrievalTimeoutException(final String message) {
        super(message);
    }

    public RetrievalTimeoutException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
