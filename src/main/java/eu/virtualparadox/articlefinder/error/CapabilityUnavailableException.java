package eu.virtualparadox.articlefinder.error;

/**
 * An external capability (embedding model, vector or lexical backend) cannot serve the call.
 * <p>Retrieval treats this as a missing signal and degrades instead of failing the request.</p>
 */
public class CapabilityUnavailableException extends RuntimeException {

    public CapabilityUnavailableException(final String message) {
        super(message);
    }

    public CapabilityUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
