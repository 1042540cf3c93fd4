package eu.virtualparadox.articlefinder.error;

/**
 * The caller supplied a request that can never succeed (empty roles, non-positive k, null query).
 */
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(final String message) {
        super(message);
    }
}
