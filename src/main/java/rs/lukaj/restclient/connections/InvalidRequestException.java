package rs.lukaj.restclient.connections;

/**
 * Thrown when request can't be built locally (e.g. malformed URL, or a body which can't be serialized).
 * These are never retried.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
