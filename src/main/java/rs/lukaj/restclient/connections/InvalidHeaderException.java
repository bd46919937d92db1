package rs.lukaj.restclient.connections;

/**
 * Thrown when a header can't be represented on the wire (e.g. empty name, or a line break inside the value).
 */
public class InvalidHeaderException extends RuntimeException {
    public InvalidHeaderException(String message) {
        super(message);
    }
}
