package rs.lukaj.restclient.connections;

import java.io.IOException;

/**
 * Thrown when response is unexpected (e.g. it doesn't follow the protocol, or redirects too many times).
 * It's an I/O failure as far as retrying is concerned.
 */
public class InvalidResponseException extends IOException {
    public InvalidResponseException(String message) {
        super(message);
    }
    public InvalidResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
