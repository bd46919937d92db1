package rs.lukaj.restclient.connections;

/**
 * Thrown if configuration parameters are invalid (e.g. a negative timeout, or a pool name that's blank).
 * Always thrown while configuring, never while executing a request.
 */
public class InvalidConfigException extends RuntimeException {
    public InvalidConfigException(String message) {
        super(message);
    }
}
