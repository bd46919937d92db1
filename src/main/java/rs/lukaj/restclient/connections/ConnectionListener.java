package rs.lukaj.restclient.connections;

import java.time.Duration;

/**
 * Receives notifications about connection lifecycle and timing of a single exchange. All methods have empty
 * default implementations, so one can override only the interesting ones. Methods are called on the thread
 * making the request and should return quickly.
 */
public interface ConnectionListener {
    ConnectionListener NONE = new ConnectionListener() {};

    /**
     * Connection to the endpoint has been asked for from the pool.
     */
    default void connectionRequested(Endpoint endpoint) {}

    /**
     * Connection has been handed out by the pool.
     * @param reused true if it's an idle connection which already carried an exchange
     */
    default void connectionObtained(Endpoint endpoint, boolean reused) {}

    /**
     * Attempt to open a new connection has finished.
     */
    default void connectionOpened(Endpoint endpoint, boolean success) {}

    /**
     * Connection has been given back to the pool.
     * @param keptIdle true if it's kept for reuse, false if it had to be closed
     */
    default void connectionReturned(Endpoint endpoint, boolean keptIdle) {}

    default void connectDone(Endpoint endpoint, Duration took) {}

    default void tlsHandshakeDone(Endpoint endpoint, Duration took) {}

    /**
     * Request line, headers and body have been flushed.
     * @param sinceStart time since the exchange started
     */
    default void requestWritten(Duration sinceStart) {}

    /**
     * Status line and headers of the response have been received.
     * @param sinceStart time since the exchange started
     */
    default void responseFirstByte(Duration sinceStart) {}
}
