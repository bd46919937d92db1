package rs.lukaj.restclient.connections;

import java.io.IOException;

/**
 * Provides connections to the client. Connections == {@link HttpSocket}s
 */
public interface ConnectionPool extends AutoCloseable {
    /**
     * Get connection to a given endpoint, reusing an idle one if possible and opening a new one otherwise.
     * Returned connection is acquired by the caller, who has to give it back using {@link #release(HttpSocket, boolean)}.
     * @param endpoint endpoint to which connection should go
     * @param listener notified about connection lifecycle
     * @return HttpSocket to the endpoint
     * @throws IOException if new connection can't be opened
     */
    HttpSocket getConnection(Endpoint endpoint, ConnectionListener listener) throws IOException;

    /**
     * Give connection back to the pool.
     * @param connection connection obtained from {@link #getConnection(Endpoint, ConnectionListener)}
     * @param reusable false if the connection is in unknown state (e.g. response wasn't fully read) and
     *                 has to be closed
     * @param listener notified whether connection was kept
     */
    void release(HttpSocket connection, boolean reusable, ConnectionListener listener);

    /**
     * Close all idle connections. Connections in use are closed when they're released.
     */
    @Override
    void close();
}
