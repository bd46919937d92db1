package rs.lukaj.restclient.connections;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigurableConnectionPoolTest {
    //connections are accepted by the backlog, nobody needs to call accept()
    private ServerSocket server;
    private Endpoint endpoint;

    @BeforeEach
    public void startServer() throws IOException {
        server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        endpoint = new Endpoint("127.0.0.1", server.getLocalPort(), false);
    }

    @AfterEach
    public void stopServer() throws IOException {
        server.close();
    }

    /**
     * Connection released after a finished exchange is handed out again, and is marked as reused.
     */
    @Test
    public void reusesIdleConnection() throws IOException {
        ConfigurableConnectionPool pool = new ConfigurableConnectionPool(new PoolConfig("reuse"));
        HttpSocket first = pool.getConnection(endpoint, ConnectionListener.NONE);
        assertFalse(first.acquireIfIdle()); //pool returns acquired connections
        assertFalse(first.isReused());
        first.exchangeFinished();
        pool.release(first, true, ConnectionListener.NONE);
        assertEquals(1, pool.getIdleConnections(endpoint));

        HttpSocket second = pool.getConnection(endpoint, ConnectionListener.NONE);
        assertSame(first, second);
        assertTrue(second.isReused());
        assertEquals(0, pool.getIdleConnections(endpoint));
        assertEquals(1, pool.getOpenConnections());
        pool.close();
    }

    /**
     * Connections released above the idle limit are closed.
     */
    @Test
    public void boundsIdleConnections() throws IOException {
        ConfigurableConnectionPool pool = new ConfigurableConnectionPool(new PoolConfig("bounded").setMaxIdleConnsPerHost(1));
        List<HttpSocket> sockets = new ArrayList<>();
        for(int i = 0; i < 3; i++) sockets.add(pool.getConnection(endpoint, ConnectionListener.NONE));
        assertEquals(3, pool.getOpenConnections());
        for(HttpSocket socket : sockets) pool.release(socket, true, ConnectionListener.NONE);
        assertEquals(1, pool.getIdleConnections(endpoint));
        assertEquals(1, pool.getOpenConnections());
        assertEquals(2, sockets.stream().filter(HttpSocket::isClosed).count());
        pool.close();
    }

    /**
     * Connections which aren't reusable (e.g. body wasn't read to the end) are closed on release.
     */
    @Test
    public void closesUnusableConnections() throws IOException {
        ConfigurableConnectionPool pool = new ConfigurableConnectionPool(new PoolConfig("unusable"));
        HttpSocket socket = pool.getConnection(endpoint, ConnectionListener.NONE);
        pool.release(socket, false, ConnectionListener.NONE);
        assertTrue(socket.isClosed());
        assertEquals(0, pool.getIdleConnections(endpoint));
        assertEquals(0, pool.getOpenConnections());
    }

    /**
     * Listener hears about every step of connection's life.
     */
    @Test
    public void notifiesListener() throws IOException {
        List<String> events = new ArrayList<>();
        ConnectionListener listener = new ConnectionListener() {
            @Override
            public void connectionRequested(Endpoint endpoint) {
                events.add("requested");
            }

            @Override
            public void connectionObtained(Endpoint endpoint, boolean reused) {
                events.add(reused ? "reused" : "fresh");
            }

            @Override
            public void connectionOpened(Endpoint endpoint, boolean success) {
                events.add(success ? "opened" : "failed");
            }

            @Override
            public void connectionReturned(Endpoint endpoint, boolean keptIdle) {
                events.add(keptIdle ? "idle" : "closed");
            }
        };
        ConfigurableConnectionPool pool = new ConfigurableConnectionPool(new PoolConfig("listener"));
        HttpSocket socket = pool.getConnection(endpoint, listener);
        socket.exchangeFinished();
        pool.release(socket, true, listener);
        socket = pool.getConnection(endpoint, listener);
        pool.release(socket, false, listener);
        assertEquals(List.of("requested", "opened", "fresh", "idle", "requested", "reused", "closed"), events);
    }

    @Test
    public void closedPoolRefusesConnections() throws IOException {
        ConfigurableConnectionPool pool = new ConfigurableConnectionPool(new PoolConfig("closed"));
        HttpSocket socket = pool.getConnection(endpoint, ConnectionListener.NONE);
        pool.release(socket, true, ConnectionListener.NONE);
        pool.close();
        assertTrue(socket.isClosed());
        assertThrows(IOException.class, () -> pool.getConnection(endpoint, ConnectionListener.NONE));
    }
}
