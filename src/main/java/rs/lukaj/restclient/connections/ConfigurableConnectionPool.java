package rs.lukaj.restclient.connections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection pool which can be configured using values in {@link PoolConfig}. Number of connections in use
 * isn't limited; at most {@link PoolConfig#getMaxIdleConnsPerHost()} idle connections are kept per endpoint,
 * and the rest are closed as soon as they're released.
 */
public class ConfigurableConnectionPool implements ConnectionPool {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigurableConnectionPool.class);

    /**
     * Idle connections for each Endpoint, most recently released first.
     */
    private final Map<Endpoint, Deque<HttpSocket>> idle = new ConcurrentHashMap<>();
    private final Set<HttpSocket> opened = ConcurrentHashMap.newKeySet();
    private final PoolConfig config;
    private final Object lock = new Object();
    private volatile boolean closed = false;

    public ConfigurableConnectionPool(PoolConfig config) {
        this.config = config.copy();
    }

    /**
     * @return config this pool has been built with; changing the returned copy has no effect
     */
    public PoolConfig getConfig() {
        return config.copy();
    }

    /**
     * @return number of currently open connections, both idle and in use
     */
    public int getOpenConnections() {
        opened.removeIf(HttpSocket::isClosed);
        return opened.size();
    }

    /**
     * @return number of idle connections to the given endpoint
     */
    public int getIdleConnections(Endpoint endpoint) {
        synchronized (lock) {
            cleanupConnections();
            Deque<HttpSocket> conns = idle.get(endpoint);
            return conns == null ? 0 : conns.size();
        }
    }

    @Override
    public HttpSocket getConnection(Endpoint endpoint, ConnectionListener listener) throws IOException {
        if(closed) throw new IOException("Connection pool " + config.getName() + " is closed");
        listener.connectionRequested(endpoint);
        synchronized (lock) {
            cleanupConnections();
            Deque<HttpSocket> conns = idle.get(endpoint);
            while(conns != null && !conns.isEmpty()) {
                HttpSocket conn = conns.pollFirst();
                if(conn.acquireIfIdle()) {
                    listener.connectionObtained(endpoint, conn.isReused());
                    return conn;
                }
                closeQuietly(conn); //closed behind our back
            }
        }
        //opening happens outside of the lock, so one slow endpoint doesn't stall the others
        HttpSocket conn;
        try {
            conn = HttpSocket.open(endpoint, config.getProxy(), config.getConnectTimeout(), listener);
        } catch (IOException e) {
            listener.connectionOpened(endpoint, false);
            throw e;
        }
        opened.add(conn);
        listener.connectionOpened(endpoint, true);
        listener.connectionObtained(endpoint, false);
        LOG.debug("Opened connection to {} in pool {}", endpoint, config.getName());
        return conn;
    }

    @Override
    public void release(HttpSocket connection, boolean reusable, ConnectionListener listener) {
        Endpoint endpoint = connection.getEndpoint();
        boolean kept = false;
        if(reusable && !closed && !connection.isClosed()) {
            synchronized (lock) {
                Deque<HttpSocket> conns = idle.computeIfAbsent(endpoint, e -> new ArrayDeque<>());
                if(conns.size() < config.getMaxIdleConnsPerHost()
                        && connection.getAge().compareTo(config.getMaxAge()) < 0) {
                    connection.release();
                    conns.addFirst(connection);
                    kept = true;
                }
            }
        }
        if(!kept) closeQuietly(connection);
        listener.connectionReturned(endpoint, kept);
    }

    //caller holds the lock
    private void cleanupConnections() {
        for (Deque<HttpSocket> conns : idle.values()) {
            for (Iterator<HttpSocket> it = conns.iterator(); it.hasNext(); ) {
                HttpSocket conn = it.next();
                if (conn.isClosed()) {
                    it.remove();
                } else if (conn.getIdlingTime().compareTo(config.getAliveTime()) > 0
                        || conn.getAge().compareTo(config.getMaxAge()) > 0) {
                    it.remove();
                    closeQuietly(conn);
                }
            }
        }
    }

    private void closeQuietly(HttpSocket conn) {
        opened.remove(conn);
        try {
            conn.close();
        } catch (IOException e) {
            LOG.debug("Error while closing connection to {}", conn.getEndpoint(), e);
        }
    }

    @Override
    public void close() {
        closed = true;
        synchronized (lock) {
            for(Deque<HttpSocket> conns : idle.values()) {
                for(HttpSocket conn : conns) closeQuietly(conn);
                conns.clear();
            }
        }
    }
}
