package rs.lukaj.restclient.connections;

import java.io.IOException;

/**
 * Executes requests over connections of one named pool. Safe for use from multiple threads; one instance exists
 * per pool name, see {@link PoolRegistry}.
 */
public class Transport implements AutoCloseable {
    private final PoolConfig config;
    private final ConnectionPool pool;

    public Transport(PoolConfig config) {
        this(config, new ConfigurableConnectionPool(config));
    }

    public Transport(PoolConfig config, ConnectionPool pool) {
        this.config = config.copy();
        this.pool = pool;
    }

    /**
     * Sends the request and reads response head. See {@link HttpTransaction#execute(HttpRequest)}.
     */
    public HttpResponse execute(HttpRequest request, ExchangeOptions options) throws IOException {
        return new HttpTransaction(pool, options).execute(request);
    }

    public String getName() {
        return config.getName();
    }

    public PoolConfig getConfig() {
        return config.copy();
    }

    public ConnectionPool getPool() {
        return pool;
    }

    @Override
    public void close() {
        pool.close();
    }
}
