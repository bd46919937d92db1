package rs.lukaj.restclient.connections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Keeps one {@link Transport} per pool name. Transports are built lazily, on first use, and exactly once
 * per name even if many threads ask for the same pool at the same time. First configuration registered
 * under a name wins; later ones with a different configuration are ignored with a warning.
 */
public class PoolRegistry implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(PoolRegistry.class);

    private final Map<String, LazyTransport> transports = new ConcurrentHashMap<>();
    private final Function<PoolConfig, Transport> factory;

    public PoolRegistry() {
        this(Transport::new);
    }

    /**
     * @param factory builds a transport for the given configuration; called at most once per pool name
     */
    public PoolRegistry(Function<PoolConfig, Transport> factory) {
        this.factory = factory;
    }

    /**
     * Get transport for the pool, building it if this is the first time the pool is used.
     * @param config pool configuration; its name identifies the pool
     * @return transport shared by everyone using the same pool name
     */
    public Transport getTransport(PoolConfig config) {
        LazyTransport lazy = transports.computeIfAbsent(config.getName(), name -> new LazyTransport(config.copy()));
        if(!lazy.config.equals(config))
            LOG.warn("Pool {} is already configured as {}; ignoring {}", config.getName(), lazy.config, config);
        return lazy.get();
    }

    /**
     * @return whether pool with the given name has been built already
     */
    public boolean isBuilt(String name) {
        LazyTransport lazy = transports.get(name);
        return lazy != null && lazy.transport != null;
    }

    @Override
    public void close() {
        for(LazyTransport lazy : transports.values()) {
            Transport transport = lazy.transport;
            if(transport != null) transport.close();
        }
    }

    //computeIfAbsent only publishes the holder; the transport itself is built outside of the map's lock
    private final class LazyTransport {
        private final PoolConfig config;
        private volatile Transport transport;

        private LazyTransport(PoolConfig config) {
            this.config = config;
        }

        private Transport get() {
            Transport t = transport;
            if(t == null) {
                synchronized (this) {
                    t = transport;
                    if(t == null) {
                        t = factory.apply(config);
                        transport = t;
                        LOG.debug("Built transport for pool {}", config.getName());
                    }
                }
            }
            return t;
        }
    }
}
