package rs.lukaj.restclient.connections;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a named connection pool. Pools are identified by name: the first configuration registered
 * under a name is the one its {@link Transport} is built with.
 */
public class PoolConfig {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofMillis(1500);
    public static final int DEFAULT_MAX_IDLE_PER_HOST = 2;

    private String name;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private int maxIdleConnsPerHost = DEFAULT_MAX_IDLE_PER_HOST;
    private Duration aliveTime = Duration.ofSeconds(90);
    private Duration maxAge = Duration.ofHours(2);
    private URI proxy;

    public PoolConfig(String name) {
        setName(name);
    }

    public PoolConfig copy() {
        PoolConfig copy = new PoolConfig(name);
        copy.connectTimeout = connectTimeout;
        copy.maxIdleConnsPerHost = maxIdleConnsPerHost;
        copy.aliveTime = aliveTime;
        copy.maxAge = maxAge;
        copy.proxy = proxy;
        return copy;
    }

    public String getName() {
        return name;
    }
    public Duration getConnectTimeout() {
        return connectTimeout;
    }
    public int getMaxIdleConnsPerHost() {
        return maxIdleConnsPerHost;
    }
    public Duration getAliveTime() {
        return aliveTime;
    }
    public Duration getMaxAge() {
        return maxAge;
    }
    public URI getProxy() {
        return proxy;
    }

    /**
     * Sets name under which the pool is registered and reported.
     */
    public PoolConfig setName(String name) {
        if(name == null || name.trim().isEmpty()) throw new InvalidConfigException("Pool name can't be empty!");
        this.name = name;
        return this;
    }

    /**
     * Sets maximum time for establishing TCP connection, TLS handshake included. Zero means waiting forever.
     * @param connectTimeout connect timeout
     */
    public PoolConfig setConnectTimeout(Duration connectTimeout) {
        if(connectTimeout == null || connectTimeout.isNegative()) throw new InvalidConfigException("connectTimeout can't be negative!");
        this.connectTimeout = connectTimeout;
        return this;
    }

    /**
     * Sets maximum number of idle connections which are kept open to a single endpoint. There's no limit on
     * connections in use; ones released above this number are closed.
     * @param maxIdleConnsPerHost maximum idle connections per endpoint
     */
    public PoolConfig setMaxIdleConnsPerHost(int maxIdleConnsPerHost) {
        if(maxIdleConnsPerHost < 0) throw new InvalidConfigException("maxIdleConnsPerHost can't be negative!");
        this.maxIdleConnsPerHost = maxIdleConnsPerHost;
        return this;
    }

    /**
     * Sets maximum time connection can be alive and idling without being closed. If connection is idling for more
     * than aliveTime, it will be closed on the next occasion and won't be used again.
     * @param aliveTime maximum idling time
     */
    public PoolConfig setAliveTime(Duration aliveTime) {
        if(aliveTime == null || aliveTime.isNegative() || aliveTime.isZero()) throw new InvalidConfigException("aliveTime must be positive!");
        this.aliveTime = aliveTime;
        return this;
    }

    /**
     * Sets maximum connection age. Age is calculated as a period between the time socket was opened and now. If
     * connection is older than maxAge, it will be closed on the next occasion and won't be used again. Connections
     * which are in use won't be closed regardless of age.
     * @param maxAge maximum age connection can live for
     */
    public PoolConfig setMaxAge(Duration maxAge) {
        if(maxAge == null || maxAge.isNegative() || maxAge.isZero()) throw new InvalidConfigException("maxAge must be positive!");
        this.maxAge = maxAge;
        return this;
    }

    /**
     * Sets HTTP proxy all connections of this pool go through, e.g. {@code http://proxy.local:3128}. Null
     * means connecting directly.
     */
    public PoolConfig setProxy(String proxy) {
        if(proxy == null || proxy.isEmpty()) {
            this.proxy = null;
            return this;
        }
        URI uri;
        try {
            uri = URI.create(proxy);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("Invalid proxy URL: " + proxy);
        }
        if(!"http".equals(uri.getScheme()) || uri.getHost() == null)
            throw new InvalidConfigException("Proxy must be an http:// URL with a host: " + proxy);
        this.proxy = uri;
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof PoolConfig)) return false;
        PoolConfig that = (PoolConfig) o;
        return maxIdleConnsPerHost == that.maxIdleConnsPerHost && name.equals(that.name)
                && connectTimeout.equals(that.connectTimeout) && aliveTime.equals(that.aliveTime)
                && maxAge.equals(that.maxAge) && Objects.equals(proxy, that.proxy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, connectTimeout, maxIdleConnsPerHost, aliveTime, maxAge, proxy);
    }

    @Override
    public String toString() {
        return "PoolConfig{name=" + name + ", connectTimeout=" + connectTimeout + ", maxIdleConnsPerHost="
                + maxIdleConnsPerHost + ", proxy=" + proxy + "}";
    }
}
