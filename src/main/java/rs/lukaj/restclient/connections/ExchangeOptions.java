package rs.lukaj.restclient.connections;

import java.time.Duration;

/**
 * Per-exchange settings, i.e. everything which can differ between two requests going through the same
 * {@link Transport}.
 */
public class ExchangeOptions {
    public static final int MAX_REDIRECTS = 10;

    private Duration readTimeout = Duration.ZERO;
    private boolean followRedirects = false;
    private ConnectionListener listener = ConnectionListener.NONE;
    private Cancellation cancellation = Cancellation.NONE;

    public Duration getReadTimeout() {
        return readTimeout;
    }
    public boolean isFollowRedirects() {
        return followRedirects;
    }
    public ConnectionListener getListener() {
        return listener;
    }
    public Cancellation getCancellation() {
        return cancellation;
    }

    /**
     * Sets how long a single read from the server can block, including waiting for the response headers. Zero
     * means no limit.
     */
    public ExchangeOptions setReadTimeout(Duration readTimeout) {
        if(readTimeout == null || readTimeout.isNegative()) throw new InvalidConfigException("readTimeout can't be negative!");
        this.readTimeout = readTimeout;
        return this;
    }

    /**
     * If set, 3xx responses with a Location are followed, up to {@link #MAX_REDIRECTS} times.
     */
    public ExchangeOptions setFollowRedirects(boolean followRedirects) {
        this.followRedirects = followRedirects;
        return this;
    }

    public ExchangeOptions setListener(ConnectionListener listener) {
        this.listener = listener == null ? ConnectionListener.NONE : listener;
        return this;
    }

    public ExchangeOptions setCancellation(Cancellation cancellation) {
        this.cancellation = cancellation == null ? Cancellation.NONE : cancellation;
        return this;
    }
}
