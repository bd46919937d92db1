package rs.lukaj.restclient.client.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of {@link RetryStrategy#shouldRetry}: whether to retry, and how long to wait before doing so.
 */
public final class RetryDecision {
    private static final RetryDecision STOP = new RetryDecision(false, Duration.ZERO);

    private final boolean retry;
    private final Duration delay;

    private RetryDecision(boolean retry, Duration delay) {
        this.retry = retry;
        this.delay = delay;
    }

    public static RetryDecision stop() {
        return STOP;
    }

    public static RetryDecision retryAfter(Duration delay) {
        if(delay == null || delay.isNegative()) throw new IllegalArgumentException("Delay can't be negative");
        return new RetryDecision(true, delay);
    }

    public boolean shouldRetry() {
        return retry;
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof RetryDecision)) return false;
        RetryDecision that = (RetryDecision) o;
        return retry == that.retry && delay.equals(that.delay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(retry, delay);
    }

    @Override
    public String toString() {
        return retry ? "retry after " + delay.toMillis() + "ms" : "stop";
    }
}
