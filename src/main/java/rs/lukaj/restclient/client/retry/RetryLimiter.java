package rs.lukaj.restclient.client.retry;

import rs.lukaj.restclient.connections.InvalidConfigException;

import java.util.concurrent.Semaphore;

/**
 * Caps how many retries can be in progress at the same time across all requests sharing the limiter, so a
 * struggling service isn't hit by a retry storm. It never waits: if there are no free permits, the retry
 * simply doesn't happen.
 */
public class RetryLimiter {
    public static final int DEFAULT_PERMITS = 100;

    private final Semaphore permits;
    private final int maxPermits;

    public RetryLimiter() {
        this(DEFAULT_PERMITS);
    }

    public RetryLimiter(int maxPermits) {
        if(maxPermits < 1) throw new InvalidConfigException("maxPermits must be positive!");
        this.maxPermits = maxPermits;
        this.permits = new Semaphore(maxPermits);
    }

    /**
     * Runs the retry if a permit is free.
     * @param retry action performing the retry
     * @return false if retry was rejected (and not run), true otherwise
     */
    public <E extends Exception> boolean tryRun(RetryAction<E> retry) throws E {
        if(!permits.tryAcquire()) return false;
        try {
            retry.run();
            return true;
        } finally {
            permits.release();
        }
    }

    public int getAvailablePermits() {
        return permits.availablePermits();
    }

    public int getMaxPermits() {
        return maxPermits;
    }

    @FunctionalInterface
    public interface RetryAction<E extends Exception> {
        void run() throws E;
    }
}
