package rs.lukaj.restclient.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rs.lukaj.restclient.connections.Cancellation;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Context of a single logical call: optional deadline, explicit cancellation, and tracing headers the caller
 * received and wants forwarded. One context can be shared by several requests (e.g. all requests made while
 * serving one incoming request); cancelling it cancels all of them.
 */
public class RequestContext implements Cancellation {
    private static final Logger LOG = LoggerFactory.getLogger(RequestContext.class);

    private final Instant deadline;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Set<Runnable> onCancel = ConcurrentHashMap.newKeySet();
    private final Map<String, String> forwardedHeaders = Collections.synchronizedMap(new LinkedHashMap<>());

    private RequestContext(Instant deadline) {
        this.deadline = deadline;
    }

    /**
     * @return context without a deadline
     */
    public static RequestContext create() {
        return new RequestContext(null);
    }

    public static RequestContext withTimeout(Duration timeout) {
        return new RequestContext(Instant.now().plus(timeout));
    }

    public static RequestContext withDeadline(Instant deadline) {
        return new RequestContext(deadline);
    }

    /**
     * Attaches a tracing header which should be forwarded with every request made in this context.
     * @return this, to allow chaining
     */
    public RequestContext withForwardedHeader(String name, String value) {
        forwardedHeaders.put(name, value);
        return this;
    }

    public Map<String, String> getForwardedHeaders() {
        synchronized (forwardedHeaders) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(forwardedHeaders));
        }
    }

    /**
     * Cancels the context. Connections of requests in progress are closed, and no more attempts are made.
     */
    public void cancel() {
        if(cancelled.getCount() == 0) return;
        cancelled.countDown();
        for(Runnable action : onCancel) runQuietly(action);
        onCancel.clear();
    }

    /**
     * @return whether the context has been cancelled or its deadline has passed
     */
    @Override
    public boolean isCancelled() {
        return cancelled.getCount() == 0 || (deadline != null && !Instant.now().isBefore(deadline));
    }

    @Override
    public Registration onCancel(Runnable action) {
        onCancel.add(action);
        if(cancelled.getCount() == 0 && onCancel.remove(action)) runQuietly(action);
        return () -> onCancel.remove(action);
    }

    private static void runQuietly(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation action failed", e);
        }
    }

    /**
     * @return deadline of this context, if it has one
     */
    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * @return time left until the deadline, never negative; empty if there's no deadline
     */
    public Optional<Duration> remaining() {
        if(deadline == null) return Optional.empty();
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Sleeps for the given time, waking up early if the context is cancelled or the deadline is reached
     * before the time elapses.
     * @return true if slept the whole time, false if cut short
     * @throws InterruptedException if the thread was interrupted while sleeping
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        if(isCancelled()) return false;
        Duration wait = duration;
        Optional<Duration> left = remaining();
        boolean cutByDeadline = left.isPresent() && left.get().compareTo(duration) < 0;
        if(cutByDeadline) wait = left.get();
        if(cancelled.await(wait.toNanos(), TimeUnit.NANOSECONDS)) return false;
        return !cutByDeadline;
    }
}
