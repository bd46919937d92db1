package rs.lukaj.restclient.client;

import org.junit.jupiter.api.Test;
import rs.lukaj.restclient.connections.Cancellation;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RequestContextTest {

    @Test
    public void cancelRunsActionsOnce() {
        RequestContext context = RequestContext.create();
        AtomicInteger runs = new AtomicInteger();
        context.onCancel(runs::incrementAndGet);
        Cancellation.Registration removed = context.onCancel(runs::incrementAndGet);
        removed.close();

        context.cancel();
        context.cancel();
        assertTrue(context.isCancelled());
        assertEquals(1, runs.get());

        context.onCancel(runs::incrementAndGet); //late registrations run right away
        assertEquals(2, runs.get());
    }

    @Test
    public void deadline() {
        assertTrue(RequestContext.withDeadline(Instant.now().minusSeconds(1)).isCancelled());
        RequestContext context = RequestContext.withTimeout(Duration.ofMinutes(1));
        assertFalse(context.isCancelled());
        assertTrue(context.remaining().get().compareTo(Duration.ofSeconds(50)) > 0);
        assertFalse(RequestContext.create().remaining().isPresent());
    }

    /**
     * Sleep is cut short by the deadline and by cancellation.
     */
    @Test
    public void sleepIsInterruptible() throws InterruptedException {
        assertTrue(RequestContext.create().sleep(Duration.ofMillis(10)));

        long start = System.nanoTime();
        assertFalse(RequestContext.withTimeout(Duration.ofMillis(50)).sleep(Duration.ofSeconds(10)));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(5)) < 0);

        RequestContext cancelled = RequestContext.create();
        new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            cancelled.cancel();
        }).start();
        assertFalse(cancelled.sleep(Duration.ofSeconds(10)));
    }

    @Test
    public void forwardedHeaders() {
        RequestContext context = RequestContext.create()
                .withForwardedHeader("X-Trace-Id", "abc")
                .withForwardedHeader("X-Span-Id", "def");
        assertEquals("abc", context.getForwardedHeaders().get("X-Trace-Id"));
        assertThrows(UnsupportedOperationException.class, () -> context.getForwardedHeaders().put("a", "b"));
    }
}
