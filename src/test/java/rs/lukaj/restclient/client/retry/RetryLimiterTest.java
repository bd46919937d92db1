package rs.lukaj.restclient.client.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class RetryLimiterTest {

    /**
     * When all permits are taken, retries are rejected without waiting.
     */
    @Test
    public void rejectsWhenExhausted() throws Exception {
        RetryLimiter limiter = new RetryLimiter(1);
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            try {
                limiter.tryRun(() -> {
                    inside.countDown();
                    release.await();
                });
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        holder.start();
        inside.await();

        assertEquals(0, limiter.getAvailablePermits());
        AtomicBoolean ran = new AtomicBoolean();
        assertFalse(limiter.tryRun(() -> ran.set(true)));
        assertFalse(ran.get());

        release.countDown();
        holder.join();
        assertEquals(1, limiter.getAvailablePermits());
        assertTrue(limiter.tryRun(() -> ran.set(true)));
        assertTrue(ran.get());
    }

    /**
     * Permit is given back even if the retry fails.
     */
    @Test
    public void releasesOnFailure() {
        RetryLimiter limiter = new RetryLimiter();
        assertEquals(RetryLimiter.DEFAULT_PERMITS, limiter.getMaxPermits());
        assertThrows(IOException.class, () -> limiter.tryRun(() -> {
            throw new IOException("nope");
        }));
        assertEquals(RetryLimiter.DEFAULT_PERMITS, limiter.getAvailablePermits());
    }
}
