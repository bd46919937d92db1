package rs.lukaj.restclient.client.retry;

import org.junit.jupiter.api.Test;
import rs.lukaj.restclient.connections.InvalidConfigException;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RetryStrategyTest {
    private static final IOException FAILURE = new IOException("connection reset");

    /**
     * maxRetries of 2 allows two retries after the first attempt, i.e. three attempts in total.
     */
    @Test
    public void simpleStopsAfterMaxRetries() {
        SimpleRetryStrategy strategy = new SimpleRetryStrategy(2, Duration.ofMillis(30));
        assertEquals(RetryDecision.retryAfter(Duration.ofMillis(30)), strategy.shouldRetry(null, null, FAILURE, 0));
        assertEquals(RetryDecision.retryAfter(Duration.ofMillis(30)), strategy.shouldRetry(null, null, FAILURE, 1));
        assertFalse(strategy.shouldRetry(null, null, FAILURE, 2).shouldRetry());
    }

    @Test
    public void zeroRetriesNeverRetries() {
        assertFalse(new SimpleRetryStrategy(0, Duration.ZERO).shouldRetry(null, null, FAILURE, 0).shouldRetry());
    }

    /**
     * Delay doubles with every attempt, but stays within bounds.
     */
    @Test
    public void backoffGrowsAndIsClamped() {
        BackoffRetryStrategy strategy = new BackoffRetryStrategy(Duration.ofMillis(10), Duration.ofMillis(100), 10);
        assertEquals(Duration.ofMillis(10), strategy.delayFor(0));
        assertEquals(Duration.ofMillis(20), strategy.delayFor(1));
        assertEquals(Duration.ofMillis(40), strategy.delayFor(2));
        assertEquals(Duration.ofMillis(80), strategy.delayFor(3));
        assertEquals(Duration.ofMillis(100), strategy.delayFor(4));
        assertEquals(Duration.ofMillis(100), strategy.delayFor(1000));
        assertEquals(Duration.ofMillis(40), strategy.shouldRetry(null, null, FAILURE, 2).getDelay());
        assertFalse(strategy.shouldRetry(null, null, FAILURE, 10).shouldRetry());
    }

    @Test
    public void customGrowth() {
        BackoffRetryStrategy strategy = new BackoffRetryStrategy(Duration.ofMillis(10), Duration.ofSeconds(10), 5, 3);
        assertEquals(Duration.ofMillis(90), strategy.delayFor(2));
    }

    @Test
    public void exposesParameters() {
        SimpleRetryStrategy simple = new SimpleRetryStrategy(3, Duration.ofMillis(250));
        assertEquals("simple", simple.strategyName());
        assertEquals(Map.of("max_retries", 3, "delay", 250L), simple.parameters());

        BackoffRetryStrategy backoff = new BackoffRetryStrategy(Duration.ofMillis(5), Duration.ofMillis(50), 4);
        assertEquals("backoff", backoff.strategyName());
        assertEquals(5L, backoff.parameters().get("min_wait"));
        assertEquals(50L, backoff.parameters().get("max_wait"));
        assertEquals(4, backoff.parameters().get("max_retries"));
    }

    @Test
    public void rejectsInvalidConfig() {
        assertThrows(InvalidConfigException.class, () -> new SimpleRetryStrategy(-1, Duration.ZERO));
        assertThrows(InvalidConfigException.class, () -> new SimpleRetryStrategy(1, Duration.ofMillis(-1)));
        assertThrows(InvalidConfigException.class,
                () -> new BackoffRetryStrategy(Duration.ofMillis(100), Duration.ofMillis(10), 1));
        assertThrows(InvalidConfigException.class,
                () -> new BackoffRetryStrategy(Duration.ZERO, Duration.ofMillis(10), 1, 0.5));
    }
}
