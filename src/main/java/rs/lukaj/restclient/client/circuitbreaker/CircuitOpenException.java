package rs.lukaj.restclient.client.circuitbreaker;

import java.time.Duration;

/**
 * Thrown when circuit breaker doesn't permit a call.
 */
public class CircuitOpenException extends Exception {
    private final Duration retryAfter;

    public CircuitOpenException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    /**
     * @return how long until the breaker lets probe calls through; zero if unknown
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
