package rs.lukaj.restclient.client.circuitbreaker;

/**
 * Gate in front of a remote service. While the service keeps failing the breaker is open and requests are
 * rejected without touching the network; after a while it lets a few through to check whether the service
 * has recovered.
 * <br/>
 * Usage:
 * <pre>
 *     CircuitBreaker.Completion completion = breaker.allow(); //throws if open
 *     boolean success = ...; //make the call
 *     completion.done(success);
 * </pre>
 * Every admitted call must be completed exactly once.
 */
public interface CircuitBreaker {

    enum State {
        /** Normal operation, failures are being counted. */
        CLOSED,
        /** Requests are rejected. */
        OPEN,
        /** Limited number of requests is let through to probe the service. */
        HALF_OPEN
    }

    /**
     * Asks for permission to make a call.
     * @return callback which must be invoked once the call is done
     * @throws CircuitOpenException if the call isn't permitted
     */
    Completion allow() throws CircuitOpenException;

    State getState();

    @FunctionalInterface
    interface Completion {
        /**
         * @param success whether the call succeeded, i.e. got a response which isn't 5xx
         */
        void done(boolean success);
    }
}
