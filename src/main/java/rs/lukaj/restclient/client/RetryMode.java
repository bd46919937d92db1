package rs.lukaj.restclient.client;

/**
 * How a request builder retries, chosen once when it's built.
 */
enum RetryMode {
    /** No retry strategy: every request is attempted once. */
    NONE,
    /**
     * Circuit breaker guards the service, so retries are made directly; breaker stops the storm if there is one.
     */
    WITH_BREAKER,
    /** Every retry has to get a permit from the client's shared {@link rs.lukaj.restclient.client.retry.RetryLimiter}. */
    LIMITED;

    static RetryMode of(boolean hasStrategy, boolean hasBreaker) {
        if(!hasStrategy) return NONE;
        return hasBreaker ? WITH_BREAKER : LIMITED;
    }
}
