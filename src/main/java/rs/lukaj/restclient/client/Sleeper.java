package rs.lukaj.restclient.client;

import java.time.Duration;

/**
 * Waits between retry attempts. Replaced in tests, so retries can be counted without actually waiting.
 */
@FunctionalInterface
interface Sleeper {
    Sleeper CONTEXT = (duration, context) -> context.sleep(duration);

    /**
     * @return true if slept the whole time, false if the context was cancelled or ran out of time
     */
    boolean sleep(Duration duration, RequestContext context) throws InterruptedException;
}
