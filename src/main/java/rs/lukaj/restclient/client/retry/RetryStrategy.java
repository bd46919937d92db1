package rs.lukaj.restclient.client.retry;

import rs.lukaj.restclient.connections.HttpRequest;
import rs.lukaj.restclient.connections.HttpResponse;

/**
 * Decides whether a failed attempt should be repeated. Strategies are stateless: everything they need to know
 * about the request's history is passed in, so one instance can be shared by any number of requests.
 */
public interface RetryStrategy {
    /**
     * @param request request which has just been attempted
     * @param response response of the attempt; null if it failed with an exception
     * @param error exception thrown by the attempt; null if there is a response
     * @param attempt zero-based number of the attempt which has just finished
     * @return whether to repeat the request, and after what delay
     */
    RetryDecision shouldRetry(HttpRequest request, HttpResponse response, Throwable error, int attempt);

    /**
     * Attempts fail on transport errors and on 5xx responses.
     */
    static boolean isFailure(HttpResponse response, Throwable error) {
        return error != null || response == null || response.getStatus().isServerError();
    }
}
