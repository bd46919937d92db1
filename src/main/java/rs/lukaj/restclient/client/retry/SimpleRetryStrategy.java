package rs.lukaj.restclient.client.retry;

import rs.lukaj.restclient.connections.HttpRequest;
import rs.lukaj.restclient.connections.HttpResponse;
import rs.lukaj.restclient.connections.InvalidConfigException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retries failed attempts (transport errors and 5xx responses) after a fixed delay. With maxRetries set to n,
 * request is attempted at most n+1 times.
 */
public class SimpleRetryStrategy implements RetryStrategy, ExposesParameters {
    private final int maxRetries;
    private final Duration delay;

    public SimpleRetryStrategy(int maxRetries, Duration delay) {
        if(maxRetries < 0) throw new InvalidConfigException("maxRetries can't be negative!");
        if(delay == null || delay.isNegative()) throw new InvalidConfigException("delay can't be negative!");
        this.maxRetries = maxRetries;
        this.delay = delay;
    }

    @Override
    public RetryDecision shouldRetry(HttpRequest request, HttpResponse response, Throwable error, int attempt) {
        if(attempt >= maxRetries || !RetryStrategy.isFailure(response, error)) return RetryDecision.stop();
        return RetryDecision.retryAfter(delay);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public String strategyName() {
        return "simple";
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("max_retries", maxRetries);
        params.put("delay", delay.toMillis());
        return params;
    }
}
