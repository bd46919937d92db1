package rs.lukaj.restclient.client.retry;

import rs.lukaj.restclient.connections.HttpRequest;
import rs.lukaj.restclient.connections.HttpResponse;
import rs.lukaj.restclient.connections.InvalidConfigException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retries failed attempts (transport errors and 5xx responses) with exponentially growing delay:
 * {@code minWait * growth^attempt}, never less than minWait nor more than maxWait.
 */
public class BackoffRetryStrategy implements RetryStrategy, ExposesParameters {
    public static final double DEFAULT_GROWTH = 2.0;

    private final Duration minWait;
    private final Duration maxWait;
    private final int maxRetries;
    private final double growth;

    public BackoffRetryStrategy(Duration minWait, Duration maxWait, int maxRetries) {
        this(minWait, maxWait, maxRetries, DEFAULT_GROWTH);
    }

    public BackoffRetryStrategy(Duration minWait, Duration maxWait, int maxRetries, double growth) {
        if(minWait == null || minWait.isNegative()) throw new InvalidConfigException("minWait can't be negative!");
        if(maxWait == null || maxWait.compareTo(minWait) < 0) throw new InvalidConfigException("maxWait must be at least minWait!");
        if(maxRetries < 0) throw new InvalidConfigException("maxRetries can't be negative!");
        if(!(growth >= 1.0) || Double.isInfinite(growth)) throw new InvalidConfigException("growth must be a finite number >= 1!");
        this.minWait = minWait;
        this.maxWait = maxWait;
        this.maxRetries = maxRetries;
        this.growth = growth;
    }

    @Override
    public RetryDecision shouldRetry(HttpRequest request, HttpResponse response, Throwable error, int attempt) {
        if(attempt >= maxRetries || !RetryStrategy.isFailure(response, error)) return RetryDecision.stop();
        return RetryDecision.retryAfter(delayFor(attempt));
    }

    /**
     * @param attempt zero-based attempt which has just failed
     * @return how long to wait before the next one
     */
    public Duration delayFor(int attempt) {
        double millis = minWait.toMillis() * Math.pow(growth, attempt);
        if(Double.isInfinite(millis) || millis >= maxWait.toMillis()) return maxWait;
        return Duration.ofMillis(Math.max(minWait.toMillis(), (long) millis));
    }

    @Override
    public String strategyName() {
        return "backoff";
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("min_wait", minWait.toMillis());
        params.put("max_wait", maxWait.toMillis());
        params.put("max_retries", maxRetries);
        params.put("growth", growth);
        return params;
    }
}
