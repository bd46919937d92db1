package rs.lukaj.restclient.client.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rs.lukaj.restclient.Utils;
import rs.lukaj.restclient.client.retry.ExposesParameters;
import rs.lukaj.restclient.client.retry.RetryStrategy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reports the configuration each pool is used with, once per pool name.
 */
public class ClientConfigReporter {
    private static final Logger LOG = LoggerFactory.getLogger(ClientConfigReporter.class);

    public static final String EVENT_NAME = "RestClientApplicationConfigs";
    public static final String CUSTOM_STRATEGY = "customRetryStrategy";

    private final MetricsRecorder metrics;
    private final Set<String> reported = ConcurrentHashMap.newKeySet();

    public ClientConfigReporter(MetricsRecorder metrics) {
        this.metrics = metrics;
    }

    /**
     * Emits the configuration event, unless one has already been emitted for this pool.
     * @param poolName name of the pool
     * @param socketTimeout request timeout, or null if disabled
     * @param strategy retry strategy, or null if requests aren't retried
     * @return whether the event was emitted
     */
    public boolean reportOnce(String poolName, Duration socketTimeout, RetryStrategy strategy) {
        if(!reported.add(poolName)) return false;
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("X-Rest-Pool-Name", poolName);
        attributes.put("X-Socket-Timeout", socketTimeout == null ? "0" : Utils.millis(socketTimeout));
        if(strategy instanceof ExposesParameters) {
            ExposesParameters described = (ExposesParameters) strategy;
            attributes.put("X-Retry-Strategy-Name", described.strategyName());
            attributes.putAll(described.parameters());
        } else if(strategy != null) {
            attributes.put("X-Retry-Strategy-Name", CUSTOM_STRATEGY);
        }
        LOG.info("Pool {} configured with {}", poolName, attributes);
        metrics.recordEvent(EVENT_NAME, attributes);
        return true;
    }
}
