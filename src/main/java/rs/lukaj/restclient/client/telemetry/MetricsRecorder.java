package rs.lukaj.restclient.client.telemetry;

import java.time.Duration;
import java.util.Map;

/**
 * Port through which the client reports what it's doing. Backends (statsd, micrometer, logs...) implement it;
 * the client never depends on one directly. Implementations must be thread-safe and shouldn't block.
 * <br/>
 * Tags are passed as {@code key:value} strings.
 */
public interface MetricsRecorder {
    /**
     * Does nothing.
     */
    MetricsRecorder NONE = new MetricsRecorder() {
        @Override
        public void recordCallOutcome(String targetId, Duration elapsed, String outcome, boolean wasRetry) {
        }

        @Override
        public void recordCount(String name, long value, String... tags) {
        }

        @Override
        public void recordGauge(String name, double value, String... tags) {
        }
    };

    /**
     * Called once per network attempt.
     * @param targetId logical name of the called service
     * @param elapsed time the attempt took
     * @param outcome status code as string, or {@code "error"} if there is none
     * @param wasRetry whether this is not the first attempt of the request
     */
    void recordCallOutcome(String targetId, Duration elapsed, String outcome, boolean wasRetry);

    void recordCount(String name, long value, String... tags);

    void recordGauge(String name, double value, String... tags);

    /**
     * Records a one-off structured event, e.g. configuration a pool has been built with.
     */
    default void recordEvent(String name, Map<String, Object> attributes) {
    }
}
