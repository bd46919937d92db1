package rs.lukaj.restclient.client.telemetry;

import org.junit.jupiter.api.Test;
import rs.lukaj.restclient.client.retry.BackoffRetryStrategy;
import rs.lukaj.restclient.client.retry.RetryDecision;
import rs.lukaj.restclient.client.retry.RetryStrategy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class ClientConfigReporterTest {
    private final MetricsRecorder metrics = mock(MetricsRecorder.class);
    private final ClientConfigReporter reporter = new ClientConfigReporter(metrics);

    /**
     * Strategies describing themselves are reported with their parameters.
     */
    @Test
    public void reportsDescribedStrategy() {
        assertTrue(reporter.reportOnce("orders", Duration.ofMillis(800),
                new BackoffRetryStrategy(Duration.ofMillis(10), Duration.ofMillis(200), 3)));
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("X-Rest-Pool-Name", "orders");
        expected.put("X-Socket-Timeout", "800");
        expected.put("X-Retry-Strategy-Name", "backoff");
        expected.put("min_wait", 10L);
        expected.put("max_wait", 200L);
        expected.put("max_retries", 3);
        expected.put("growth", 2.0);
        verify(metrics).recordEvent(ClientConfigReporter.EVENT_NAME, expected);
    }

    @Test
    public void reportsEachPoolOnce() {
        RetryStrategy custom = (request, response, error, attempt) -> RetryDecision.stop();
        assertTrue(reporter.reportOnce("a", null, custom));
        assertFalse(reporter.reportOnce("a", Duration.ofSeconds(1), null));
        assertTrue(reporter.reportOnce("b", null, null));
        verify(metrics, times(2)).recordEvent(anyString(), anyMap());
        verify(metrics).recordEvent(ClientConfigReporter.EVENT_NAME, Map.of(
                "X-Rest-Pool-Name", "a",
                "X-Socket-Timeout", "0",
                "X-Retry-Strategy-Name", ClientConfigReporter.CUSTOM_STRATEGY));
    }
}
