package rs.lukaj.restclient.client.telemetry;

import org.junit.jupiter.api.Test;
import rs.lukaj.restclient.connections.Endpoint;

import java.time.Duration;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class ConnectionMetricsTest {
    private final MetricsRecorder metrics = mock(MetricsRecorder.class);
    private final ConnectionMetrics listener = new ConnectionMetrics(metrics, "billing");
    private final Endpoint endpoint = new Endpoint("billing.internal", 80, false);

    @Test
    public void countsConnectionLifecycle() {
        listener.connectionRequested(endpoint);
        listener.connectionOpened(endpoint, false);
        listener.connectionObtained(endpoint, true);
        listener.connectionReturned(endpoint, true);

        verify(metrics).recordCount(ConnectionMetrics.CONN_REQUEST, 1, "target_id:billing");
        verify(metrics).recordCount(ConnectionMetrics.CONN_NEW, 1, "target_id:billing", "status:fail");
        verify(metrics).recordCount(ConnectionMetrics.CONN_GOT, 1, "target_id:billing", "status:reused");
        verify(metrics).recordCount(ConnectionMetrics.CONN_PUT_IDLE, 1, "target_id:billing", "status:ok");
    }

    @Test
    public void recordsTimings() {
        listener.connectDone(endpoint, Duration.ofMillis(12));
        listener.responseFirstByte(Duration.ofMillis(40));
        verify(metrics).recordGauge(ConnectionMetrics.TCP_CONNECT_TIME, 12.0, "target_id:billing");
        verify(metrics).recordGauge(ConnectionMetrics.RESPONSE_FIRST_BYTE_TIME, 40.0, "target_id:billing");
    }
}
