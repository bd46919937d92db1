package rs.lukaj.restclient.client.telemetry;

import rs.lukaj.restclient.connections.ConnectionListener;
import rs.lukaj.restclient.connections.Endpoint;

import java.time.Duration;

/**
 * Turns connection lifecycle notifications into counters and timing gauges, tagged with the target id.
 */
public class ConnectionMetrics implements ConnectionListener {
    public static final String CONN_REQUEST = "conn_request";
    public static final String CONN_GOT = "conn_got";
    public static final String CONN_NEW = "conn_new";
    public static final String CONN_PUT_IDLE = "conn_put_idle";
    public static final String TCP_CONNECT_TIME = "toolkit.http.tcp_connect.time";
    public static final String TLS_HANDSHAKE_TIME = "toolkit.http.tls_handshake.time";
    public static final String REQUEST_WRITTEN_TIME = "toolkit.http.request_written.time";
    public static final String RESPONSE_FIRST_BYTE_TIME = "toolkit.http.response_first_byte.time";

    private final MetricsRecorder metrics;
    private final String targetTag;

    public ConnectionMetrics(MetricsRecorder metrics, String targetId) {
        this.metrics = metrics;
        this.targetTag = "target_id:" + targetId;
    }

    @Override
    public void connectionRequested(Endpoint endpoint) {
        metrics.recordCount(CONN_REQUEST, 1, targetTag);
    }

    @Override
    public void connectionObtained(Endpoint endpoint, boolean reused) {
        metrics.recordCount(CONN_GOT, 1, targetTag, reused ? "status:reused" : "status:not_reused");
    }

    @Override
    public void connectionOpened(Endpoint endpoint, boolean success) {
        metrics.recordCount(CONN_NEW, 1, targetTag, success ? "status:ok" : "status:fail");
    }

    @Override
    public void connectionReturned(Endpoint endpoint, boolean keptIdle) {
        metrics.recordCount(CONN_PUT_IDLE, 1, targetTag, keptIdle ? "status:ok" : "status:fail");
    }

    @Override
    public void connectDone(Endpoint endpoint, Duration took) {
        metrics.recordGauge(TCP_CONNECT_TIME, took.toMillis(), targetTag);
    }

    @Override
    public void tlsHandshakeDone(Endpoint endpoint, Duration took) {
        metrics.recordGauge(TLS_HANDSHAKE_TIME, took.toMillis(), targetTag);
    }

    @Override
    public void requestWritten(Duration sinceStart) {
        metrics.recordGauge(REQUEST_WRITTEN_TIME, sinceStart.toMillis(), targetTag);
    }

    @Override
    public void responseFirstByte(Duration sinceStart) {
        metrics.recordGauge(RESPONSE_FIRST_BYTE_TIME, sinceStart.toMillis(), targetTag);
    }
}
