package rs.lukaj.restclient.client.telemetry;

import rs.lukaj.restclient.client.RequestContext;

import java.util.Map;

/**
 * Supplies tracing headers (trace ids, baggage...) which should be forwarded with an outgoing request.
 */
public interface TracingPort {
    /**
     * Forwards whatever was attached to the context using {@link RequestContext#withForwardedHeader(String, String)}.
     */
    TracingPort CONTEXT = RequestContext::getForwardedHeaders;

    /**
     * @param context context of the call, never null
     * @return headers to forward; never null
     */
    Map<String, String> forwardedHeaders(RequestContext context);
}
