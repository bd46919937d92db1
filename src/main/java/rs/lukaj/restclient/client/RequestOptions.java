package rs.lukaj.restclient.client;

import rs.lukaj.restclient.connections.RequestHeaders;

/**
 * Per-call additions to a request: extra headers, which win over everything the builder sets, and the
 * {@link RequestContext} the call belongs to. All methods allow chaining.
 */
public class RequestOptions {
    private final RequestHeaders headers = new RequestHeaders();
    private RequestContext context;

    public static RequestOptions create() {
        return new RequestOptions();
    }

    public RequestOptions header(String name, String value) {
        headers.setHeader(name, value);
        return this;
    }

    public RequestOptions context(RequestContext context) {
        this.context = context;
        return this;
    }

    public RequestHeaders getHeaders() {
        return headers.copy();
    }

    /**
     * @return context of the call, or null if none was set
     */
    public RequestContext getContext() {
        return context;
    }
}
