package rs.lukaj.restclient.client;

import rs.lukaj.restclient.connections.ResponseHeaders;

import java.io.IOException;
import java.time.Instant;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Result of a request. Either carries what the server answered (status, headers, body, caching metadata), or
 * an error describing why there is no answer; sometimes both (e.g. body failed to decompress). Requests never
 * throw: every failure ends up here.
 * <br/>
 * Responses are immutable, except that the one kept in the cache can be marked as needing revalidation.
 */
public class Response {
    private final String requestLine;
    private final int statusCode;
    private final String statusPhrase;
    private final ResponseHeaders headers;
    private final byte[] body;
    private final ContentType contentType;
    private final Throwable error;
    private final CacheHeaders caching;
    private final boolean fromCache;
    private volatile boolean revalidate;

    Response(String requestLine, int statusCode, String statusPhrase, ResponseHeaders headers, byte[] body,
             ContentType contentType, Throwable error, CacheHeaders caching, boolean fromCache) {
        this.requestLine = requestLine;
        this.statusCode = statusCode;
        this.statusPhrase = statusPhrase == null ? "" : statusPhrase;
        this.headers = headers == null ? new ResponseHeaders() : headers;
        this.body = body;
        this.contentType = contentType;
        this.error = error;
        this.caching = caching == null ? CacheHeaders.NONE : caching;
        this.fromCache = fromCache;
        this.revalidate = this.caching.needsRevalidation();
    }

    /**
     * Response carrying only an error, i.e. one for which server wasn't asked or didn't answer.
     * @param statusCode 0 for local and transport errors; 500 when circuit breaker rejected the call
     */
    static Response failed(String requestLine, int statusCode, Throwable error, ContentType contentType) {
        return new Response(requestLine, statusCode, "", null, null, contentType, error, null, false);
    }

    /**
     * @return copy of this response, marked as served from cache
     */
    Response asCacheHit() {
        return new Response(requestLine, statusCode, statusPhrase, headers, body, contentType, error, caching, true);
    }

    /**
     * Called by the cache when TTL has passed: next request for the same resource has to go to the network.
     */
    void markStale() {
        revalidate = true;
    }

    /**
     * @return status code, or 0 if server didn't answer
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getStatusPhrase() {
        return statusPhrase;
    }

    public ResponseHeaders getHeaders() {
        return headers.copy();
    }

    public String getHeader(String name) {
        return headers.getHeader(name);
    }

    /**
     * @return body bytes (a copy), or null if there is no body
     */
    public byte[] getBytes() {
        return body == null ? null : body.clone();
    }

    /**
     * @return body as UTF-8 string, or empty string if there is none
     */
    public String getString() {
        return body == null ? "" : new String(body, UTF_8);
    }

    /**
     * Unmarshals body into an instance of the given class, using the format the request builder is configured
     * with (JSON or XML).
     * @throws IOException if there's no body, or it doesn't fit the type
     */
    public <T> T fillUp(Class<T> type) throws IOException {
        if(body == null) throw new IOException("Response has no body", error);
        return contentType.unmarshal(body, type);
    }

    /**
     * @return why the request failed, or null
     */
    public Throwable getError() {
        return error;
    }

    /**
     * @return true if request failed, or server answered with 4xx or 5xx
     */
    public boolean isError() {
        return error != null || statusCode >= 400 || statusCode == 0;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    /**
     * @return until when this response may be served from cache without asking server; null if not known
     */
    public Instant getTtl() {
        return caching.getTtl();
    }

    public Instant getLastModified() {
        return caching.getLastModified();
    }

    public String getETag() {
        return caching.getETag();
    }

    /**
     * @return whether server has to be asked whether cached copy of this response is still valid
     */
    public boolean needsRevalidation() {
        return revalidate;
    }

    CacheHeaders getCaching() {
        return caching;
    }

    /**
     * Human-readable dump of request and response, meant for logs.
     */
    public String debug() {
        StringBuilder sb = new StringBuilder(256);
        sb.append("> ").append(requestLine).append('\n');
        if(error != null) sb.append("! ").append(error).append('\n');
        if(statusCode != 0) {
            sb.append("< ").append(statusCode).append(' ').append(statusPhrase);
            if(fromCache) sb.append(" (from cache)");
            sb.append('\n');
            for(java.util.Map.Entry<String, String> h : headers.asMap().entrySet())
                sb.append("< ").append(h.getKey()).append(": ").append(h.getValue()).append('\n');
            sb.append('\n').append(getString());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        if(error != null && statusCode == 0) return "Response{error=" + error + "}";
        return "Response{" + statusCode + " " + statusPhrase + (fromCache ? ", from cache" : "") + "}";
    }
}
