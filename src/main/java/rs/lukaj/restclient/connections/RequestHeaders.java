package rs.lukaj.restclient.connections;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Base64;

/**
 * Headers which are sent with the request. Provides helper functions for setting them.
 * If empty or null is passed to helper functions, header is removed.
 */
public class RequestHeaders extends Headers {

    public RequestHeaders() {
    }

    public RequestHeaders copy() {
        RequestHeaders copy = new RequestHeaders();
        copy.setAll(this);
        return copy;
    }

    private void setOrRemove(String header, String value) {
        if(value == null || value.isEmpty()) removeHeader(header);
        else setHeader(header, value);
    }

    public void setBasicAuthorization(String username, String password) {
        if(username == null) {
            removeHeader("Authorization");
            return;
        }
        String credentials = username + ":" + (password == null ? "" : password);
        setHeader("Authorization", "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
    }
    public void setConnection(String connection) {
        setOrRemove("Connection", connection);
    }
    public void setCacheControl(String cacheControl) {
        setOrRemove("Cache-Control", cacheControl);
    }
    public void setContentLength(long contentLength) {
        if(contentLength < 0) throw new InvalidHeaderException("Content-Length can't be negative: " + contentLength);
        setHeader("Content-Length", String.valueOf(contentLength));
    }
    public void setContentType(String type) {
        setOrRemove("Content-Type", type);
    }
    public void setHost(String host) {
        setOrRemove("Host", host);
    }
    public void setUserAgent(String userAgent) {
        setOrRemove("User-Agent", userAgent);
    }
    public void setAccept(String types) {
        setOrRemove("Accept", types);
    }
    public void setIfNoneMatch(String etag) {
        setOrRemove("If-None-Match", etag);
    }
    public void setIfModifiedSince(Instant lastModified) {
        if(lastModified == null) removeHeader("If-Modified-Since");
        else setHeader("If-Modified-Since", DateTimeFormatter.RFC_1123_DATE_TIME.format(lastModified.atOffset(ZoneOffset.UTC)));
    }
}
