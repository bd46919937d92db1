package rs.lukaj.restclient.client;

import rs.lukaj.restclient.connections.ResponseHeaders;

import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caching metadata extracted from response headers.
 * <br/>
 * TTL comes from {@code Cache-Control: max-age} (or {@code s-maxage}) if present; only if it isn't, a future
 * {@code Expires} is used. Without a TTL, a response carrying {@code Last-Modified} or {@code ETag} can still be
 * cached, but has to be revalidated before each use.
 */
final class CacheHeaders {
    static final CacheHeaders NONE = new CacheHeaders(null, null, null);
    private static final Pattern MAX_AGE = Pattern.compile("(?:max-age|s-maxage)=(\\d+)");

    private final Instant ttl;
    private final Instant lastModified;
    private final String etag;

    private CacheHeaders(Instant ttl, Instant lastModified, String etag) {
        this.ttl = ttl;
        this.lastModified = lastModified;
        this.etag = etag;
    }

    static CacheHeaders parse(ResponseHeaders headers, Instant now) {
        Instant ttl = null;
        String cacheControl = headers.getCacheControl();
        Matcher m = cacheControl == null ? null : MAX_AGE.matcher(cacheControl);
        if(m != null && m.find()) {
            long seconds;
            try {
                seconds = Long.parseLong(m.group(1));
            } catch (NumberFormatException e) {
                seconds = 0; //absurdly big
            }
            if(seconds > 0) ttl = now.plusSeconds(seconds);
        } else {
            Instant expires = headers.getExpires();
            if(expires != null && expires.isAfter(now)) ttl = expires;
        }
        String etag = headers.getETag();
        if(etag != null && etag.isEmpty()) etag = null;
        return new CacheHeaders(ttl, headers.getLastModified(), etag);
    }

    Instant getTtl() {
        return ttl;
    }

    Instant getLastModified() {
        return lastModified;
    }

    String getETag() {
        return etag;
    }

    boolean isCacheable() {
        return ttl != null || lastModified != null || etag != null;
    }

    boolean needsRevalidation() {
        return ttl == null && (lastModified != null || etag != null);
    }
}
