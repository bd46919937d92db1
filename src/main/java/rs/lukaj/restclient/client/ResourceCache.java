package rs.lukaj.restclient.client;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Responses to read requests, keyed by request URL. There's at most one entry per URL and no eviction apart from
 * expiry: entries past their TTL are kept, but marked as stale when looked up, so the next request revalidates
 * them instead of serving them. Safe for concurrent use; operations are atomic per key.
 */
public class ResourceCache {
    private final ConcurrentMap<String, Response> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public ResourceCache() {
        this(Clock.systemUTC());
    }

    ResourceCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return cached response for the URL, possibly one which needs revalidation; null if there's none
     */
    public Response get(String url) {
        Response cached = entries.get(url);
        if(cached == null) return null;
        if(cached.getTtl() != null && !clock.instant().isBefore(cached.getTtl())) cached.markStale();
        return cached;
    }

    /**
     * Stores the response, unless there's already an entry for the URL which doesn't need revalidation.
     * Stale entries are replaced.
     * @return whether the response was stored
     */
    public boolean setIfAbsent(String url, Response response) {
        boolean[] stored = {false};
        entries.compute(url, (key, existing) -> {
            if(existing == null || existing.needsRevalidation()) {
                stored[0] = true;
                return response;
            }
            return existing;
        });
        return stored[0];
    }

    /**
     * Time against which TTLs of responses stored here are computed and checked.
     */
    Instant now() {
        return clock.instant();
    }

    public void evict(String url) {
        entries.remove(url);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
