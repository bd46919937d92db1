package rs.lukaj.restclient.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rs.lukaj.restclient.connections.Http;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/**
 * Collects requests which should be executed in parallel. Obtained inside {@link RequestBuilder#forkJoin}: every
 * verb method only queues the request and hands out a {@link FutureResponse}, which is filled once the batch
 * is executed. Not thread-safe; requests should be queued from the callback only.
 */
public class Concurrent {
    private static final Logger LOG = LoggerFactory.getLogger(Concurrent.class);

    private final RequestBuilder builder;
    private final List<Callable<Void>> tasks = new ArrayList<>();

    Concurrent(RequestBuilder builder) {
        this.builder = builder;
    }

    public FutureResponse get(String url) {
        return doRequest(Http.Verb.GET, url, null, null);
    }

    public FutureResponse get(String url, RequestOptions options) {
        return doRequest(Http.Verb.GET, url, null, options);
    }

    public FutureResponse post(String url, Object body) {
        return doRequest(Http.Verb.POST, url, body, null);
    }

    public FutureResponse post(String url, Object body, RequestOptions options) {
        return doRequest(Http.Verb.POST, url, body, options);
    }

    public FutureResponse put(String url, Object body) {
        return doRequest(Http.Verb.PUT, url, body, null);
    }

    public FutureResponse put(String url, Object body, RequestOptions options) {
        return doRequest(Http.Verb.PUT, url, body, options);
    }

    public FutureResponse patch(String url, Object body) {
        return doRequest(Http.Verb.PATCH, url, body, null);
    }

    public FutureResponse patch(String url, Object body, RequestOptions options) {
        return doRequest(Http.Verb.PATCH, url, body, options);
    }

    public FutureResponse delete(String url) {
        return doRequest(Http.Verb.DELETE, url, null, null);
    }

    public FutureResponse delete(String url, RequestOptions options) {
        return doRequest(Http.Verb.DELETE, url, null, options);
    }

    public FutureResponse head(String url) {
        return doRequest(Http.Verb.HEAD, url, null, null);
    }

    public FutureResponse head(String url, RequestOptions options) {
        return doRequest(Http.Verb.HEAD, url, null, options);
    }

    public FutureResponse options(String url) {
        return doRequest(Http.Verb.OPTIONS, url, null, null);
    }

    public FutureResponse options(String url, RequestOptions options) {
        return doRequest(Http.Verb.OPTIONS, url, null, options);
    }

    /**
     * Queues a request with any verb.
     * @return holder which gets filled once the batch is executed
     */
    public FutureResponse doRequest(Http.Verb verb, String url, Object body, RequestOptions options) {
        FutureResponse future = new FutureResponse();
        tasks.add(() -> {
            Response response;
            try {
                response = builder.doRequest(verb, url, body, options);
            } catch (RuntimeException e) {
                LOG.warn("Queued request {} {} failed unexpectedly", verb, url, e);
                response = Response.failed(verb + " " + url, 0, e, builder.getContentType());
            }
            future.set(response);
            return null;
        });
        return future;
    }

    int size() {
        return tasks.size();
    }

    /**
     * Runs every queued request, each on its own worker, and waits for all of them to finish.
     * @throws InterruptedException if interrupted while waiting; requests still in progress are cancelled
     */
    void join(ExecutorService executor) throws InterruptedException {
        if(tasks.isEmpty()) return;
        LOG.debug("Executing {} requests concurrently", tasks.size());
        executor.invokeAll(tasks);
    }
}
