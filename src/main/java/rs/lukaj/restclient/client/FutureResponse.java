package rs.lukaj.restclient.client;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder for the response of a request queued with {@link Concurrent}. It's filled exactly once, by the worker
 * which executed the request, and can be read any number of times afterwards. Reading never blocks:
 * {@link RequestBuilder#forkJoin} returns only once every holder of the batch has been filled.
 */
public class FutureResponse {
    private final AtomicReference<Response> response = new AtomicReference<>();

    void set(Response value) {
        if(value == null) throw new IllegalArgumentException("Response can't be null");
        if(!response.compareAndSet(null, value))
            throw new IllegalStateException("Response has already been set");
    }

    /**
     * @return the response, or null if the request hasn't completed yet
     */
    public Response peek() {
        return response.get();
    }

    public boolean isDone() {
        return response.get() != null;
    }

    @Override
    public String toString() {
        Response r = response.get();
        return r == null ? "FutureResponse{pending}" : "FutureResponse{" + r + "}";
    }
}
