package rs.lukaj.restclient.connections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

/**
 * This is used to represent a single transaction over the network, over a {@link HttpSocket} obtained from a
 * {@link ConnectionPool}. It can make multiple requests if needed (i.e. if server indicates a redirect, or if an
 * idle connection turns out to be closed by the server).
 * It is illegal to use one HttpTransaction object for multiple requests.
 */
public class HttpTransaction {
    private static final Logger LOG = LoggerFactory.getLogger(HttpTransaction.class);

    private final ConnectionPool connectionPool;
    private final ExchangeOptions options;
    private volatile boolean used = false;
    private int currRedirects = 0;

    /**
     * Create a new transaction which uses given connection pool to obtain a {@link HttpSocket}.
     * @param connectionPool connection pool used for obtaining sockets
     * @param options timeouts, redirect policy, cancellation and listener used for this transaction
     */
    public HttpTransaction(ConnectionPool connectionPool, ExchangeOptions options) {
        this.connectionPool = connectionPool;
        this.options = options;
    }

    /**
     * Send the request and read response status and headers. Body is left on the wire, to be read through
     * the returned response, which must be closed or fully read afterwards.
     * @param request request to send
     * @return response from the server (the last one, if redirects were followed)
     * @throws IOException if I/O exception occurs during transfer, response breaks the protocol or the
     *                     transaction has been cancelled
     */
    public HttpResponse execute(HttpRequest request) throws IOException {
        if(used) throw new IllegalStateException("Transaction has already been used!");
        used = true;

        HttpRequest current = request;
        while(true) {
            HttpResponse response = exchange(current);
            if(!options.isFollowRedirects() || !response.getStatus().isRedirect()) return response;
            String location = response.getHeaders().getLocation();
            if(location == null || location.isEmpty()) return response;

            response.drain();
            currRedirects++;
            if(currRedirects > ExchangeOptions.MAX_REDIRECTS) throw new InvalidResponseException("Too many redirects");
            current = redirectOf(current, response.getStatus().code, location);
            LOG.debug("Following redirect {} to {}", response.getStatus().code, current.getTarget());
        }
    }

    //303 always switches to GET; 301 and 302 do so for anything other than GET or HEAD, as browsers do
    private static HttpRequest redirectOf(HttpRequest previous, int code, String location) throws IOException {
        String target;
        try {
            target = previous.getTarget().toURI().resolve(new URI(location)).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new InvalidResponseException("Invalid redirect location: " + location, e);
        }
        Http.Verb verb = previous.getVerb();
        boolean switchToGet = (code == 303 && verb != Http.Verb.HEAD)
                || ((code == 301 || code == 302) && verb != Http.Verb.GET && verb != Http.Verb.HEAD);
        try {
            if(switchToGet) return previous.redirect(Http.Verb.GET, target, false);
            return previous.redirect(verb, target, true);
        } catch (InvalidRequestException e) {
            throw new InvalidResponseException("Invalid redirect location: " + location, e);
        }
    }

    private HttpResponse exchange(HttpRequest request) throws IOException {
        long start = System.nanoTime();
        HttpSocket socket = obtain(request.getEndpoint());
        boolean reused = socket.isReused();
        try {
            return exchangeOn(socket, request, start);
        } catch (StaleConnectionException stale) {
            if(!reused || !request.getVerb().isIdempotent()) throw stale.getCause();
            //server closed an idle connection while it was in the pool; that says nothing about the request
            LOG.debug("Idle connection to {} was closed by server, retrying {} on a fresh one", request.getEndpoint(), request);
            HttpSocket fresh = obtain(request.getEndpoint());
            try {
                return exchangeOn(fresh, request, start);
            } catch (StaleConnectionException again) {
                throw again.getCause();
            }
        }
    }

    private HttpSocket obtain(Endpoint endpoint) throws IOException {
        ensureNotCancelled();
        return connectionPool.getConnection(endpoint, options.getListener());
    }

    private HttpResponse exchangeOn(HttpSocket socket, HttpRequest request, long start) throws IOException {
        ConnectionListener listener = options.getListener();
        boolean headReceived = false;
        try (Cancellation.Registration ignored = options.getCancellation().onCancel(() -> abort(socket))) {
            socket.setReadTimeout(options.getReadTimeout());
            request.writeTo(socket);
            listener.requestWritten(since(start));
            HttpResponse response = HttpResponse.read(socket, request,
                    (s, reusable) -> connectionPool.release(s, reusable, listener));
            headReceived = true;
            listener.responseFirstByte(since(start));
            return response;
        } catch (IOException e) {
            connectionPool.release(socket, false, listener);
            if(options.getCancellation().isCancelled()) {
                InterruptedIOException cancelled = new InterruptedIOException("Request to " + request.getTarget() + " cancelled");
                cancelled.initCause(e);
                throw cancelled;
            }
            if(!headReceived && isStale(e)) throw new StaleConnectionException(e);
            throw e;
        } catch (RuntimeException e) {
            connectionPool.release(socket, false, listener);
            throw e;
        }
    }

    //failures which mean server has gone away before it even started answering
    private static boolean isStale(IOException e) {
        if(e instanceof SocketTimeoutException) return false;
        return e instanceof EOFException || e instanceof SocketException;
    }

    private void ensureNotCancelled() throws InterruptedIOException {
        if(options.getCancellation().isCancelled()) throw new InterruptedIOException("Request cancelled");
    }

    private static void abort(HttpSocket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("Error while aborting connection to {}", socket.getEndpoint(), e);
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static class StaleConnectionException extends IOException {
        private StaleConnectionException(IOException cause) {
            super(cause);
        }

        @Override
        public synchronized IOException getCause() {
            return (IOException) super.getCause();
        }
    }
}
