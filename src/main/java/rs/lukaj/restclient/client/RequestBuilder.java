package rs.lukaj.restclient.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rs.lukaj.restclient.Utils;
import rs.lukaj.restclient.client.circuitbreaker.CircuitBreaker;
import rs.lukaj.restclient.client.circuitbreaker.CircuitOpenException;
import rs.lukaj.restclient.client.retry.RetryDecision;
import rs.lukaj.restclient.client.retry.RetryStrategy;
import rs.lukaj.restclient.client.telemetry.ConnectionMetrics;
import rs.lukaj.restclient.connections.*;

import java.io.IOException;
import java.net.MalformedURLException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

/**
 * Makes requests to one remote service. Every request goes through the same steps: circuit breaker (if any) is
 * asked for permission, then the cache is consulted (for read requests, if caching is enabled), then the request
 * is sent over the pooled connection and retried according to the retry strategy, and finally the response is
 * stored in the cache and returned. Verb methods never throw; whatever goes wrong is reported through
 * {@link Response#getError()}.
 * <br/>
 * Builders are created by {@link RestClient#newRequestBuilder(Config)}, usually once per remote service, and
 * are safe for use from multiple threads.
 * <br/>
 * Example:
 * <pre>
 *     RequestBuilder users = client.newRequestBuilder(new RequestBuilder.Config()
 *                                  .setBaseUrl("http://users.internal")
 *                                  .setEnableCache(true)
 *                                  .setRetryStrategy(new SimpleRetryStrategy(2, Duration.ofMillis(50))));
 *     User user = users.get("/users/42").fillUp(User.class);
 * </pre>
 */
public class RequestBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(RequestBuilder.class);

    public static final String FORWARDED_HEADER_DIFF = "platform.traffic.forwarded_header.diff";
    public static final String RETRY_BREAK = "api_call.retry_break";
    static final String STACK_TAG = "stack:restclient-java";

    private final RestClient client;
    private final Config config;
    private final String poolName;
    private final String targetId;
    private final RetryMode retryMode;
    private final ConnectionListener connectionListener;
    private volatile Transport transport;

    RequestBuilder(RestClient client, Config config) {
        this.client = client;
        this.config = config.copy();
        this.poolName = this.config.poolName != null ? this.config.poolName : defaultPoolName();
        this.targetId = this.config.targetId != null ? this.config.targetId : poolName;
        this.retryMode = RetryMode.of(this.config.retryStrategy != null, this.config.circuitBreaker != null);
        this.connectionListener = this.config.disableHttpConnectionsMetrics
                ? ConnectionListener.NONE
                : new ConnectionMetrics(client.getMetrics(), targetId);
    }

    //pool is named after whoever builds the request builder, unless named explicitly
    private static String defaultPoolName() {
        String caller = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE)
                .walk(frames -> frames
                        .map(StackWalker.StackFrame::getDeclaringClass)
                        .filter(c -> c != RequestBuilder.class && c != RestClient.class)
                        .findFirst())
                .map(Class::getSimpleName)
                .filter(name -> !name.isEmpty())
                .orElse("RestClient");
        return "pool_" + caller;
    }

    public String getPoolName() {
        return poolName;
    }

    public ContentType getContentType() {
        return config.contentType;
    }

    RetryMode getRetryMode() {
        return retryMode;
    }

    public Response get(String url) {
        return doRequest(Http.Verb.GET, url, null, null);
    }

    public Response get(String url, RequestOptions options) {
        return doRequest(Http.Verb.GET, url, null, options);
    }

    public Response post(String url, Object body) {
        return doRequest(Http.Verb.POST, url, body, null);
    }

    public Response post(String url, Object body, RequestOptions options) {
        return doRequest(Http.Verb.POST, url, body, options);
    }

    public Response put(String url, Object body) {
        return doRequest(Http.Verb.PUT, url, body, null);
    }

    public Response put(String url, Object body, RequestOptions options) {
        return doRequest(Http.Verb.PUT, url, body, options);
    }

    public Response patch(String url, Object body) {
        return doRequest(Http.Verb.PATCH, url, body, null);
    }

    public Response patch(String url, Object body, RequestOptions options) {
        return doRequest(Http.Verb.PATCH, url, body, options);
    }

    public Response delete(String url) {
        return doRequest(Http.Verb.DELETE, url, null, null);
    }

    public Response delete(String url, RequestOptions options) {
        return doRequest(Http.Verb.DELETE, url, null, options);
    }

    public Response head(String url) {
        return doRequest(Http.Verb.HEAD, url, null, null);
    }

    public Response head(String url, RequestOptions options) {
        return doRequest(Http.Verb.HEAD, url, null, options);
    }

    public Response options(String url) {
        return doRequest(Http.Verb.OPTIONS, url, null, null);
    }

    public Response options(String url, RequestOptions options) {
        return doRequest(Http.Verb.OPTIONS, url, null, options);
    }

    /**
     * Queues requests through the callback and executes all of them in parallel, returning once every one of
     * them has completed. Requests don't affect each other: if one fails, the others still run to completion.
     * <pre>
     *     List&lt;FutureResponse&gt; responses = new ArrayList&lt;&gt;();
     *     builder.forkJoin(c -&gt; {
     *         for(String id : ids) responses.add(c.get("/items/" + id));
     *     });
     * </pre>
     * @param queue callback which queues the requests
     * @throws InterruptedException if interrupted while waiting; requests still in progress are cancelled
     */
    public void forkJoin(Consumer<Concurrent> queue) throws InterruptedException {
        Concurrent concurrent = new Concurrent(this);
        queue.accept(concurrent);
        concurrent.join(client.getExecutor());
    }

    /**
     * Executes a request.
     * @param verb request method
     * @param url path, appended to the base url as-is
     * @param body request body, marshalled according to the content type; may be null
     * @param options per-call headers and context; may be null
     * @return response, or a response carrying the error if the request couldn't be completed
     */
    public Response doRequest(Http.Verb verb, String url, Object body, RequestOptions options) {
        RequestOptions opts = options != null ? options : RequestOptions.create();
        RequestContext context = opts.getContext() != null ? opts.getContext() : RequestContext.create();
        String target = config.baseUrl + url;

        CircuitBreaker.Completion completion = null;
        if(config.circuitBreaker != null) {
            try {
                completion = config.circuitBreaker.allow();
            } catch (CircuitOpenException e) {
                LOG.debug("{} {} rejected: {}", verb, target, e.getMessage());
                return Response.failed(verb + " " + target, 500, e, config.contentType);
            }
        }

        Response response = null;
        try {
            response = execute(verb, target, body, opts, context);
            return response;
        } finally {
            if(completion != null)
                completion.done(response != null && response.getError() == null && response.getStatusCode() / 100 != 5);
        }
    }

    private Response execute(Http.Verb verb, String url, Object body, RequestOptions options, RequestContext context) {
        String requestLine = verb + " " + url;
        boolean useCache = config.enableCache && verb.isReadVerb();
        Response cached = null;
        if(useCache) {
            cached = client.getCache().get(url);
            if(cached != null && !cached.needsRevalidation()) {
                LOG.debug("Serving {} from cache", url);
                return cached.asCacheHit();
            }
        }

        HttpRequest request;
        try {
            byte[] payload = body != null || verb.isContentVerb() ? config.contentType.marshal(body) : null;
            request = HttpRequest.create(verb, url).setBody(payload);
        } catch (MalformedURLException e) {
            return Response.failed(requestLine, 0, new InvalidRequestException("Invalid url " + url, e), config.contentType);
        } catch (InvalidRequestException e) {
            return Response.failed(requestLine, 0, e, config.contentType);
        }

        HttpResponse response = null;
        IOException error = null;
        int attempt = 0;
        while(true) {
            long start = System.nanoTime();
            try {
                request.setHeaders(headersFor(verb, cached, options, context, attempt));
                response = transport().execute(request, exchangeOptions(context));
                error = null;
            } catch (IOException e) {
                response = null;
                error = e;
            } catch (InvalidRequestException | InvalidHeaderException e) {
                LOG.warn("Can't execute {}: {}", requestLine, e.getMessage());
                return Response.failed(requestLine, 0, e, config.contentType);
            }
            if(!config.disableApiCallMetrics) {
                String outcome = response == null ? "error" : String.valueOf(response.getStatus().code);
                client.getMetrics().recordCallOutcome(targetId, Duration.ofNanos(System.nanoTime() - start),
                        outcome, attempt > 0);
            }

            if(retryMode == RetryMode.NONE || context.isCancelled()) break;
            RetryDecision decision = config.retryStrategy.shouldRetry(request, response, error, attempt);
            if(!decision.shouldRetry()) break;

            HttpResponse failed = response;
            boolean[] slept = {false};
            try {
                if(retryMode == RetryMode.LIMITED) {
                    boolean admitted = client.getRetryLimiter().tryRun(
                            () -> slept[0] = backOff(failed, decision.getDelay(), context));
                    if(!admitted) {
                        LOG.warn("Too many retries in progress, not retrying {}", requestLine);
                        client.getMetrics().recordCount(RETRY_BREAK, 1, "target_id:" + targetId);
                        break;
                    }
                } else {
                    slept[0] = backOff(failed, decision.getDelay(), context);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(requestLine, e);
            }
            if(!slept[0]) return cancelled(requestLine, null);
            attempt++;
            LOG.debug("Retrying {}, attempt {}", requestLine, attempt);
        }

        if(error != null) return Response.failed(requestLine, 0, error, config.contentType);
        return complete(requestLine, url, response, useCache ? cached : null, useCache);
    }

    //previous response must be consumed before the connection can carry the next attempt
    private boolean backOff(HttpResponse previous, Duration delay, RequestContext context) throws InterruptedException {
        if(previous != null) previous.drain();
        return client.getSleeper().sleep(delay, context);
    }

    private Response cancelled(String requestLine, Throwable cause) {
        CancellationException e = new CancellationException("Request " + requestLine + " cancelled while waiting to retry");
        if(cause != null) e.initCause(cause);
        return Response.failed(requestLine, 0, e, config.contentType);
    }

    private Response complete(String requestLine, String url, HttpResponse response, Response cached, boolean useCache) {
        HttpResponse.Status status = response.getStatus();
        ResponseHeaders headers = response.getHeaders();
        byte[] body;
        try (response) {
            body = response.readBody();
        } catch (IOException e) {
            return Response.failed(requestLine, 0, e, config.contentType);
        }

        if(status.code == 304 && cached != null) {
            LOG.debug("{} not modified, serving cached copy", url);
            return cached.asCacheHit();
        }

        if(config.uncompressResponse && body.length > 0 && Utils.isGzip(headers.getContentEncoding(), headers.getContentType())) {
            try {
                body = Utils.gunzip(body);
            } catch (IOException e) {
                LOG.warn("Can't decompress body of {}", requestLine, e);
                return new Response(requestLine, status.code, status.phrase, headers, null, config.contentType,
                        e, null, false);
            }
        }

        CacheHeaders caching = CacheHeaders.parse(headers, client.getCache().now());
        Response result = new Response(requestLine, status.code, status.phrase, headers, body, config.contentType,
                null, caching, false);
        if(useCache && caching.isCacheable() && client.getCache().setIfAbsent(url, result))
            LOG.debug("Cached {} until {}", url, caching.getTtl());
        return result;
    }

    RequestHeaders headersFor(Http.Verb verb, Response cached, RequestOptions options, RequestContext context, int attempt) {
        RequestHeaders headers = config.headers.copy();
        headers.setConnection("keep-alive");
        headers.setCacheControl("no-cache");
        if(config.basicAuthUser != null) headers.setBasicAuthorization(config.basicAuthUser, config.basicAuthPassword);
        headers.setUserAgent(config.userAgent);
        if(config.contentType.accept() != null) headers.setAccept(config.contentType.accept());
        if(verb.isContentVerb()) headers.setContentType(config.contentType.getMime());
        if(cached != null) {
            if(cached.getETag() != null) headers.setIfNoneMatch(cached.getETag());
            else if(cached.getLastModified() != null) headers.setIfModifiedSince(cached.getLastModified());
        }
        if(!config.disableTimeout) headers.setHeader("X-Socket-Timeout", Utils.millis(config.timeout));
        headers.setHeader("X-Rest-Pool-Name", poolName);
        if(attempt > 0) headers.setHeader("X-Retry", String.valueOf(attempt));
        headers.setAll(options.getHeaders());

        for(Map.Entry<String, String> forwarded : client.getTracing().forwardedHeaders(context).entrySet()) {
            String existing = headers.getHeader(forwarded.getKey());
            if(existing == null) {
                try {
                    headers.setHeader(forwarded.getKey(), forwarded.getValue());
                } catch (InvalidHeaderException e) {
                    LOG.warn("Not forwarding invalid tracing header: {}", e.getMessage());
                }
            } else if(!existing.equals(forwarded.getValue())) {
                client.getMetrics().recordCount(FORWARDED_HEADER_DIFF, 1, STACK_TAG,
                        "header:" + forwarded.getKey().toLowerCase(Locale.ROOT));
            }
        }
        return headers;
    }

    private ExchangeOptions exchangeOptions(RequestContext context) {
        Duration readTimeout = Duration.ZERO;
        if(!config.disableTimeout) {
            readTimeout = config.timeout;
            Optional<Duration> left = context.remaining();
            if(left.isPresent() && left.get().compareTo(readTimeout) < 0)
                readTimeout = left.get().isZero() ? Duration.ofMillis(1) : left.get();
        }
        return new ExchangeOptions()
                .setReadTimeout(readTimeout)
                .setFollowRedirects(config.followRedirect)
                .setListener(connectionListener)
                .setCancellation(context);
    }

    Transport transport() {
        Transport t = transport;
        if(t == null) {
            PoolConfig poolConfig = new PoolConfig(poolName)
                    .setConnectTimeout(config.connectTimeout)
                    .setMaxIdleConnsPerHost(config.maxIdleConnsPerHost)
                    .setProxy(config.proxy);
            t = client.getPools().getTransport(poolConfig);
            client.getConfigReporter().reportOnce(poolName, config.disableTimeout ? null : config.timeout,
                    config.retryStrategy);
            transport = t;
        }
        return t;
    }

    /**
     * Configuration of a {@link RequestBuilder}. Builder copies it when it's created, so changing the config
     * afterwards doesn't affect existing builders. All setters validate their input and allow chaining.
     */
    public static class Config {
        public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(500);
        public static final String DEFAULT_USER_AGENT = "rs.lukaj/restclient";

        private String baseUrl = "";
        private ContentType contentType = ContentType.JSON;
        private RequestHeaders headers = new RequestHeaders();
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean disableTimeout = false;
        private Duration connectTimeout = PoolConfig.DEFAULT_CONNECT_TIMEOUT;
        private int maxIdleConnsPerHost = PoolConfig.DEFAULT_MAX_IDLE_PER_HOST;
        private String proxy;
        private String poolName;
        private boolean enableCache = false;
        private boolean uncompressResponse = false;
        private boolean followRedirect = false;
        private String userAgent = DEFAULT_USER_AGENT;
        private String basicAuthUser;
        private String basicAuthPassword;
        private RetryStrategy retryStrategy;
        private CircuitBreaker circuitBreaker;
        private String targetId;
        private boolean disableApiCallMetrics = false;
        private boolean disableHttpConnectionsMetrics = false;

        Config copy() {
            Config copy = new Config();
            copy.baseUrl = baseUrl;
            copy.contentType = contentType;
            copy.headers = headers.copy();
            copy.timeout = timeout;
            copy.disableTimeout = disableTimeout;
            copy.connectTimeout = connectTimeout;
            copy.maxIdleConnsPerHost = maxIdleConnsPerHost;
            copy.proxy = proxy;
            copy.poolName = poolName;
            copy.enableCache = enableCache;
            copy.uncompressResponse = uncompressResponse;
            copy.followRedirect = followRedirect;
            copy.userAgent = userAgent;
            copy.basicAuthUser = basicAuthUser;
            copy.basicAuthPassword = basicAuthPassword;
            copy.retryStrategy = retryStrategy;
            copy.circuitBreaker = circuitBreaker;
            copy.targetId = targetId;
            copy.disableApiCallMetrics = disableApiCallMetrics;
            copy.disableHttpConnectionsMetrics = disableHttpConnectionsMetrics;
            return copy;
        }

        /**
         * Sets prefix of every request url, e.g. {@code http://users.internal/api}. Paths given to verb methods
         * are appended to it as-is.
         */
        public Config setBaseUrl(String baseUrl) {
            if(baseUrl == null) throw new InvalidConfigException("baseUrl can't be null! Use empty string for no prefix");
            this.baseUrl = baseUrl;
            return this;
        }

        public Config setContentType(ContentType contentType) {
            if(contentType == null) throw new InvalidConfigException("contentType can't be null!");
            this.contentType = contentType;
            return this;
        }

        /**
         * Adds a header sent with every request. Headers set by the builder itself take precedence.
         */
        public Config addHeader(String name, String value) {
            try {
                headers.setHeader(name, value);
            } catch (InvalidHeaderException e) {
                throw new InvalidConfigException("Invalid header " + name + ": " + e.getMessage());
            }
            return this;
        }

        /**
         * Sets how long to wait for the server to answer, i.e. maximum time a single read can block.
         * @param timeout request timeout, 500ms by default
         */
        public Config setTimeout(Duration timeout) {
            if(timeout == null || timeout.isNegative() || timeout.isZero())
                throw new InvalidConfigException("timeout must be positive! Use setDisableTimeout to wait forever");
            this.timeout = timeout;
            return this;
        }

        public Config setDisableTimeout(boolean disableTimeout) {
            this.disableTimeout = disableTimeout;
            return this;
        }

        /**
         * @see PoolConfig#setConnectTimeout(Duration)
         */
        public Config setConnectTimeout(Duration connectTimeout) {
            if(connectTimeout == null || connectTimeout.isNegative())
                throw new InvalidConfigException("connectTimeout can't be negative!");
            this.connectTimeout = connectTimeout;
            return this;
        }

        /**
         * @see PoolConfig#setMaxIdleConnsPerHost(int)
         */
        public Config setMaxIdleConnsPerHost(int maxIdleConnsPerHost) {
            if(maxIdleConnsPerHost < 0) throw new InvalidConfigException("maxIdleConnsPerHost can't be negative!");
            this.maxIdleConnsPerHost = maxIdleConnsPerHost;
            return this;
        }

        /**
         * @see PoolConfig#setProxy(String)
         */
        public Config setProxy(String proxy) {
            new PoolConfig("validation").setProxy(proxy);
            this.proxy = proxy;
            return this;
        }

        /**
         * Sets name of the connection pool. Builders using the same name share connections, and the pool is
         * configured by whichever of them is used first. If not set, it's derived from the class creating
         * the builder.
         */
        public Config setPoolName(String poolName) {
            if(poolName != null && poolName.trim().isEmpty()) throw new InvalidConfigException("poolName can't be blank!");
            this.poolName = poolName;
            return this;
        }

        /**
         * If enabled, responses to GET, HEAD and OPTIONS requests carrying caching headers are kept in the
         * client's cache.
         */
        public Config setEnableCache(boolean enableCache) {
            this.enableCache = enableCache;
            return this;
        }

        /**
         * If enabled, gzip-compressed bodies are decompressed before being returned.
         */
        public Config setUncompressResponse(boolean uncompressResponse) {
            this.uncompressResponse = uncompressResponse;
            return this;
        }

        public Config setFollowRedirect(boolean followRedirect) {
            this.followRedirect = followRedirect;
            return this;
        }

        public Config setUserAgent(String userAgent) {
            if(userAgent == null || userAgent.isEmpty()) throw new InvalidConfigException("userAgent can't be empty!");
            this.userAgent = userAgent;
            return this;
        }

        /**
         * Sets credentials sent as Basic authorization with every request. Null username removes them.
         */
        public Config setBasicAuth(String username, String password) {
            if(username != null && username.indexOf(':') >= 0)
                throw new InvalidConfigException("Username can't contain a colon!");
            this.basicAuthUser = username;
            this.basicAuthPassword = username == null ? null : (password == null ? "" : password);
            return this;
        }

        /**
         * Sets strategy deciding whether failed requests are repeated. Null means they aren't.
         */
        public Config setRetryStrategy(RetryStrategy retryStrategy) {
            this.retryStrategy = retryStrategy;
            return this;
        }

        public Config setCircuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        /**
         * Sets name of the called service, used to tag metrics. Defaults to the pool name.
         */
        public Config setTargetId(String targetId) {
            if(targetId != null && targetId.trim().isEmpty()) throw new InvalidConfigException("targetId can't be blank!");
            this.targetId = targetId;
            return this;
        }

        public Config setDisableApiCallMetrics(boolean disableApiCallMetrics) {
            this.disableApiCallMetrics = disableApiCallMetrics;
            return this;
        }

        public Config setDisableHttpConnectionsMetrics(boolean disableHttpConnectionsMetrics) {
            this.disableHttpConnectionsMetrics = disableHttpConnectionsMetrics;
            return this;
        }
    }
}
