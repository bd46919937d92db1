package rs.lukaj.restclient.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rs.lukaj.restclient.client.retry.RetryLimiter;
import rs.lukaj.restclient.client.telemetry.ClientConfigReporter;
import rs.lukaj.restclient.client.telemetry.MetricsRecorder;
import rs.lukaj.restclient.client.telemetry.TracingPort;
import rs.lukaj.restclient.connections.PoolRegistry;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Top-level class of the library. Owns everything request builders share: response cache, connection pools,
 * retry limiter, metrics and tracing ports, and the executor running concurrent requests. Usually there's one
 * client per application, created at startup and closed at shutdown.
 * <br/>
 * Example with default values:
 * <pre>
 *     RequestBuilder builder = RestClient.create().newRequestBuilder(new RequestBuilder.Config()
 *                                                                     .setBaseUrl("http://localhost:8080"));
 * </pre>
 * <br/>
 * More customized example:
 * <pre>
 *     RestClient client = RestClient.create()
 *                                   .withMetrics(myStatsdRecorder)
 *                                   .withRetryLimiter(new RetryLimiter(20));
 *     RequestBuilder users = client.newRequestBuilder(usersConfig);
 *     RequestBuilder orders = client.newRequestBuilder(ordersConfig);
 * </pre>
 * The {@code with} methods should be called before creating any request builders; builders created earlier
 * keep using whatever they got when they were created.
 */
public class RestClient implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RestClient.class);

    private ResourceCache       cache          = new ResourceCache();
    private PoolRegistry        pools          = new PoolRegistry();
    private RetryLimiter        retryLimiter   = new RetryLimiter();
    private MetricsRecorder     metrics        = MetricsRecorder.NONE;
    private ClientConfigReporter configReporter = new ClientConfigReporter(metrics);
    private TracingPort         tracing        = TracingPort.CONTEXT;
    private ExecutorService     executor       = Executors.newCachedThreadPool();
    private Sleeper             sleeper        = Sleeper.CONTEXT;

    private RestClient() {
    }

    /**
     * Create a {@link RestClient} with default parameters.
     * @return a new {@link RestClient} instance
     */
    public static RestClient create() {
        return new RestClient();
    }

    /**
     * Set cache used for responses of builders with caching enabled.
     * @return this instance, to allow chaining
     */
    public RestClient withCache(ResourceCache cache) {
        this.cache = cache;
        return this;
    }

    /**
     * Set registry from which builders get their connection pools. Builders of two clients sharing a registry
     * share pools too.
     * @return this instance, to allow chaining
     */
    public RestClient withPools(PoolRegistry pools) {
        this.pools = pools;
        return this;
    }

    /**
     * Set limiter which bounds the number of concurrent retries of builders without a circuit breaker.
     * @return this instance, to allow chaining
     */
    public RestClient withRetryLimiter(RetryLimiter retryLimiter) {
        this.retryLimiter = retryLimiter;
        return this;
    }

    /**
     * Set recorder receiving call outcomes, connection metrics and configuration events.
     * @return this instance, to allow chaining
     */
    public RestClient withMetrics(MetricsRecorder metrics) {
        this.metrics = metrics == null ? MetricsRecorder.NONE : metrics;
        this.configReporter = new ClientConfigReporter(this.metrics);
        return this;
    }

    /**
     * Set source of tracing headers forwarded with every request.
     * @return this instance, to allow chaining
     */
    public RestClient withTracing(TracingPort tracing) {
        this.tracing = tracing == null ? TracingPort.CONTEXT : tracing;
        return this;
    }

    /**
     * Set executor which runs requests of {@link RequestBuilder#forkJoin} batches. It needs as many threads as
     * there are requests in the largest batch for them to really run in parallel. Default one is a cached
     * thread pool.
     * @return this instance, to allow chaining
     */
    public RestClient withExecutor(ExecutorService executor) {
        this.executor = executor;
        return this;
    }

    RestClient withSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
        return this;
    }

    /**
     * Create a new request builder. Configuration is copied, so it can be reused for other builders.
     * @param config builder configuration
     * @return new {@link RequestBuilder}
     */
    public RequestBuilder newRequestBuilder(RequestBuilder.Config config) {
        return new RequestBuilder(this, config);
    }

    public ResourceCache getCache() {
        return cache;
    }

    public PoolRegistry getPools() {
        return pools;
    }

    public RetryLimiter getRetryLimiter() {
        return retryLimiter;
    }

    public MetricsRecorder getMetrics() {
        return metrics;
    }

    public TracingPort getTracing() {
        return tracing;
    }

    ExecutorService getExecutor() {
        return executor;
    }

    ClientConfigReporter getConfigReporter() {
        return configReporter;
    }

    Sleeper getSleeper() {
        return sleeper;
    }

    /**
     * Stops the executor and closes all pooled connections. Requests in progress aren't waited for.
     */
    @Override
    public void close() {
        LOG.debug("Closing client");
        executor.shutdownNow();
        pools.close();
    }
}
