/**
 * Classes meant to be used by the programmer to make requests to remote services.
 * <br/>
 * <h3>Overview</h3>
 * {@link rs.lukaj.restclient.client.RestClient} holds everything request builders share: the
 * {@link rs.lukaj.restclient.client.ResourceCache}, connection pools, retry limiter and telemetry ports.
 * <br/>
 * {@link rs.lukaj.restclient.client.RequestBuilder} talks to one service. It runs each request through the
 * circuit breaker, the cache and the retry loop, and turns whatever happens into a
 * {@link rs.lukaj.restclient.client.Response}.
 * <br/>
 * {@link rs.lukaj.restclient.client.Concurrent} queues requests which
 * {@link rs.lukaj.restclient.client.RequestBuilder#forkJoin} then executes in parallel, handing out
 * {@link rs.lukaj.restclient.client.FutureResponse}s.
 * <br/>
 * Retry strategies, circuit breakers and metrics live in their own subpackages.
 */
package rs.lukaj.restclient.client;
