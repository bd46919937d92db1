/**
 * This package implements low-level communication with server: HTTP/1.1 over plain sockets, pooled per endpoint.
 * More high-level (i.e. usable) stuff is located inside the client package.
 *
 * <br/>
 * <h3>Overview</h3>
 * {@link rs.lukaj.restclient.connections.HttpSocket} is a connection to an endpoint, possibly through an HTTP proxy.
 * Doesn't actually implement any HTTP.
 * <br/>
 * {@link rs.lukaj.restclient.connections.ConnectionPool} (implemented as
 * {@link rs.lukaj.restclient.connections.ConfigurableConnectionPool}) pools HttpSockets, keeping a bounded number of
 * idle ones per endpoint.
 * <br/>
 * {@link rs.lukaj.restclient.connections.HttpRequest} / {@link rs.lukaj.restclient.connections.HttpResponse}
 * use the HttpSocket to communicate with server using HTTP. They know the structure of each request and response,
 * including body framing (Content-Length, chunked, or until the connection closes).
 * <br/>
 * {@link rs.lukaj.restclient.connections.HttpTransaction} makes the request, follows redirects when asked to and
 * transparently repeats idempotent requests whose idle connection has gone stale.
 * <br/>
 * {@link rs.lukaj.restclient.connections.Transport} is what the client sees of a named pool, and
 * {@link rs.lukaj.restclient.connections.PoolRegistry} makes sure there's exactly one per name.
 */
package rs.lukaj.restclient.connections;
