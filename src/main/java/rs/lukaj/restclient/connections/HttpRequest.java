package rs.lukaj.restclient.connections;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Represents a HTTP request. Knows what to do with addresses, request methods, headers and body, and how to
 * put them on the wire.
 */
public class HttpRequest {
    private static final byte[] EMPTY = new byte[0];

    private final Http.Verb verb;
    private final URL target;
    private final Endpoint endpoint;
    private RequestHeaders headers = new RequestHeaders();
    private byte[] body = EMPTY;

    private HttpRequest(Http.Verb verb, URL target) throws MalformedURLException {
        this.verb = verb;
        this.target = target;
        this.endpoint = Endpoint.fromUrl(target);
    }

    /**
     * Create a new HTTP request using a given request method.
     * @param method request method ("http verb")
     * @param target address to where should the request go (URL)
     * @return new HTTP request
     * @throws MalformedURLException if target is invalid or isn't http(s)
     */
    public static HttpRequest create(Http.Verb method, String target) throws MalformedURLException {
        if(method == null) throw new InvalidRequestException("Method can't be null!");
        if(target == null) throw new MalformedURLException("URL can't be null!");
        URL url;
        try {
            url = new URI(target).toURL();
        } catch (URISyntaxException | IllegalArgumentException e) {
            MalformedURLException ex = new MalformedURLException("Invalid URL " + target + ": " + e.getMessage());
            ex.initCause(e);
            throw ex;
        }
        if(url.getHost() == null || url.getHost().isEmpty()) throw new MalformedURLException("No host in " + target);
        return new HttpRequest(method, url);
    }

    /**
     * Same request, with the same headers and body, to another method and target. Used for redirects.
     */
    public HttpRequest redirect(Http.Verb method, String target, boolean keepBody) throws MalformedURLException {
        HttpRequest redirected = create(method, target);
        redirected.headers = headers.copy();
        if(keepBody) {
            redirected.body = body;
        } else {
            redirected.headers.removeHeader("Content-Type");
            redirected.headers.removeHeader("Content-Length");
        }
        return redirected;
    }

    /**
     * Set request headers. Host and Content-Length are managed by the request itself.
     * @param headers headers to be used with this request
     * @return this, to allow chaining
     */
    public HttpRequest setHeaders(RequestHeaders headers) {
        this.headers = headers == null ? new RequestHeaders() : headers;
        return this;
    }

    /**
     * Set request body. Null means no body.
     * @return this, to allow chaining
     */
    public HttpRequest setBody(byte[] body) {
        this.body = body == null ? EMPTY : body;
        return this;
    }

    public Http.Verb getVerb() {
        return verb;
    }
    public URL getTarget() {
        return target;
    }
    public Endpoint getEndpoint() {
        return endpoint;
    }
    /**
     * @return headers used for this request; changing them changes the request
     */
    public RequestHeaders getHeaders() {
        return headers;
    }
    public byte[] getBody() {
        return body;
    }

    private String requestTarget(boolean absolute) {
        if(absolute) return target.toString().split("#", 2)[0];
        String file = target.getFile();
        return file.isEmpty() ? "/" : file;
    }

    /**
     * @return request line, e.g. {@code GET /path?q=1 HTTP/1.1}
     */
    public String requestLine(boolean absolute) {
        return verb + " " + requestTarget(absolute) + " " + Http.VERSION;
    }

    /**
     * Writes request line, headers and body to the socket and flushes it.
     * @param socket acquired socket to the endpoint of this request
     */
    public void writeTo(HttpSocket socket) throws IOException {
        headers.setHost(endpoint.hostHeader());
        if(body.length > 0 || verb.isContentVerb()) headers.setContentLength(body.length);
        else headers.removeHeader("Content-Length");

        StringBuilder head = new StringBuilder(256);
        head.append(requestLine(socket.isViaHttpProxy())).append("\r\n");
        head.append(headers.toWireString());
        head.append("\r\n");
        socket.write(head.toString().getBytes(ISO_8859_1));
        if(body.length > 0) socket.write(body);
        socket.flush();
    }

    @Override
    public String toString() {
        return verb + " " + target;
    }
}
