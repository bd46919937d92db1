package rs.lukaj.restclient.connections;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.Objects;

/**
 * Endpoint to which connections are connected. Consists of host, port and scheme. Hostname is resolved
 * when the socket is opened, not when the endpoint is made.
 */
public class Endpoint {
    private final String host;
    private final int port;
    private final boolean https;

    /**
     * Create a new endpoint
     * @param host hostname of the server
     * @param port port on which to connect (e.g. 80 for HTTP, 443 for HTTPS)
     * @param isHttps should the connection be over TLS
     */
    public Endpoint(String host, int port, boolean isHttps) {
        if(host == null || host.isEmpty()) throw new InvalidRequestException("Host can't be empty!");
        if(port < 1 || port > 65535) throw new InvalidRequestException("Invalid port " + port);
        this.port = port;
        this.host = host;
        this.https = isHttps;
    }

    /**
     * Create Endpoint from URL passed. If not present, port will be inferred from protocol.
     * @param url URL to which this endpoint should point
     * @return new Endpoint for given address
     * @throws MalformedURLException if protocol is neither http nor https
     */
    public static Endpoint fromUrl(URL url) throws MalformedURLException {
        String protocol = url.getProtocol();
        if(!protocol.equals("http") && !protocol.equals("https"))
            throw new MalformedURLException("Unknown protocol: " + protocol);
        int port = url.getPort();
        if(port == -1) port = url.getDefaultPort();
        return new Endpoint(url.getHost(), port, protocol.equals("https"));
    }

    public int getPort() {
        return port;
    }
    public String getHost() {
        return host;
    }
    public boolean isHttps() {
        return https;
    }

    /**
     * Value used for the Host header: port is omitted when it's the default one for the scheme.
     */
    public String hostHeader() {
        if((https && port == 443) || (!https && port == 80)) return host;
        return host + ":" + port;
    }

    @Override
    public boolean equals(Object obj) {
        if(!(obj instanceof Endpoint)) return false;
        Endpoint other = (Endpoint)obj;
        return port == other.port && https == other.https && host.equalsIgnoreCase(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host.toLowerCase(), port, https);
    }

    @Override
    public String toString() {
        return (https ? "https://" : "http://") + host + ":" + port;
    }
}
