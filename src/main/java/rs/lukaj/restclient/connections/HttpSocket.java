package rs.lukaj.restclient.connections;

import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.*;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.time.Duration;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Represents a socket used for communicating with the network. Supports HTTP and HTTPS {@link Endpoint}s,
 * directly or through an HTTP proxy. Socket and connection are used interchangeably.
 */
public class HttpSocket implements Closeable {
    private static final int BUFFER_SIZE = 8192;

    private final Endpoint endpoint;
    private final boolean viaHttpProxy;
    private final Socket socket;
    private final InputStream input;
    private final OutputStream output;

    private final long openedAt;
    private volatile long lastUsedAt;
    private volatile boolean inUse;
    private volatile int exchanges = 0;
    private final Object acquireLock = new Object();

    private HttpSocket(Endpoint endpoint, Socket socket, boolean viaHttpProxy) throws IOException {
        this.endpoint = endpoint;
        this.socket = socket;
        this.viaHttpProxy = viaHttpProxy;
        this.input = new BufferedInputStream(socket.getInputStream(), BUFFER_SIZE);
        this.output = new BufferedOutputStream(socket.getOutputStream(), BUFFER_SIZE);
        this.openedAt = System.currentTimeMillis();
        this.lastUsedAt = openedAt;
        this.inUse = true;
    }

    /**
     * Open a new socket to a given endpoint. Returned socket is already acquired.
     * @param endpoint endpoint for the socket
     * @param proxy http proxy to connect through, or null for a direct connection
     * @param connectTimeout timeout for establishing TCP connection (and TLS handshake); zero means no timeout
     * @param listener notified about connect and handshake durations
     * @throws IOException if connection can't be established
     */
    public static HttpSocket open(Endpoint endpoint, URI proxy, Duration connectTimeout, ConnectionListener listener)
            throws IOException {
        int timeout = (int) connectTimeout.toMillis();
        String connectHost = proxy == null ? endpoint.getHost() : proxy.getHost();
        int connectPort = proxy == null ? endpoint.getPort() : (proxy.getPort() == -1 ? 80 : proxy.getPort());

        Socket raw = new Socket();
        try {
            long start = System.nanoTime();
            raw.connect(new InetSocketAddress(connectHost, connectPort), timeout);
            listener.connectDone(endpoint, Duration.ofNanos(System.nanoTime() - start));
            raw.setTcpNoDelay(true);
            if(!endpoint.isHttps()) return new HttpSocket(endpoint, raw, proxy != null);

            if(proxy != null) tunnel(raw, endpoint, timeout);
            start = System.nanoTime();
            SSLSocket ssl = (SSLSocket) ((SSLSocketFactory) SSLSocketFactory.getDefault())
                    .createSocket(raw, endpoint.getHost(), endpoint.getPort(), true);
            ssl.setSoTimeout(timeout);
            ssl.startHandshake();
            listener.tlsHandshakeDone(endpoint, Duration.ofNanos(System.nanoTime() - start));
            return new HttpSocket(endpoint, ssl, false);
        } catch (IOException | RuntimeException e) {
            try {
                raw.close();
            } catch (IOException closing) {
                e.addSuppressed(closing);
            }
            throw e;
        }
    }

    //asks the proxy to open a raw tunnel to the endpoint; TLS goes on top of it
    private static void tunnel(Socket raw, Endpoint endpoint, int timeout) throws IOException {
        raw.setSoTimeout(timeout);
        String authority = endpoint.getHost() + ":" + endpoint.getPort();
        OutputStream out = raw.getOutputStream();
        out.write(("CONNECT " + authority + " " + Http.VERSION + "\r\nHost: " + authority + "\r\n\r\n").getBytes(ISO_8859_1));
        out.flush();
        InputStream in = raw.getInputStream();
        String status = readLine(in);
        String[] tokens = status.split(" ", 3);
        if(tokens.length < 2 || !tokens[1].startsWith("2"))
            throw new IOException("Proxy refused tunnel to " + authority + ": " + status);
        //skip proxy's headers; there is no body on a successful CONNECT
        while(!readLine(in).isEmpty());
    }

    /**
     * Get how long is this connection idling. Idle time is calculated as a duration between the time it was released
     * last time and this moment. If connection is in use, idling time is 0.
     * @return idling duration
     */
    public Duration getIdlingTime() {
        if(inUse) return Duration.ZERO;
        return Duration.ofMillis(System.currentTimeMillis() - lastUsedAt);
    }

    /**
     * Get how old is this socket. Age is calculated as duration between the time it was opened and this moment.
     * @return socket age
     */
    public Duration getAge() {
        return Duration.ofMillis(System.currentTimeMillis() - openedAt);
    }

    /**
     * Release the socket, allowing it to be used for other transactions. Releasing the socket does not close
     * the underlying connection with the server.
     */
    public void release() {
        synchronized (acquireLock) {
            inUse = false;
            lastUsedAt = System.currentTimeMillis();
        }
    }

    /**
     * Acquires this connection if idle and not closed and returns true. Otherwise, returns false.
     * Connection must be acquired before writing to or reading from it.
     * @return whether the connection is acquired
     */
    //similar to read-modify-write; methods like "isAcquired" are inherently unsafe
    public boolean acquireIfIdle() {
        synchronized (acquireLock) {
            if(inUse || isClosed()) return false;
            inUse = true;
            return true;
        }
    }

    private void ensureAcquired() {
        if(!inUse) throw new IllegalStateException("Cannot use idling connection!");
    }

    /**
     * Sets how long a single read can block. Zero means forever.
     */
    public void setReadTimeout(Duration timeout) throws IOException {
        socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
    }

    /**
     * @return stream of bytes coming from the server
     */
    public InputStream getInput() {
        ensureAcquired();
        return input;
    }

    /**
     * Write raw bytes to the socket. This call is buffered; use {@link #flush()} to send them.
     * @param bytes data to be sent
     */
    public void write(byte[] bytes) throws IOException {
        ensureAcquired();
        output.write(bytes);
        lastUsedAt = System.currentTimeMillis();
    }

    /**
     * Flush the connection, sending the bytes to the server.
     */
    public void flush() throws IOException {
        ensureAcquired();
        output.flush();
        lastUsedAt = System.currentTimeMillis();
    }

    /**
     * Read a line from the server. Lines are terminated with <em>either</em> CRLF or just LF. This method should not
     * be used for reading body of the response.
     * @return next line, without the terminator
     * @throws EOFException if the server closed the connection before sending a full line
     */
    //skirting the protocol here, because it specifies only CRLF as newline
    public String readLine() throws IOException {
        ensureAcquired();
        String line = readLine(input);
        lastUsedAt = System.currentTimeMillis();
        return line;
    }

    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(64);
        int c;
        while((c = in.read()) != '\n') {
            if(c == -1) {
                if(out.size() == 0) throw new EOFException("Connection closed by server");
                throw new EOFException("Connection closed in the middle of a line");
            }
            out.write(c);
        }
        byte[] bytes = out.toByteArray();
        int len = bytes.length;
        if(len > 0 && bytes[len-1] == '\r') len--;
        return new String(bytes, 0, len, ISO_8859_1);
    }

    /**
     * Marks end of a request-response exchange on this socket. Sockets which have had at least one
     * exchange are considered reused when handed out again.
     */
    public void exchangeFinished() {
        exchanges++;
    }

    /**
     * @return whether this socket has already carried a full exchange
     */
    public boolean isReused() {
        return exchanges > 0;
    }

    /**
     * Plain HTTP requests going through a proxy must use absolute URI in the request line.
     */
    public boolean isViaHttpProxy() {
        return viaHttpProxy;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    /**
     * Returns whether the underlying (and, by extension, this) socket is closed. You cannot write to nor read from
     * closed sockets.
     * @return true if socket is closed, false otherwise
     */
    public boolean isClosed() {
        return socket.isClosed();
    }

    /**
     * Close the connection to the server. After closing, socket cannot be re-acquired and no more data can be read
     * from or written to this socket.
     * @throws IOException
     */
    @Override
    public void close() throws IOException {
        synchronized (acquireLock) {
            inUse = false;
        }
        socket.close();
    }
}
