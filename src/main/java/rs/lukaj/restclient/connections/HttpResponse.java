package rs.lukaj.restclient.connections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;

/**
 * Represents a HTTP response. Parsing status line, headers and body framing is done here. Body is exposed as a
 * stream which ends where the response ends; once it's fully read the connection goes back to the pool for reuse.
 * Closing the response before the body is consumed closes the connection instead.
 */
public class HttpResponse implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(HttpResponse.class);

    /**
     * Maximum number of bytes read from an unwanted body in order to reuse the connection.
     */
    public static final int DRAIN_LIMIT = 4096;
    private static final int MAX_INFORMATIVE_RESPONSES = 5;

    /**
     * Gives the socket back once the response is done with it.
     */
    public interface SocketReleaser {
        void release(HttpSocket socket, boolean reusable);
    }

    private final HttpRequest request;
    private final Status status;
    private final ResponseHeaders headers;
    private final InputStream body;
    private final boolean keepAlive;
    private HttpSocket socket;
    private SocketReleaser releaser;

    private HttpResponse(HttpRequest request, Status status, ResponseHeaders headers, HttpSocket socket,
                         SocketReleaser releaser) throws IOException {
        this.request = request;
        this.status = status;
        this.headers = headers;
        this.socket = socket;
        this.releaser = releaser;

        InputStream in = socket.getInput();
        if(!hasBody(request.getVerb(), status.code)) {
            body = new BoundedInputStream(in, 0);
            keepAlive = !headers.isConnectionClose();
        } else if(headers.isChunked()) {
            body = new ChunkedInputStream(in);
            keepAlive = !headers.isConnectionClose();
        } else if(headers.getContentLength() != null) {
            long len;
            try {
                len = Long.parseLong(headers.getContentLength().trim());
            } catch (NumberFormatException e) {
                throw new InvalidResponseException("Invalid Content-Length: " + headers.getContentLength(), e);
            }
            if(len < 0) throw new InvalidResponseException("Negative Content-Length: " + len);
            body = new BoundedInputStream(in, len);
            keepAlive = !headers.isConnectionClose();
        } else {
            //no framing: body lasts until server closes the connection
            body = in;
            keepAlive = false;
        }
        if(isBodyFinished()) finish(keepAlive);
    }

    /**
     * Read the response to the given request from the socket. Informational (1xx) responses are skipped.
     * @param socket socket over which request has been sent
     * @param request request whose response is being read
     * @param releaser used to give the socket back when response is done with it
     * @return response whose status and headers are parsed, and whose body is ready for reading
     * @throws IOException if reading fails or response doesn't follow the protocol
     */
    public static HttpResponse read(HttpSocket socket, HttpRequest request, SocketReleaser releaser) throws IOException {
        Status status;
        ResponseHeaders headers;
        int informative = 0;
        do {
            if(informative > MAX_INFORMATIVE_RESPONSES) throw new InvalidResponseException("Too many informative responses!");
            status = new Status(socket.readLine());
            headers = new ResponseHeaders();
            String line;
            while(!(line = socket.readLine()).isEmpty()) {
                try {
                    headers.appendHeader(line);
                } catch (InvalidHeaderException e) {
                    throw new InvalidResponseException(e.getMessage(), e);
                }
            }
            informative++;
        } while (status.code / 100 == 1 && status.code != 101);
        return new HttpResponse(request, status, headers, socket, releaser);
    }

    private static boolean hasBody(Http.Verb verb, int code) {
        if(!verb.responseHasBody()) return false;
        return code / 100 != 1 && code != 204 && code != 304;
    }

    /**
     * Get data from Status-Line received in this response.
     * @return status line data
     */
    public Status getStatus() {
        return status;
    }

    /**
     * Get response headers received.
     * @return received headers
     */
    public ResponseHeaders getHeaders() {
        return headers;
    }

    /**
     * @return request this is the response to (after redirects, if any were followed)
     */
    public HttpRequest getRequest() {
        return request;
    }

    /**
     * @return body of the response, as it's received (i.e. without un-gzipping it)
     */
    public InputStream getBody() {
        return new FinishingInputStream(body);
    }

    /**
     * Reads whole body and releases the connection.
     * @return body bytes, possibly empty
     */
    public byte[] readBody() throws IOException {
        try (InputStream in = getBody()) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            int read;
            while((read = in.read(buffer)) != -1) out.write(buffer, 0, read);
            return out.toByteArray();
        }
    }

    /**
     * Reads and discards at most {@link #DRAIN_LIMIT} bytes of the body, so the connection can be reused. If the
     * body is longer than that, connection is closed instead.
     */
    public void drain() {
        if(socket == null) return;
        try {
            byte[] buffer = new byte[512];
            int total = 0;
            while(total <= DRAIN_LIMIT) {
                int read = body.read(buffer, 0, Math.min(buffer.length, DRAIN_LIMIT + 1 - total));
                if(read == -1) {
                    finish(keepAlive);
                    return;
                }
                total += read;
            }
            LOG.debug("Body of {} longer than {} bytes, closing connection instead of draining it", request, DRAIN_LIMIT);
        } catch (IOException e) {
            LOG.debug("Error while draining body of {}", request, e);
        }
        finish(false);
    }

    private boolean isBodyFinished() {
        if(body instanceof BoundedInputStream) return ((BoundedInputStream) body).remaining == 0;
        if(body instanceof ChunkedInputStream) return ((ChunkedInputStream) body).isFinished();
        return false;
    }

    private synchronized void finish(boolean reusable) {
        if(socket == null) return;
        HttpSocket s = socket;
        socket = null;
        if(reusable) s.exchangeFinished();
        releaser.release(s, reusable);
        releaser = null;
    }

    /**
     * Closes the response. If body has been fully read, the connection is returned to the pool; otherwise
     * it's closed.
     */
    @Override
    public void close() {
        finish(keepAlive && isBodyFinished());
    }

    @Override
    public String toString() {
        return status.toString();
    }

    /**
     * Represents data contained in a Status-Line of the response. Contains HTTP version, response code and a
     * response phrase.
     */
    public static class Status {
        public final String httpVersion;
        public final int code;
        public final String phrase;

        public Status(String httpVersion, int code, String phrase) {
            this.httpVersion = httpVersion;
            this.code = code;
            this.phrase = phrase;
        }

        public Status(String statusLine) throws InvalidResponseException {
            String[] tokens = statusLine.split(" ", 3);
            if(tokens.length < 2 || !tokens[0].startsWith("HTTP/"))
                throw new InvalidResponseException("Invalid status line: " + statusLine);
            httpVersion = tokens[0];
            try {
                code = Integer.parseInt(tokens[1]);
            } catch (NumberFormatException e) {
                throw new InvalidResponseException("Invalid status code in: " + statusLine, e);
            }
            if(code < 100 || code > 999) throw new InvalidResponseException("Invalid status code " + code);
            phrase = tokens.length == 3 ? tokens[2] : "";
        }

        public boolean isRedirect() {
            return code == 301 || code == 302 || code == 303 || code == 307 || code == 308;
        }

        public boolean isServerError() {
            return code / 100 == 5;
        }

        @Override
        public String toString() {
            return httpVersion + " " + code + " " + phrase;
        }
    }

    //stream of Content-Length bytes
    private static class BoundedInputStream extends InputStream {
        private final InputStream in;
        private long remaining;

        private BoundedInputStream(InputStream in, long length) {
            this.in = in;
            this.remaining = length;
        }

        @Override
        public int read() throws IOException {
            if(remaining == 0) return -1;
            int next = in.read();
            if(next == -1) throw new EOFException("Connection closed with " + remaining + " bytes of body left");
            remaining--;
            return next;
        }

        @Override
        public int read(byte[] buf, int off, int len) throws IOException {
            if(len == 0) return 0;
            if(remaining == 0) return -1;
            int read = in.read(buf, off, (int) Math.min(len, remaining));
            if(read == -1) throw new EOFException("Connection closed with " + remaining + " bytes of body left");
            remaining -= read;
            return read;
        }

        @Override
        public int available() throws IOException {
            return (int) Math.min(in.available(), remaining);
        }
    }

    //gives the socket back as soon as the body is exhausted, or closes it if caller gives up early
    private class FinishingInputStream extends FilterInputStream {
        private FinishingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            int next;
            try {
                next = super.read();
            } catch (IOException e) {
                finish(false);
                throw e;
            }
            if(next == -1) finish(keepAlive);
            return next;
        }

        @Override
        public int read(byte[] buf, int off, int len) throws IOException {
            int read;
            try {
                read = super.read(buf, off, len);
            } catch (IOException e) {
                finish(false);
                throw e;
            }
            if(read == -1) finish(keepAlive);
            return read;
        }

        @Override
        public void close() {
            HttpResponse.this.close();
        }
    }
}
