package rs.lukaj.restclient.connections;

import java.io.IOException;
import java.io.InputStream;

/**
 * InputStream designed to read from HTTP chunked data (Transfer-Encoding: chunked). Strips chunk sizes and
 * extensions, and consumes the trailer section after the last chunk, so the underlying connection is left
 * positioned at the start of the next response. Requires CRLF on all the right places, otherwise throws
 * {@link InvalidResponseException}. Closing this stream does <em>not</em> close the underlying one.
 */
public class ChunkedInputStream extends InputStream {

    private final InputStream in;
    private long remaining = 0;
    private boolean closed = false;
    private boolean end = false;
    private boolean beginning = true;

    /**
     * @param socketStream input stream with data from server
     */
    public ChunkedInputStream(InputStream socketStream) {
        in = socketStream;
    }

    private void ensureOpen() throws IOException {
        if(closed) throw new IOException("Trying to read from closed stream!");
    }

    @Override
    public int read() throws IOException {
        ensureOpen();
        if(end) return -1;
        if(remaining == 0) {
            enterChunk();
            if(end) return -1;
        }
        int next = in.read();
        if(next == -1) throw new InvalidResponseException("Connection closed in the middle of a chunk");
        remaining--;
        return next;
    }

    @Override
    public int read(byte[] buf, int off, int len) throws IOException {
        ensureOpen();
        if(len == 0) return 0;
        if(end) return -1;
        if(remaining == 0) {
            enterChunk();
            if(end) return -1;
        }
        int read = in.read(buf, off, (int) Math.min(len, remaining));
        if(read == -1) throw new InvalidResponseException("Connection closed in the middle of a chunk");
        remaining -= read;
        return read;
    }

    @Override
    public int available() throws IOException {
        if(closed || end) return 0;
        return (int) Math.min(in.available(), remaining);
    }

    private void enterChunk() throws IOException {
        if(!beginning) {
            int current = in.read(), next = in.read();
            if (!(current == '\r' && next == '\n')) throw new InvalidResponseException("Ill-formed chunk: no CRLF at the end");
        }
        beginning = false;
        String sizeLine = readLine();
        int ext = sizeLine.indexOf(';');
        if(ext >= 0) sizeLine = sizeLine.substring(0, ext);
        sizeLine = sizeLine.trim();
        long len;
        try {
            len = Long.parseLong(sizeLine, 16);
        } catch (NumberFormatException e) {
            throw new InvalidResponseException("Ill-formed chunk size: " + sizeLine, e);
        }
        if(len < 0) throw new InvalidResponseException("Negative chunk size");
        if(len == 0) {
            end = true;
            //trailers; we don't expose them, but they have to be consumed
            while(!readLine().isEmpty());
        }
        else remaining = len;
    }

    private String readLine() throws IOException {
        StringBuilder line = new StringBuilder(8);
        int c;
        while((c = in.read()) != '\n') {
            if(c == -1) throw new InvalidResponseException("Connection closed while reading chunk header");
            if(c != '\r') line.append((char) c);
        }
        return line.toString();
    }

    /**
     * @return whether the terminating chunk has been read
     */
    public boolean isFinished() {
        return end;
    }

    @Override
    public void close() {
        closed = true;
    }
}
