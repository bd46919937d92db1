package rs.lukaj.restclient.connections;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static org.junit.jupiter.api.Assertions.*;

public class ChunkedInputStreamTest {

    private static InputStream wire(String data) {
        return new ByteArrayInputStream(data.getBytes(ISO_8859_1));
    }

    /**
     * Chunk sizes and CRLFs are stripped, and the stream ends at the terminating chunk.
     */
    @Test
    public void readsChunks() throws IOException {
        ChunkedInputStream in = new ChunkedInputStream(wire("4\r\nWiki\r\n5\r\npedia\r\n0\r\n\r\n"));
        assertEquals("Wikipedia", new String(in.readAllBytes(), ISO_8859_1));
        assertTrue(in.isFinished());
        assertEquals(-1, in.read());
    }

    /**
     * Extensions are ignored, trailers are consumed, and whatever follows the body is left untouched.
     */
    @Test
    public void skipsExtensionsAndTrailers() throws IOException {
        InputStream raw = wire("a;name=value\r\n0123456789\r\n0\r\nExpires: never\r\n\r\nHTTP/1.1 200 OK");
        ChunkedInputStream in = new ChunkedInputStream(raw);
        assertEquals("0123456789", new String(in.readAllBytes(), ISO_8859_1));
        assertEquals("HTTP/1.1 200 OK", new String(raw.readAllBytes(), ISO_8859_1));
    }

    /**
     * Single-byte reads give the same result as bulk reads.
     */
    @Test
    public void readsByteByByte() throws IOException {
        ChunkedInputStream in = new ChunkedInputStream(wire("2\r\nab\r\n1\r\nc\r\n0\r\n\r\n"));
        StringBuilder sb = new StringBuilder();
        int c;
        while((c = in.read()) != -1) sb.append((char) c);
        assertEquals("abc", sb.toString());
    }

    @Test
    public void rejectsMalformedInput() {
        assertThrows(InvalidResponseException.class,
                () -> new ChunkedInputStream(wire("zz\r\nab\r\n0\r\n\r\n")).readAllBytes());
        assertThrows(InvalidResponseException.class,
                () -> new ChunkedInputStream(wire("2\r\nabX\r\n0\r\n\r\n")).readAllBytes());
        assertThrows(InvalidResponseException.class,
                () -> new ChunkedInputStream(wire("5\r\nab")).readAllBytes());
    }

    /**
     * Closing the chunked stream leaves the connection open.
     */
    @Test
    public void closeDoesntCloseUnderlying() throws IOException {
        InputStream raw = wire("1\r\na\r\n0\r\n\r\nrest");
        ChunkedInputStream in = new ChunkedInputStream(raw);
        in.close();
        assertThrows(IOException.class, in::read);
        assertEquals('1', raw.read());
    }
}
