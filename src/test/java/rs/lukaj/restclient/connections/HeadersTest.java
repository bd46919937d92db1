package rs.lukaj.restclient.connections;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class HeadersTest {

    /**
     * Names are case-insensitive, but original spelling is kept on the wire.
     */
    @Test
    public void caseInsensitiveNames() {
        RequestHeaders headers = new RequestHeaders();
        headers.setHeader("X-Trace-Id", "abc");
        assertEquals("abc", headers.getHeader("x-trace-id"));
        headers.setHeader("x-trace-id", "def");
        assertEquals(1, headers.size());
        assertEquals("x-trace-id: def\r\n", headers.toWireString());
    }

    @Test
    public void appendJoinsValues() {
        ResponseHeaders headers = new ResponseHeaders();
        headers.appendHeader("Cache-Control: no-store");
        headers.appendHeader("Cache-Control", "max-age=0");
        assertEquals("no-store, max-age=0", headers.getCacheControl());
    }

    /**
     * Header values can't be used to smuggle in more headers.
     */
    @Test
    public void rejectsLineBreaks() {
        RequestHeaders headers = new RequestHeaders();
        assertThrows(InvalidHeaderException.class, () -> headers.setHeader("X-Evil", "a\r\nHost: elsewhere"));
    }

    @Test
    public void copyIsIndependent() {
        RequestHeaders headers = new RequestHeaders();
        headers.setUserAgent("one");
        RequestHeaders copy = headers.copy();
        copy.setUserAgent("two");
        assertEquals("one", headers.getHeader("User-Agent"));
        assertEquals("two", copy.getHeader("User-Agent"));
    }

    @Test
    public void basicAuthorization() {
        RequestHeaders headers = new RequestHeaders();
        headers.setBasicAuthorization("Aladdin", "open sesame");
        assertEquals("Basic QWxhZGRpbjpvcGVuIHNlc2FtZQ==", headers.getHeader("Authorization"));
    }

    /**
     * Dates use the RFC 1123 format in both directions; garbage parses to null.
     */
    @Test
    public void httpDates() {
        RequestHeaders request = new RequestHeaders();
        request.setIfModifiedSince(Instant.parse("1994-11-06T08:49:37Z"));
        assertEquals("Sun, 6 Nov 1994 08:49:37 GMT", request.getHeader("If-Modified-Since"));

        ResponseHeaders response = new ResponseHeaders();
        response.setHeader("Last-Modified", "Sun, 06 Nov 1994 08:49:37 GMT");
        response.setHeader("Expires", "0");
        assertEquals(Instant.parse("1994-11-06T08:49:37Z"), response.getLastModified());
        assertNull(response.getExpires());
    }
}
