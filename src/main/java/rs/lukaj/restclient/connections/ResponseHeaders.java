package rs.lukaj.restclient.connections;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Headers which are received from server. Provides helper functions for getting them.
 */
public class ResponseHeaders extends Headers {
    public ResponseHeaders() {
    }

    public ResponseHeaders copy() {
        ResponseHeaders copy = new ResponseHeaders();
        copy.setAll(this);
        return copy;
    }

    public String getCacheControl() {
        return getHeader("Cache-Control");
    }
    public String getConnection() {
        return getHeader("Connection");
    }
    public String getContentEncoding() {
        return getHeader("Content-Encoding");
    }
    public String getTransferEncoding() {
        return getHeader("Transfer-Encoding");
    }
    public String getContentLength() {
        return getHeader("Content-Length");
    }
    public String getContentType() {
        return getHeader("Content-Type");
    }
    public String getETag() {
        return getHeader("ETag");
    }
    //used for redirection (among other things)
    public String getLocation() {
        return getHeader("Location");
    }
    public Instant getExpires() {
        return parseDate(getHeader("Expires"));
    }
    public Instant getLastModified() {
        return parseDate(getHeader("Last-Modified"));
    }

    public boolean isChunked() {
        String te = getTransferEncoding();
        return te != null && te.toLowerCase(Locale.ROOT).contains("chunked");
    }

    public boolean isConnectionClose() {
        String connection = getConnection();
        return connection != null && connection.equalsIgnoreCase("close");
    }

    /**
     * Parses RFC 1123 date, as used by Expires, Last-Modified and friends.
     * @return parsed instant, or null if header is missing or isn't a valid date
     */
    public static Instant parseDate(String value) {
        if(value == null || value.isEmpty()) return null;
        try {
            return Instant.from(DateTimeFormatter.RFC_1123_DATE_TIME.parse(value.trim()));
        } catch (DateTimeParseException e) {
            return null; //e.g. "Expires: 0", which means "already expired"
        }
    }
}
