package rs.lukaj.restclient;

import java.io.*;
import java.time.Duration;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

//you know, other stuff
public class Utils {
    private Utils() {
    }

    /**
     * Decides whether a response body is gzip-compressed, judging by its Content-Encoding or, when there is
     * none, by its Content-Type (some servers send gzip files as application/x-gzip without any encoding).
     * @param contentEncoding value of Content-Encoding header, possibly null
     * @param contentType value of Content-Type header, possibly null
     * @return whether body should be un-gzipped
     */
    public static boolean isGzip(String contentEncoding, String contentType) {
        String encoding = contentEncoding != null && !contentEncoding.isEmpty() ? contentEncoding : contentType;
        if(encoding == null) return false;
        encoding = encoding.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return encoding.equals("gzip") || encoding.equals("application/x-gzip");
    }

    /**
     * Decompresses gzip-encoded byte array.
     * @param data data to decompress
     * @return decompressed bytes
     * @throws IOException if data isn't valid gzip (usually {@link java.util.zip.ZipException})
     */
    public static byte[] gunzip(byte[] data) throws IOException {
        ByteArrayInputStream bytein = new ByteArrayInputStream(data);
        ByteArrayOutputStream byteout = new ByteArrayOutputStream(data.length * 4);
        try(bytein; InputStream compressed = new GZIPInputStream(bytein)) {
            compressed.transferTo(byteout);
        }
        return byteout.toByteArray();
    }

    /**
     * Formats duration as whole milliseconds, e.g. for X-Socket-Timeout.
     */
    public static String millis(Duration duration) {
        return String.valueOf(duration.toMillis());
    }
}
