package rs.lukaj.restclient.connections;

import java.util.*;

/**
 * Represents headers which are received from server or sent as a part of the request.
 * Header names are case-insensitive; the wire uses the spelling from the last time the header was set.
 * Insertion order is preserved.
 */
public class Headers {
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private static final class Entry {
        private final String name;
        private String value;

        private Entry(String name, String value) {
            this.name = name;
            this.value = value;
        }
    }

    private static String key(String header) {
        return header.toLowerCase(Locale.ROOT);
    }

    private static void checkHeader(String header, String value) {
        if(header == null || header.trim().isEmpty()) throw new InvalidHeaderException("Header name can't be empty!");
        if(value == null) throw new InvalidHeaderException("Value of " + header + " can't be null!");
        if(header.indexOf('\n') >= 0 || header.indexOf('\r') >= 0 || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0)
            throw new InvalidHeaderException("Header " + header + " contains a line break");
    }

    /**
     * Get value of the header identified by the name passed
     * @param header name of the header
     * @return value of the header, or null if it doesn't exist
     */
    public String getHeader(String header) {
        Entry e = entries.get(key(header));
        return e == null ? null : e.value;
    }

    /**
     * Put a new header, replacing the existing one if it exists.
     * @param header name of the header
     * @param value value of the header
     * @return previous value of the header, or null if it didn't exist
     */
    public String setHeader(String header, String value) {
        checkHeader(header, value);
        Entry previous = entries.put(key(header), new Entry(header, value));
        return previous == null ? null : previous.value;
    }

    /**
     * Append header value if the header with the same name already exists, or put a new header
     * if it doesn't. Header values are separated by a comma.
     * @param header name of the header
     * @param value value of the header
     */
    public void appendHeader(String header, String value) {
        Entry existing = entries.get(key(header));
        if(existing == null) {
            setHeader(header, value);
        } else {
            checkHeader(header, value);
            existing.value = existing.value + ", " + value;
        }
    }

    /**
     * Append header line as received from the wire, where header name and value are separated by a colon.
     * @param line header line
     */
    public void appendHeader(String line) {
        String[] tokens = line.split(":", 2);
        if(tokens.length != 2) throw new InvalidHeaderException("Malformed header line: " + line);
        appendHeader(tokens[0].trim(), tokens[1].trim());
    }

    /**
     * Remove a header if it exists.
     * @param header header name
     * @return previous value of the header, or null if it didn't exist
     */
    public String removeHeader(String header) {
        Entry e = entries.remove(key(header));
        return e == null ? null : e.value;
    }

    /**
     * Check whether header exists.
     * @param header header name
     * @return true if it exists, false otherwise
     */
    public boolean hasHeader(String header) {
        return entries.containsKey(key(header));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Copies all headers from other into this, replacing the ones with the same name.
     */
    public void setAll(Headers other) {
        for(Entry e : other.entries.values()) setHeader(e.name, e.value);
    }

    /**
     * @return read-only view of headers, using their original names
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for(Entry e : entries.values()) map.put(e.name, e.value);
        return Collections.unmodifiableMap(map);
    }

    /**
     * Returns headers in format appropriate for sending, with trailing CRLF after each one.
     * @return String representation of headers
     */
    public String toWireString() {
        StringBuilder builder = new StringBuilder(entries.size() * 32);
        for(Entry e : entries.values()) {
            builder.append(e.name).append(": ").append(e.value).append("\r\n");
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof Headers)) return false;
        Headers other = (Headers) o;
        if(entries.size() != other.entries.size()) return false;
        for(Map.Entry<String, Entry> e : entries.entrySet()) {
            Entry oth = other.entries.get(e.getKey());
            if(oth == null || !oth.value.equals(e.getValue().value)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for(Map.Entry<String, Entry> e : entries.entrySet()) hash += e.getKey().hashCode() ^ e.getValue().value.hashCode();
        return hash;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
