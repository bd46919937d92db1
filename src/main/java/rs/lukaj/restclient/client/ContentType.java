package rs.lukaj.restclient.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import rs.lukaj.restclient.connections.InvalidRequestException;

import java.io.IOException;

/**
 * Format in which request bodies are sent and response bodies are expected. Determines Content-Type and Accept
 * headers, and how bodies are (un)marshalled.
 */
public enum ContentType {
    JSON("application/json"),
    XML("application/xml"),
    /**
     * Raw bytes: body must be a {@code byte[]}, and is sent as-is.
     */
    BYTES("application/octet-stream");

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final ObjectMapper XML_MAPPER = new XmlMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final byte[] EMPTY = new byte[0];

    private final String mime;

    ContentType(String mime) {
        this.mime = mime;
    }

    public String getMime() {
        return mime;
    }

    /**
     * @return value for the Accept header, or null if anything goes
     */
    public String accept() {
        return this == BYTES ? null : mime;
    }

    /**
     * Serializes request body. Null means empty body; byte arrays are always sent as they are.
     * @throws InvalidRequestException if body can't be serialized
     */
    public byte[] marshal(Object body) {
        if(body == null) return EMPTY;
        if(body instanceof byte[]) return (byte[]) body;
        if(this == BYTES)
            throw new InvalidRequestException("Body must be byte[] when sending raw bytes, but got " + body.getClass().getName());
        try {
            return mapper().writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("Can't serialize " + body.getClass().getName() + " as " + name(), e);
        }
    }

    /**
     * Deserializes response body into the given type.
     * @throws IOException if body doesn't match the type
     */
    public <T> T unmarshal(byte[] body, Class<T> type) throws IOException {
        if(this == BYTES) {
            if(type.isInstance(body)) return type.cast(body);
            throw new IOException("Raw body can only be read as byte[], not " + type.getName());
        }
        return mapper().readValue(body, type);
    }

    private ObjectMapper mapper() {
        return this == XML ? XML_MAPPER : JSON_MAPPER;
    }
}
