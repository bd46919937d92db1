package rs.lukaj.restclient.connections;

/**
 * Wrapper class for HTTP properties.
 */
public class Http {
    /**
     * Only version this client speaks.
     */
    public static final String VERSION = "HTTP/1.1";

    /**
     * Denotes a request method (i.e. "http verb")
     */
    public enum Verb {
        GET("GET", P.READ | P.RESP_BODY | P.IDEMPOTENT),
        POST("POST", P.CONTENT | P.RESP_BODY),
        PUT("PUT", P.CONTENT | P.RESP_BODY | P.IDEMPOTENT),
        PATCH("PATCH", P.CONTENT | P.RESP_BODY),
        DELETE("DELETE", P.RESP_BODY | P.IDEMPOTENT),
        HEAD("HEAD", P.READ | P.IDEMPOTENT),
        OPTIONS("OPTIONS", P.READ | P.RESP_BODY | P.IDEMPOTENT);

        private static class P { //hack around illegal forward reference
            private static final int READ = 1; //response may be served from / stored into the resource cache
            private static final int CONTENT = 1 << 1; //request carries a body and a Content-Type
            private static final int RESP_BODY = 1 << 2;
            private static final int IDEMPOTENT = 1 << 3;
        }

        private final String text;
        private final int properties;

        Verb(String text, int properties) {
            this.text = text;
            this.properties = properties;
        }

        /**
         * Read verbs are the only ones whose responses are cached.
         * @return whether this is GET, HEAD or OPTIONS
         */
        public boolean isReadVerb() {
            return (properties & P.READ) != 0;
        }

        /**
         * Content verbs send the serialized body together with a Content-Type header.
         * @return whether this is POST, PUT or PATCH
         */
        public boolean isContentVerb() {
            return (properties & P.CONTENT) != 0;
        }

        /**
         * @return whether response to this method can have a body
         */
        public boolean responseHasBody() {
            return (properties & P.RESP_BODY) != 0;
        }

        /**
         * If method is idempotent, request can be made multiple times with the same outcome.
         * @return whether method is idempotent
         */
        public boolean isIdempotent() {
            return (properties & P.IDEMPOTENT) != 0;
        }

        @Override
        public String toString() {
            return text;
        }
    }
}
