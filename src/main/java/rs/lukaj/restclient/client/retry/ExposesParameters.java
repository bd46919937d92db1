package rs.lukaj.restclient.client.retry;

import java.util.Map;

/**
 * Implemented by retry strategies which can describe themselves, so the client can report the configuration
 * each pool runs with.
 */
public interface ExposesParameters {
    String strategyName();

    /**
     * @return parameter names mapped to their values, in a stable order
     */
    Map<String, Object> parameters();
}
