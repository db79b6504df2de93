package com.p14n.eventbroker.telemetry;

import io.opentelemetry.context.propagation.TextMapGetter;

import java.util.Map;

/**
 * Implementation of OpenTelemetry's TextMapGetter interface for extracting
 * context from a Map.
 * Used to rebuild the publisher's trace context from the traceparent an event
 * carries.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * Map<String, String> carrier = new HashMap<>();
 * carrier.put("traceparent", "00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-01");
 *
 * MapTextMapGetter getter = new MapTextMapGetter();
 * String traceParent = getter.get(carrier, "traceparent");
 * }</pre>
 */
public class MapTextMapGetter implements TextMapGetter<Map<String, String>> {

    /** Creates a getter; it holds no state. */
    public MapTextMapGetter() {
    }

    /**
     * Retrieves a value from the carrier Map using the specified key.
     *
     * @param carrier The Map containing the context information, may be null
     * @param key     The key whose value should be retrieved
     * @return The value associated with the key, or null if not present
     */
    @Override
    public String get(Map<String, String> carrier, String key) {
        return carrier == null ? null : carrier.get(key);
    }

    /**
     * Returns all keys present in the carrier Map.
     *
     * @param carrier The Map containing the context information
     * @return The carrier's keys
     */
    @Override
    public Iterable<String> keys(Map<String, String> carrier) {
        return carrier.keySet();
    }
}
