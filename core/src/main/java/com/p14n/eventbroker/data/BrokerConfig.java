package com.p14n.eventbroker.data;

/**
 * Configuration interface for an event broker.
 */
public interface BrokerConfig {
    /**
     * Gets the broker name, used as the OpenTelemetry instrumentation scope and
     * in log messages.
     *
     * @return the broker name
     */
    String name();

    /**
     * Gets the format used to name delivery threads. It takes a single numeric
     * argument.
     * Default is {@code event-broker-<name>-%d}.
     *
     * @return the thread name format
     */
    default String threadNameFormat() {
        return "event-broker-" + name() + "-%d";
    }
}
