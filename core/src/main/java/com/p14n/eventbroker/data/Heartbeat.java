package com.p14n.eventbroker.data;

import java.time.Instant;

/**
 * A periodic liveness signal.
 *
 * @param timestamp   when the heartbeat was emitted
 * @param source      name of the component emitting it
 * @param sequence    monotonically increasing sequence number per source
 * @param traceparent OpenTelemetry trace parent identifier, may be null
 */
public record Heartbeat(Instant timestamp, String source, long sequence, String traceparent) implements Event {

    /**
     * Creates an untraced heartbeat stamped with the current time.
     *
     * @param source   name of the component emitting it
     * @param sequence sequence number
     * @return a new heartbeat
     * @throws IllegalArgumentException if source is null or empty
     */
    public static Heartbeat create(String source, long sequence) {
        return create(source, sequence, null);
    }

    /**
     * Creates a heartbeat stamped with the current time.
     *
     * @param source      name of the component emitting it
     * @param sequence    sequence number
     * @param traceparent trace parent of the publishing context, may be null
     * @return a new heartbeat
     * @throws IllegalArgumentException if source is null or empty
     */
    public static Heartbeat create(String source, long sequence, String traceparent) {
        if (source == null || source.trim().isEmpty()) {
            throw new IllegalArgumentException("source cannot be null or empty");
        }
        return new Heartbeat(Instant.now(), source, sequence, traceparent);
    }
}
