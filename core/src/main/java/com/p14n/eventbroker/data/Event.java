package com.p14n.eventbroker.data;

import java.time.Instant;

/**
 * An immutable event published through an
 * {@link com.p14n.eventbroker.broker.EventBroker}.
 *
 * <p>
 * The concrete class of an event is its event type: subscriptions that restrict
 * themselves to a set of types are matched against {@code event.getClass()}
 * exactly, so a subclass is a different type from its parent.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * public record OrderPlaced(Instant timestamp, String orderId) implements Event {
 * }
 *
 * broker.subscribe(e -> ship((OrderPlaced) e), Set.of(OrderPlaced.class));
 * broker.publish(new OrderPlaced(Instant.now(), "order-1"));
 * }</pre>
 */
public interface Event {

    /**
     * Returns the time at which the event occurred.
     *
     * @return the event timestamp
     */
    Instant timestamp();

    /**
     * Returns the W3C trace parent of the publishing context, if the publisher
     * captured one.
     *
     * @return the trace parent, or {@code null} when the event is not traced
     */
    default String traceparent() {
        return null;
    }

    /**
     * Returns the name used for this event's type in logs and metrics.
     *
     * @return the simple name of the event class
     */
    default String eventType() {
        return getClass().getSimpleName();
    }
}
